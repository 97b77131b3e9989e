package dbkit.repo;

import dbkit.error.DeactivationNotSupportedException;
import dbkit.error.NoPrimaryKeyException;
import dbkit.error.NoUuidSupportException;
import dbkit.error.NotFoundException;
import dbkit.model.Entity;
import dbkit.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD and query facade bound to one session and one entity type.
 *
 * <p>Every mutating operation commits the bound session and returns the entity as re-read
 * from the store. Payload maps are applied through the entity type's column list; unknown keys
 * are ignored.
 *
 * @param <E> entity type
 */
public interface Repository<E extends Entity> {

  EntityType<E> entityType();

  /**
   * Inserts a new row.
   *
   * <p>Any {@code id} in the payload is ignored. A uuid and the creation timestamps are generated
   * when the entity type supports them and the payload does not supply them.
   *
   * @param payload column values keyed by column name
   * @return the persisted entity
   */
  E create(Map<String, ?> payload);

  /**
   * @throws NotFoundException if no row has this id
   */
  E get(long id);

  Optional<E> find(long id);

  /**
   * @throws NoUuidSupportException if the entity type has no uuid column
   * @throws NotFoundException if no row has this uuid
   */
  E getByUuid(UUID uuid);

  /**
   * @throws NoUuidSupportException if the entity type has no uuid column
   */
  Optional<E> findByUuid(UUID uuid);

  /**
   * Applies the payload to the row identified by its {@code id}, or by {@code uuid} when no id
   * is given. {@code id}, {@code uuid} and {@code created_at} are never changed; {@code updated_at}
   * is always set by the repository.
   *
   * @throws NoPrimaryKeyException if the payload has neither a non-null id nor a non-null uuid
   * @throws NotFoundException if the row does not exist
   */
  E update(Map<String, ?> payload);

  /**
   * Soft-deletes the row if the entity type supports it and the row is not yet soft-deleted;
   * otherwise removes it physically.
   *
   * @return {@code true}
   * @throws NotFoundException if the row does not exist
   */
  boolean delete(long id);

  /**
   * Resolves the row by uuid, then behaves as {@link #delete(long)}.
   */
  boolean deleteByUuid(UUID uuid);

  /**
   * Flips {@code deactivated_at} between {@code null} and the current time.
   *
   * @return the refreshed entity
   * @throws DeactivationNotSupportedException if the entity type has no deactivation column
   * @throws NotFoundException if the row does not exist
   */
  E toggleDeactivate(long id);

  default List<E> list() {
    return list(ListFilter.none(), Page.defaults(), null);
  }

  default List<E> list(ListFilter filter) {
    return list(filter, Page.defaults(), null);
  }

  /**
   * Lists rows visible under {@code filter}, ordered by {@code sort} (unspecified order when
   * {@code null}), windowed by {@code page}.
   *
   * @throws IllegalArgumentException if the sort column is unknown
   */
  List<E> list(ListFilter filter, Page page, Sort sort);
}
