package dbkit.jdbc;

import dbkit.error.DeactivationNotSupportedException;
import dbkit.error.EmptySessionException;
import dbkit.error.NoModelException;
import dbkit.error.NoPrimaryKeyException;
import dbkit.error.NoUuidSupportException;
import dbkit.error.NotFoundException;
import dbkit.jdbc.spi.Dialect;
import dbkit.model.Capabilities;
import dbkit.model.Column;
import dbkit.model.Deactivatable;
import dbkit.model.Entity;
import dbkit.model.EntityType;
import dbkit.model.Fields;
import dbkit.model.SoftDeletable;
import dbkit.model.Timestamped;
import dbkit.model.UuidIdentified;
import dbkit.model.Values;
import dbkit.repo.ListFilter;
import dbkit.repo.Page;
import dbkit.repo.Repository;
import dbkit.repo.Sort;
import dbkit.spi.RepositoryMetrics;
import dbkit.util.Ids;
import dbkit.util.Timestamps;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * JDBC {@link Repository} bound to one {@link JdbcSession} and one {@link EntityType}.
 *
 * <p>The repository never opens or closes its session; it commits it after every mutation.
 * Subclasses may fix the entity type:
 *
 * <pre>{@code
 * public final class WidgetRepository extends JdbcRepository<Widget> {
 *   public WidgetRepository(JdbcSession session) {
 *     super(session, Widget.TYPE);
 *   }
 * }
 * }</pre>
 *
 * @param <E> entity type
 */
public class JdbcRepository<E extends Entity> implements Repository<E> {
  private static final Logger logger = Logger.getLogger(JdbcRepository.class.getName());

  private static final Set<String> IMMUTABLE_ON_UPDATE =
      Set.of(Fields.ID, Fields.UUID, Fields.CREATED_AT, Fields.UPDATED_AT);

  private final JdbcSession session;
  private final EntityType<E> type;
  private final Capabilities capabilities;
  private final Dialect dialect;
  private final RepositoryMetrics metrics;
  private final Clock clock;
  private final String selectColumns;

  /**
   * @throws EmptySessionException if {@code session} is {@code null}
   * @throws NoModelException if {@code type} is {@code null}
   */
  public JdbcRepository(JdbcSession session, EntityType<E> type) {
    this(session, type, Clock.systemUTC());
  }

  public JdbcRepository(JdbcSession session, EntityType<E> type, Clock clock) {
    if (session == null) {
      throw new EmptySessionException(getClass().getSimpleName());
    }
    if (type == null) {
      throw new NoModelException(getClass().getSimpleName());
    }
    this.session = session;
    this.type = type;
    this.capabilities = type.capabilities();
    this.dialect = session.dialect();
    this.metrics = session.metrics();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.selectColumns = type.columns().stream().map(Column::name).collect(Collectors.joining(", "));
  }

  @Override
  public EntityType<E> entityType() {
    return type;
  }

  protected JdbcSession session() {
    return session;
  }

  @Override
  public E create(Map<String, ?> payload) {
    Objects.requireNonNull(payload, "payload");
    logger.log(Level.FINE, "Creating {0} from {1}", new Object[]{type.name(), payload.keySet()});
    E entity = type.newInstance();
    for (Map.Entry<String, ?> entry : payload.entrySet()) {
      if (Fields.ID.equals(entry.getKey())) {
        logger.log(Level.FINE, "Ignoring id in create payload for {0}", type.name());
        continue;
      }
      applyKnown(entity, entry.getKey(), entry.getValue());
    }
    if (capabilities.supportsUuid() && ((UuidIdentified) entity).getUuid() == null) {
      ((UuidIdentified) entity).setUuid(Ids.newUuid());
    }
    if (capabilities.supportsTimestamps()) {
      Timestamped ts = (Timestamped) entity;
      if (ts.getCreatedAt() == null) {
        ts.setCreatedAt(Timestamps.now(clock));
      }
      if (ts.getUpdatedAt() == null) {
        ts.setUpdatedAt(ts.getCreatedAt());
      }
    }

    List<String> names = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (Column<E, ?> column : type.columns()) {
      if (Fields.ID.equals(column.name())) {
        continue;
      }
      names.add(column.name());
      params.add(dialect.toJdbcValue(column.get(entity)));
    }
    String sql = "INSERT INTO " + type.tableName() + " (" + String.join(", ", names) + ") VALUES ("
        + names.stream().map(n -> "?").collect(Collectors.joining(", ")) + ")";
    long id = session.insert(sql, params.toArray());
    session.commit();
    metrics.incrementCreated(type.name());
    logger.log(Level.INFO, "Created {0} id={1}", new Object[]{type.name(), id});
    return get(id);
  }

  @Override
  public E get(long id) {
    return find(id).orElseThrow(() -> notFound(Fields.ID, id));
  }

  @Override
  public Optional<E> find(long id) {
    return selectOne(Fields.ID, id);
  }

  @Override
  public E getByUuid(UUID uuid) {
    requireUuidSupport();
    return findByUuid(uuid).orElseThrow(() -> notFound(Fields.UUID, uuid));
  }

  @Override
  public Optional<E> findByUuid(UUID uuid) {
    requireUuidSupport();
    Objects.requireNonNull(uuid, "uuid");
    return selectOne(Fields.UUID, dialect.toJdbcValue(uuid));
  }

  @Override
  public E update(Map<String, ?> payload) {
    Objects.requireNonNull(payload, "payload");
    Object id = payload.get(Fields.ID);
    Object uuid = payload.get(Fields.UUID);
    if (id == null && uuid == null) {
      throw new NoPrimaryKeyException(type.name());
    }
    logger.log(Level.FINE, "Updating {0} from {1}", new Object[]{type.name(), payload.keySet()});
    E entity = id != null ? get(Values.coerce(Long.class, id)) : getByUuid(Values.coerce(UUID.class, uuid));

    Map<String, Object> changes = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : payload.entrySet()) {
      if (IMMUTABLE_ON_UPDATE.contains(entry.getKey())) {
        continue;
      }
      Optional<Column<E, ?>> column = applyKnown(entity, entry.getKey(), entry.getValue());
      column.ifPresent(c -> changes.put(c.name(), c.get(entity)));
    }
    if (capabilities.supportsTimestamps()) {
      changes.put(Fields.UPDATED_AT, nextUpdatedAt(entity));
    }
    if (changes.isEmpty()) {
      logger.log(Level.FINE, "Nothing to update on {0} id={1}", new Object[]{type.name(), entity.getId()});
      return entity;
    }
    updateColumns(entity.getId(), changes);
    session.commit();
    metrics.incrementUpdated(type.name());
    logger.log(Level.INFO, "Updated {0} id={1} columns={2}",
        new Object[]{type.name(), entity.getId(), changes.keySet()});
    return get(entity.getId());
  }

  @Override
  public boolean delete(long id) {
    E entity = get(id);
    if (capabilities.supportsSoftDelete() && !((SoftDeletable) entity).isDeleted()) {
      Instant now = capabilities.supportsTimestamps() ? nextUpdatedAt(entity) : Timestamps.now(clock);
      Map<String, Object> changes = new LinkedHashMap<>();
      changes.put(Fields.DELETED_AT, now);
      if (capabilities.supportsTimestamps()) {
        changes.put(Fields.UPDATED_AT, now);
      }
      updateColumns(id, changes);
      session.commit();
      metrics.incrementSoftDeleted(type.name());
      logger.log(Level.INFO, "Soft-deleted {0} id={1}", new Object[]{type.name(), id});
      return true;
    }
    if (capabilities.supportsSoftDelete()) {
      // TODO: replace this escalation with an explicit purge operation once callers stop relying on it
      logger.log(Level.WARNING, "Permanently deleting already soft-deleted {0} id={1}",
          new Object[]{type.name(), id});
    }
    session.update("DELETE FROM " + type.tableName() + " WHERE " + Fields.ID + " = ?", id);
    session.commit();
    metrics.incrementHardDeleted(type.name());
    logger.log(Level.INFO, "Deleted {0} id={1}", new Object[]{type.name(), id});
    return true;
  }

  @Override
  public boolean deleteByUuid(UUID uuid) {
    return delete(getByUuid(uuid).getId());
  }

  @Override
  public E toggleDeactivate(long id) {
    if (!capabilities.supportsDeactivation()) {
      throw new DeactivationNotSupportedException(type.name());
    }
    E entity = get(id);
    Instant now = capabilities.supportsTimestamps() ? nextUpdatedAt(entity) : Timestamps.now(clock);
    boolean deactivating = !((Deactivatable) entity).isDeactivated();
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put(Fields.DEACTIVATED_AT, deactivating ? now : null);
    if (capabilities.supportsTimestamps()) {
      changes.put(Fields.UPDATED_AT, now);
    }
    updateColumns(id, changes);
    session.commit();
    metrics.incrementToggled(type.name());
    logger.log(Level.INFO, "{0} {1} id={2}",
        new Object[]{deactivating ? "Deactivated" : "Reactivated", type.name(), id});
    return get(id);
  }

  @Override
  public List<E> list(ListFilter filter, Page page, Sort sort) {
    ListFilter f = filter == null ? ListFilter.none() : filter;
    Page p = page == null ? Page.defaults() : page;
    String orderBy = null;
    if (sort != null) {
      Column<E, ?> column = type.column(sort.column()).orElseThrow(() -> new IllegalArgumentException(
          "Unknown sort column " + sort.column() + " for " + type.name()));
      orderBy = column.name() + " " + sort.direction().name();
    }

    List<String> conditions = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    if (capabilities.supportsSoftDelete()) {
      if (f.onlyDeleted()) {
        conditions.add(Fields.DELETED_AT + " IS NOT NULL");
      } else if (!f.withDeleted()) {
        conditions.add(Fields.DELETED_AT + " IS NULL");
      }
    }
    if (capabilities.supportsDeactivation()) {
      if (f.onlyDeactivated()) {
        conditions.add(Fields.DEACTIVATED_AT + " IS NOT NULL");
      } else if (!f.withDeactivated()) {
        conditions.add(Fields.DEACTIVATED_AT + " IS NULL");
      }
    }
    if (!f.ids().isEmpty()) {
      conditions.add(Fields.ID + " IN (" + placeholders(f.ids().size()) + ")");
      params.addAll(f.ids());
    }
    if (capabilities.supportsUuid() && !f.uuids().isEmpty()) {
      conditions.add(Fields.UUID + " IN (" + placeholders(f.uuids().size()) + ")");
      f.uuids().forEach(u -> params.add(dialect.toJdbcValue(u)));
    }

    StringBuilder sql = new StringBuilder("SELECT ").append(selectColumns).append(" FROM ").append(type.tableName());
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    if (orderBy != null) {
      sql.append(" ORDER BY ").append(orderBy);
    }
    sql.append(' ').append(dialect.limitOffsetClause());
    params.add(p.limit());
    params.add(p.offset());

    logger.log(Level.FINE, "Listing {0} with {1}, {2}, {3}", new Object[]{type.name(), f, p, sort});
    List<E> rows = session.query(sql.toString(), this::mapRow, params.toArray());
    metrics.recordListed(type.name(), rows.size());
    return rows;
  }

  private Optional<E> selectOne(String column, Object value) {
    String sql = "SELECT " + selectColumns + " FROM " + type.tableName() + " WHERE " + column + " = ?";
    List<E> rows = session.query(sql, this::mapRow, value);
    return rows.stream().findFirst();
  }

  private E mapRow(ResultSet rs) throws SQLException {
    E entity = type.newInstance();
    for (Column<E, ?> column : type.columns()) {
      column.set(entity, dialect.readValue(rs, column.name(), column.type()));
    }
    return entity;
  }

  private void updateColumns(long id, Map<String, Object> changes) {
    List<String> assignments = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (Map.Entry<String, Object> change : changes.entrySet()) {
      assignments.add(change.getKey() + " = ?");
      params.add(dialect.toJdbcValue(change.getValue()));
    }
    params.add(id);
    session.update("UPDATE " + type.tableName() + " SET " + String.join(", ", assignments)
        + " WHERE " + Fields.ID + " = ?", params.toArray());
  }

  private Optional<Column<E, ?>> applyKnown(E entity, String key, Object value) {
    Optional<Column<E, ?>> column = type.column(key);
    if (column.isEmpty()) {
      logger.log(Level.FINE, "Ignoring unknown field {0} for {1}", new Object[]{key, type.name()});
      return Optional.empty();
    }
    column.get().set(entity, value);
    return column;
  }

  private Instant nextUpdatedAt(E entity) {
    Instant updatedAt = ((Timestamped) entity).getUpdatedAt();
    Instant now = Timestamps.after(updatedAt, clock);
    ((Timestamped) entity).setUpdatedAt(now);
    return now;
  }

  private void requireUuidSupport() {
    if (!capabilities.supportsUuid()) {
      throw new NoUuidSupportException(type.name());
    }
  }

  private NotFoundException notFound(String field, Object value) {
    metrics.incrementNotFound(type.name());
    return new NotFoundException(type.name(), field, value);
  }

  private static String placeholders(int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }
}
