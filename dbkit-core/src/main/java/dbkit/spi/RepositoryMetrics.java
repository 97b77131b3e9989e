package dbkit.spi;

/**
 * Observability hook counting repository operations per entity type.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code entity} is the simple class name
 * of the entity type.
 */
public interface RepositoryMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  RepositoryMetrics NOOP = new Noop();

  void incrementCreated(String entity);

  void incrementUpdated(String entity);

  void incrementSoftDeleted(String entity);

  void incrementHardDeleted(String entity);

  /**
   * Increments the count of deactivation toggles, in either direction.
   */
  void incrementToggled(String entity);

  /**
   * Increments the count of lookups by id or uuid that found no row.
   */
  default void incrementNotFound(String entity) {
  }

  /**
   * Records one list call and the number of rows it returned.
   */
  default void recordListed(String entity, int rows) {
  }

  final class Noop implements RepositoryMetrics {
    @Override
    public void incrementCreated(String entity) {
    }

    @Override
    public void incrementUpdated(String entity) {
    }

    @Override
    public void incrementSoftDeleted(String entity) {
    }

    @Override
    public void incrementHardDeleted(String entity) {
    }

    @Override
    public void incrementToggled(String entity) {
    }
  }
}
