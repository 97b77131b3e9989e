package dbkit.micrometer;

import dbkit.spi.RepositoryMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link RepositoryMetrics}.
 *
 * <p>Every meter is tagged with {@code entity}, the simple class name of the entity type.
 * Meters are registered lazily, the first time an entity type reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbkit.repository.created}: rows inserted</li>
 *   <li>{@code dbkit.repository.updated}: rows updated</li>
 *   <li>{@code dbkit.repository.deleted.soft}: rows marked deleted</li>
 *   <li>{@code dbkit.repository.deleted.hard}: rows physically removed</li>
 *   <li>{@code dbkit.repository.toggled}: deactivation toggles</li>
 *   <li>{@code dbkit.repository.not_found}: lookups that found no row</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code dbkit.repository.listed.rows}: rows returned per list call</li>
 * </ul>
 *
 * @see RepositoryMetrics
 */
public final class MicrometerRepositoryMetrics implements RepositoryMetrics, AutoCloseable {
  public static final String ENTITY_TAG = "entity";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "dbkit.repository"}.
   */
  public MicrometerRepositoryMetrics(MeterRegistry registry) {
    this(registry, "dbkit.repository");
  }

  /**
   * @param registry the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
   */
  public MicrometerRepositoryMetrics(MeterRegistry registry, String namePrefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementCreated(String entity) {
    increment("created", "Rows inserted", entity);
  }

  @Override
  public void incrementUpdated(String entity) {
    increment("updated", "Rows updated", entity);
  }

  @Override
  public void incrementSoftDeleted(String entity) {
    increment("deleted.soft", "Rows marked deleted", entity);
  }

  @Override
  public void incrementHardDeleted(String entity) {
    increment("deleted.hard", "Rows physically removed", entity);
  }

  @Override
  public void incrementToggled(String entity) {
    increment("toggled", "Deactivation toggles", entity);
  }

  @Override
  public void incrementNotFound(String entity) {
    increment("not_found", "Lookups by id or uuid that found no row", entity);
  }

  @Override
  public void recordListed(String entity, int rows) {
    if (closed) return;
    String name = namePrefix + ".listed.rows";
    DistributionSummary summary = (DistributionSummary) meters.computeIfAbsent(name + "|" + entity,
        key -> DistributionSummary.builder(name)
            .description("Rows returned per list call")
            .tag(ENTITY_TAG, entity)
            .register(registry));
    summary.record(rows);
  }

  private void increment(String suffix, String description, String entity) {
    if (closed) return;
    String name = namePrefix + "." + suffix;
    Counter counter = (Counter) meters.computeIfAbsent(name + "|" + entity,
        key -> Counter.builder(name)
            .description(description)
            .tag(ENTITY_TAG, entity)
            .register(registry));
    counter.increment();
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters.values()) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }
}
