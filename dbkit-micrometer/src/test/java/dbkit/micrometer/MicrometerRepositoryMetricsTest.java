package dbkit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerRepositoryMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerRepositoryMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerRepositoryMetrics(registry);
  }

  @Test
  void countersAreTaggedByEntity() {
    metrics.incrementCreated("Widget");
    metrics.incrementCreated("Widget");
    metrics.incrementCreated("Log");

    assertEquals(2.0, counter("dbkit.repository.created", "Widget").count());
    assertEquals(1.0, counter("dbkit.repository.created", "Log").count());
  }

  @Test
  void eachOperationHasItsOwnCounter() {
    metrics.incrementUpdated("Widget");
    metrics.incrementSoftDeleted("Widget");
    metrics.incrementHardDeleted("Widget");
    metrics.incrementToggled("Widget");
    metrics.incrementNotFound("Widget");

    assertEquals(1.0, counter("dbkit.repository.updated", "Widget").count());
    assertEquals(1.0, counter("dbkit.repository.deleted.soft", "Widget").count());
    assertEquals(1.0, counter("dbkit.repository.deleted.hard", "Widget").count());
    assertEquals(1.0, counter("dbkit.repository.toggled", "Widget").count());
    assertEquals(1.0, counter("dbkit.repository.not_found", "Widget").count());
  }

  @Test
  void recordListed() {
    metrics.recordListed("Widget", 3);
    metrics.recordListed("Widget", 5);

    DistributionSummary summary = registry.find("dbkit.repository.listed.rows")
        .tag(MicrometerRepositoryMetrics.ENTITY_TAG, "Widget").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(8.0, summary.totalAmount());
  }

  @Test
  void customPrefix() {
    MicrometerRepositoryMetrics custom = new MicrometerRepositoryMetrics(registry, "orders.db");
    custom.incrementCreated("Order");

    assertEquals(1.0, counter("orders.db.created", "Order").count());
    assertNull(registry.find("dbkit.repository.created").counter());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerRepositoryMetrics(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerRepositoryMetrics(registry, "db."));
    assertThrows(NullPointerException.class, () -> new MicrometerRepositoryMetrics(null));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    metrics.incrementCreated("Widget");
    metrics.recordListed("Widget", 1);
    assertFalse(registry.getMeters().isEmpty());

    metrics.close();
    assertTrue(registry.getMeters().isEmpty());

    metrics.incrementCreated("Widget");
    assertNull(registry.find("dbkit.repository.created").counter());
  }

  private Counter counter(String name, String entity) {
    Counter counter = registry.find(name).tag(MicrometerRepositoryMetrics.ENTITY_TAG, entity).counter();
    assertNotNull(counter, "counter " + name + " for " + entity);
    return counter;
  }
}
