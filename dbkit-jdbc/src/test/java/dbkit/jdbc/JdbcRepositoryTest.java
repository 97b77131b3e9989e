package dbkit.jdbc;

import dbkit.error.DeactivationNotSupportedException;
import dbkit.error.EmptySessionException;
import dbkit.error.ErrorKind;
import dbkit.error.NoModelException;
import dbkit.error.NoPrimaryKeyException;
import dbkit.error.NoUuidSupportException;
import dbkit.error.NotFoundException;
import dbkit.model.BaseEntity;
import dbkit.model.Entity;
import dbkit.model.EntityType;
import dbkit.repo.ListFilter;
import dbkit.repo.Page;
import dbkit.repo.Sort;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRepositoryTest {
  private DatabaseConnectionManager manager;
  private JdbcSession session;
  private JdbcRepository<Widget> widgets;
  private JdbcRepository<Log> logs;
  private JdbcRepository<Account> accounts;

  @BeforeEach
  void setUp() {
    manager = new DatabaseConnectionManager();
    manager.init(TestSchema.h2Settings());
    TestSchema.create(manager);
    session = manager.getSession();
    widgets = new JdbcRepository<>(session, Widget.TYPE);
    logs = new JdbcRepository<>(session, Log.TYPE);
    accounts = new JdbcRepository<>(session, Account.TYPE);
  }

  @AfterEach
  void tearDown() {
    session.close();
    manager.close();
  }

  @Test
  void widgetLifecycle() {
    Widget created = widgets.create(Map.of("name", "a"));
    assertEquals(1L, created.getId());
    assertNotNull(created.getUuid());
    assertNotNull(created.getCreatedAt());
    assertEquals(created.getCreatedAt(), created.getUpdatedAt());
    assertTrue(created.isCreated());

    Widget updated = widgets.update(Map.of("id", 1L, "name", "b"));
    assertEquals("b", updated.getName());
    assertTrue(updated.getUpdatedAt().isAfter(updated.getCreatedAt()));
    assertFalse(updated.isCreated());

    assertTrue(widgets.delete(1L));
    Widget deleted = widgets.get(1L);
    assertNotNull(deleted.getDeletedAt());
    assertTrue(deleted.isDeleted());

    assertTrue(widgets.list().isEmpty());
    List<Widget> withDeleted = widgets.list(ListFilter.builder().withDeleted(true).build());
    assertEquals(List.of(1L), ids(withDeleted));
  }

  @Test
  void logLifecycle() {
    Log created = logs.create(Map.of("msg", "x"));
    assertEquals("x", created.getMsg());

    assertTrue(logs.delete(created.getId()));
    assertThrows(NotFoundException.class, () -> logs.get(created.getId()));

    assertThrows(NoUuidSupportException.class, () -> logs.getByUuid(UUID.randomUUID()));
    assertThrows(NoUuidSupportException.class, () -> logs.findByUuid(UUID.randomUUID()));
    assertThrows(DeactivationNotSupportedException.class, () -> logs.toggleDeactivate(created.getId()));
  }

  @Test
  void unsupportedCapabilityIsReportedBeforeLookup() {
    // no row 42 exists, the capability error still wins
    assertThrows(DeactivationNotSupportedException.class, () -> widgets.toggleDeactivate(42L));
    assertThrows(NoUuidSupportException.class, () -> logs.getByUuid(UUID.randomUUID()));
  }

  @Test
  void createRoundTripsAllColumns() {
    Widget created = widgets.create(Map.of("name", "gear", "price", new BigDecimal("9.99"), "quantity", 5L));
    Widget loaded = widgets.get(created.getId());

    assertEquals("gear", loaded.getName());
    assertEquals(new BigDecimal("9.99"), loaded.getPrice());
    assertEquals(Integer.valueOf(5), loaded.getQuantity());
    assertEquals(created.getUuid(), loaded.getUuid());
    assertEquals(created.getCreatedAt(), loaded.getCreatedAt());
    assertEquals(created.getUpdatedAt(), loaded.getUpdatedAt());
    assertNull(loaded.getDeletedAt());
  }

  @Test
  void createRoundTripsEnumDateAndBoolean() {
    Account created = accounts.create(Map.of(
        "email", "a@example.com", "tier", "PRO", "birthday", "1990-01-02", "verified", true));

    Account loaded = accounts.get(created.getId());
    assertEquals(Account.Tier.PRO, loaded.getTier());
    assertEquals(LocalDate.of(1990, 1, 2), loaded.getBirthday());
    assertEquals(Boolean.TRUE, loaded.getVerified());
    assertNull(loaded.getDeactivatedAt());
  }

  @Test
  void createIgnoresUnknownKeysAndSuppliedId() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("id", 99L);
    payload.put("name", "x");
    payload.put("colour", "red");

    Widget created = widgets.create(payload);
    assertEquals(1L, created.getId());
    assertThrows(NotFoundException.class, () -> widgets.get(99L));
  }

  @Test
  void createKeepsSuppliedUuidAndTimestamps() {
    UUID uuid = UUID.randomUUID();
    Instant createdAt = Instant.parse("2024-03-01T10:15:30.123456789Z");

    Widget created = widgets.create(Map.of("name", "x", "uuid", uuid.toString(), "created_at", createdAt));
    assertEquals(uuid, created.getUuid());
    assertEquals(Instant.parse("2024-03-01T10:15:30.123456Z"), created.getCreatedAt());
    assertEquals(created.getCreatedAt(), created.getUpdatedAt());
  }

  @Test
  void createRejectsLossyValues() {
    assertThrows(IllegalArgumentException.class,
        () -> widgets.create(Map.of("name", "x", "quantity", Long.MAX_VALUE)));
    assertThrows(IllegalArgumentException.class,
        () -> widgets.create(Map.of("name", "x", "quantity", "five")));
    assertTrue(widgets.list(ListFilter.builder().withDeleted(true).build()).isEmpty());
  }

  @Test
  void storageFailuresAreWrapped() {
    StorageException e = assertThrows(StorageException.class, () -> widgets.create(Map.of("price", BigDecimal.ONE)));
    assertNotNull(e.getCause());
    assertNotNull(e.sqlState());
  }

  @Test
  void getMissingRow() {
    NotFoundException e = assertThrows(NotFoundException.class, () -> widgets.get(7L));
    assertEquals(ErrorKind.NOT_FOUND, e.kind());
    assertEquals(404, e.statusCode());
    assertTrue(widgets.find(7L).isEmpty());
  }

  @Test
  void lookupByUuid() {
    Widget created = widgets.create(Map.of("name", "u"));

    assertEquals(created.getId(), widgets.getByUuid(created.getUuid()).getId());
    assertEquals(created.getId(), widgets.findByUuid(created.getUuid()).orElseThrow().getId());
    assertTrue(widgets.findByUuid(UUID.randomUUID()).isEmpty());
    assertThrows(NotFoundException.class, () -> widgets.getByUuid(UUID.randomUUID()));
  }

  @Test
  void updateWithoutKeyFailsForEveryEntityType() {
    for (JdbcRepository<?> repository : List.of(widgets, logs, accounts)) {
      NoPrimaryKeyException e = assertThrows(NoPrimaryKeyException.class,
          () -> repository.update(Map.of("name", "x")));
      assertEquals(400, e.statusCode());
    }
    Map<String, Object> nullKeys = new HashMap<>();
    nullKeys.put("id", null);
    nullKeys.put("uuid", null);
    assertThrows(NoPrimaryKeyException.class, () -> widgets.update(nullKeys));
  }

  @Test
  void updateByUuid() {
    Widget created = widgets.create(Map.of("name", "a"));
    Widget updated = widgets.update(Map.of("uuid", created.getUuid(), "name", "z"));

    assertEquals(created.getId(), updated.getId());
    assertEquals("z", updated.getName());
  }

  @Test
  void updateLeavesImmutableColumnsAlone() {
    Widget created = widgets.create(Map.of("name", "a"));
    Instant epoch = Instant.EPOCH;

    Widget updated = widgets.update(Map.of(
        "id", created.getId(),
        "uuid", UUID.randomUUID(),
        "created_at", epoch,
        "updated_at", epoch,
        "quantity", 3,
        "unknown", "ignored"));

    assertEquals(created.getUuid(), updated.getUuid());
    assertEquals(created.getCreatedAt(), updated.getCreatedAt());
    assertTrue(updated.getUpdatedAt().isAfter(created.getUpdatedAt()));
    assertEquals(Integer.valueOf(3), updated.getQuantity());
    assertEquals("a", updated.getName());
  }

  @Test
  void updateIdTakesPrecedenceOverUuid() {
    Widget first = widgets.create(Map.of("name", "first"));
    Widget second = widgets.create(Map.of("name", "second"));

    widgets.update(Map.of("id", first.getId(), "uuid", second.getUuid(), "name", "changed"));

    assertEquals("changed", widgets.get(first.getId()).getName());
    assertEquals("second", widgets.get(second.getId()).getName());
  }

  @Test
  void updateMissingRow() {
    assertThrows(NotFoundException.class, () -> widgets.update(Map.of("id", 5L, "name", "x")));
    assertThrows(NotFoundException.class, () -> logs.update(Map.of("id", 5, "msg", "x")));
  }

  @Test
  void updateWithoutTimestampsOnlyWritesPayload() {
    Log created = logs.create(Map.of("msg", "a"));
    Log updated = logs.update(Map.of("id", created.getId(), "msg", "b"));
    assertEquals("b", updated.getMsg());

    Log untouched = logs.update(Map.of("id", created.getId()));
    assertEquals("b", untouched.getMsg());
  }

  @Test
  void updatedAtStrictlyIncreasesWithStoppedClock() {
    Clock stopped = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    JdbcRepository<Widget> repository = new JdbcRepository<>(session, Widget.TYPE, stopped);

    Widget created = repository.create(Map.of("name", "a"));
    Widget first = repository.update(Map.of("id", created.getId(), "name", "b"));
    Widget second = repository.update(Map.of("id", created.getId(), "name", "c"));

    assertEquals(Instant.parse("2025-01-01T00:00:00Z"), created.getCreatedAt());
    assertEquals(Instant.parse("2025-01-01T00:00:00.000001Z"), first.getUpdatedAt());
    assertEquals(Instant.parse("2025-01-01T00:00:00.000002Z"), second.getUpdatedAt());
  }

  @Test
  void timestampsAreStoredAsUtcWhateverTheDefaultZone() throws SQLException {
    TimeZone original = TimeZone.getDefault();
    TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
    try {
      // 05:30Z and 06:10Z fall either side of the New York fall-back transition
      Instant createdAt = Instant.parse("2024-11-03T05:30:00Z");
      Instant updatedAt = Instant.parse("2024-11-03T06:10:00Z");
      Widget created = new JdbcRepository<>(session, Widget.TYPE, Clock.fixed(createdAt, ZoneOffset.UTC))
          .create(Map.of("name", "dst"));
      Widget updated = new JdbcRepository<>(session, Widget.TYPE, Clock.fixed(updatedAt, ZoneOffset.UTC))
          .update(Map.of("id", created.getId(), "name", "dst2"));

      assertEquals(createdAt, updated.getCreatedAt());
      assertEquals(updatedAt, updated.getUpdatedAt());
      assertTrue(updated.getUpdatedAt().isAfter(updated.getCreatedAt()));

      try (Statement st = session.connection().createStatement();
           ResultSet rs = st.executeQuery("SELECT created_at FROM widget WHERE id = " + created.getId())) {
        assertTrue(rs.next());
        assertEquals(LocalDateTime.of(2024, 11, 3, 5, 30), rs.getObject(1, LocalDateTime.class));
      }
    } finally {
      TimeZone.setDefault(original);
    }
  }

  @Test
  void secondDeleteRemovesSoftDeletedRow() {
    Widget created = widgets.create(Map.of("name", "a"));

    assertTrue(widgets.delete(created.getId()));
    assertNotNull(widgets.get(created.getId()).getDeletedAt());

    assertTrue(widgets.delete(created.getId()));
    assertThrows(NotFoundException.class, () -> widgets.get(created.getId()));
  }

  @Test
  void softDeleteTouchesUpdatedAt() {
    Widget created = widgets.create(Map.of("name", "a"));
    widgets.delete(created.getId());

    Widget deleted = widgets.get(created.getId());
    assertTrue(deleted.getUpdatedAt().isAfter(created.getUpdatedAt()));
    assertEquals(deleted.getDeletedAt(), deleted.getUpdatedAt());
  }

  @Test
  void deleteMissingRow() {
    assertThrows(NotFoundException.class, () -> widgets.delete(3L));
    assertThrows(NotFoundException.class, () -> logs.delete(3L));
  }

  @Test
  void deleteByUuid() {
    Widget created = widgets.create(Map.of("name", "a"));

    assertTrue(widgets.deleteByUuid(created.getUuid()));
    assertTrue(widgets.get(created.getId()).isDeleted());
    assertThrows(NotFoundException.class, () -> widgets.deleteByUuid(UUID.randomUUID()));
    assertThrows(NoUuidSupportException.class, () -> logs.deleteByUuid(UUID.randomUUID()));
  }

  @Test
  void toggleDeactivateIsItsOwnInverse() {
    Account created = accounts.create(Map.of("email", "a@example.com"));
    assertNull(created.getDeactivatedAt());

    Account deactivated = accounts.toggleDeactivate(created.getId());
    assertNotNull(deactivated.getDeactivatedAt());
    assertTrue(deactivated.isDeactivated());
    assertTrue(deactivated.getUpdatedAt().isAfter(created.getUpdatedAt()));

    Account reactivated = accounts.toggleDeactivate(created.getId());
    assertNull(reactivated.getDeactivatedAt());
    assertTrue(reactivated.getUpdatedAt().isAfter(deactivated.getUpdatedAt()));
  }

  @Test
  void toggleMissingRow() {
    assertThrows(NotFoundException.class, () -> accounts.toggleDeactivate(11L));
  }

  @Test
  void onlyDeletedIsDisjointFromDefaultList() {
    List<Long> all = List.of(
        widgets.create(Map.of("name", "a")).getId(),
        widgets.create(Map.of("name", "b")).getId(),
        widgets.create(Map.of("name", "c")).getId(),
        widgets.create(Map.of("name", "d")).getId());
    widgets.delete(all.get(1));
    widgets.delete(all.get(3));

    Set<Long> deleted = Set.copyOf(ids(widgets.list(ListFilter.builder().onlyDeleted(true).build())));
    Set<Long> visible = Set.copyOf(ids(widgets.list()));

    assertEquals(Set.of(all.get(1), all.get(3)), deleted);
    assertEquals(Set.of(all.get(0), all.get(2)), visible);
    assertEquals(Set.copyOf(all),
        Set.copyOf(ids(widgets.list(ListFilter.builder().withDeleted(true).build()))));
    // onlyDeleted wins over withDeleted
    assertEquals(deleted, Set.copyOf(ids(widgets.list(
        ListFilter.builder().onlyDeleted(true).withDeleted(true).build()))));
  }

  @Test
  void deactivationFilters() {
    Account active = accounts.create(Map.of("email", "active@example.com"));
    Account inactive = accounts.create(Map.of("email", "inactive@example.com"));
    accounts.toggleDeactivate(inactive.getId());

    assertEquals(List.of(active.getId()), ids(accounts.list()));
    assertEquals(List.of(inactive.getId()),
        ids(accounts.list(ListFilter.builder().onlyDeactivated(true).build())));
    assertEquals(Set.of(active.getId(), inactive.getId()),
        Set.copyOf(ids(accounts.list(ListFilter.builder().withDeactivated(true).build()))));
  }

  @Test
  void idAndUuidFilters() {
    Widget a = widgets.create(Map.of("name", "a"));
    Widget b = widgets.create(Map.of("name", "b"));
    widgets.create(Map.of("name", "c"));

    assertEquals(Set.of(a.getId(), b.getId()),
        Set.copyOf(ids(widgets.list(ListFilter.builder().id(a.getId()).id(b.getId()).build()))));
    assertEquals(List.of(b.getId()), ids(widgets.list(ListFilter.builder().uuid(b.getUuid()).build())));
    assertEquals(3, widgets.list(ListFilter.builder().ids(List.of()).build()).size());
  }

  @Test
  void uuidFilterIgnoredWithoutUuidCapability() {
    logs.create(Map.of("msg", "a"));
    logs.create(Map.of("msg", "b"));

    assertEquals(2, logs.list(ListFilter.builder().uuid(UUID.randomUUID()).build()).size());
  }

  @Test
  void filtersFromMap() {
    Widget a = widgets.create(Map.of("name", "a"));
    Widget b = widgets.create(Map.of("name", "b"));
    widgets.delete(b.getId());

    List<Widget> listed = widgets.list(ListFilter.fromMap(Map.of("onlyDeleted", true, "page", 3)));
    assertEquals(List.of(b.getId()), ids(listed));

    List<Widget> byIds = widgets.list(ListFilter.fromMap(Map.of("ids", List.of(a.getId()), "with_deleted", true)));
    assertEquals(List.of(a.getId()), ids(byIds));
  }

  @Test
  void sortAndPage() {
    for (String name : List.of("c", "a", "e", "b", "d")) {
      widgets.create(Map.of("name", name));
    }

    List<String> asc = widgets.list(ListFilter.none(), Page.defaults(), Sort.asc("name")).stream()
        .map(Widget::getName).toList();
    assertEquals(List.of("a", "b", "c", "d", "e"), asc);

    List<String> window = widgets.list(ListFilter.none(), Page.of(2, 1), Sort.desc("name")).stream()
        .map(Widget::getName).toList();
    assertEquals(List.of("d", "c"), window);

    assertTrue(widgets.list(ListFilter.none(), Page.of(0, 0), null).isEmpty());
    assertTrue(widgets.list(ListFilter.none(), Page.of(10, 5), Sort.asc("id")).isEmpty());
  }

  @Test
  void unknownSortColumnIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> widgets.list(ListFilter.none(), Page.defaults(), Sort.asc("name; DROP TABLE widget")));
    assertThrows(IllegalArgumentException.class,
        () -> logs.list(ListFilter.none(), Page.defaults(), Sort.asc("created_at")));
  }

  @Test
  void defaultPageHoldsOneHundredRows() {
    for (int i = 0; i < 105; i++) {
      logs.create(Map.of("msg", "m" + i));
    }
    assertEquals(Page.DEFAULT_LIMIT, logs.list().size());
    assertEquals(5, logs.list(ListFilter.none(), Page.of(100, 100), null).size());
  }

  @Test
  void constructorPreconditions() {
    assertThrows(EmptySessionException.class, () -> new JdbcRepository<>(null, Widget.TYPE));
    assertThrows(NoModelException.class, () -> new JdbcRepository<Widget>(session, null));
  }

  @Test
  void subclassBindsEntityType() {
    WidgetRepository repository = new WidgetRepository(session);
    Widget created = repository.create(Map.of("name", "sub"));

    assertEquals(Widget.TYPE, repository.entityType());
    assertEquals("sub", repository.get(created.getId()).getName());
  }

  @Test
  void mutationsAreCommitted() {
    Widget created = widgets.create(Map.of("name", "a"));
    widgets.update(Map.of("id", created.getId(), "name", "b"));

    String name = manager.inSession(other -> new JdbcRepository<>(other, Widget.TYPE).get(created.getId()).getName());
    assertEquals("b", name);
  }

  @Test
  void tableNameDefaultsToSnakeCase() {
    EntityType<OrderLine> type = EntityType.builder(OrderLine.class, OrderLine::new).build();
    assertEquals("order_line", type.tableName());
  }

  static final class WidgetRepository extends JdbcRepository<Widget> {
    WidgetRepository(JdbcSession session) {
      super(session, Widget.TYPE);
    }
  }

  static final class OrderLine extends BaseEntity {
  }

  private static List<Long> ids(List<? extends Entity> entities) {
    return entities.stream().map(Entity::getId).collect(Collectors.toList());
  }
}
