package works.tally;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import works.tally.exceptions.ItemTooLargeException;
import works.tally.exceptions.TypeCastException;
import works.tally.store.InMemoryItemStore;
import works.tally.store.ItemKey;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.tally.Address.CITY;
import static works.tally.Address.CONFIG;
import static works.tally.Address.DELIVERABLE;
import static works.tally.Address.LOCK_VERSION;
import static works.tally.Address.OPTIONS;
import static works.tally.DocumentClass.UPDATED_AT;

class DocumentRepositoryTest {
	static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
	static final Instant LATER = Instant.parse("2024-03-01T13:00:00Z");

	DocumentClass<Address> addresses;
	InMemoryItemStore store;
	DocumentRepository repository;
	TallyConfig originalConfig;

	@BeforeEach
	void setup() {
		originalConfig = TallyConfig.global();
		useClock(NOW);
		addresses = Address.define();
		store = new InMemoryItemStore();
		repository = new DocumentRepository(store);
	}

	@AfterEach
	void restoreConfig() {
		TallyConfig.setGlobal(originalConfig);
		DocumentClass.resetDeprecationWarnings();
	}

	@Test
	@SuppressWarnings("deprecation")
	void floatField_warnsAndRoundTrips() {
		Logger logger = (Logger) LoggerFactory.getLogger(DocumentClass.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		try {
			DocumentClass.resetDeprecationWarnings();
			addresses.field("longitude", FieldType.FLOAT);
		} finally {
			logger.detachAppender(appender);
		}
		assertThat(appender.list.get(0).getFormattedMessage(), containsString("deprecated"));

		Address address = repository.create(addresses, Map.of("longitude", 5.33));
		assertEquals(new BigDecimal("5.33"), repository.reload(address).get("longitude"));
	}

	@Test
	void updateAttribute_castsAndSaves() {
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		repository.updateAttribute(address, LOCK_VERSION, "101");
		assertEquals(101L, address.get(LOCK_VERSION));
		assertFalse(address.isChanged());

		Map<String, Object> stored = store.getItem(addresses.tableName(), ItemKey.of(address.id())).orElseThrow();
		assertEquals(101L, stored.get(LOCK_VERSION));
	}

	@Test
	void updateAttributes_setsTimestamp() {
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		useClock(LATER);
		repository.updateAttributes(address, Map.of(CITY, "Springfield", DELIVERABLE, true));

		Address reloaded = repository.reload(address);
		assertEquals("Springfield", reloaded.city());
		assertEquals(true, reloaded.get(DELIVERABLE));
		assertEquals(NOW, reloaded.createdAt());
		assertEquals(LATER, reloaded.updatedAt());
	}

	@Test
	void updateAttributes_explicitUpdatedAtWins() {
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		Instant explicit = Instant.parse("2019-06-01T00:00:00Z");
		useClock(LATER);
		repository.updateAttributes(address, Map.of(CITY, "Springfield", UPDATED_AT, explicit));
		assertEquals(explicit, repository.reload(address).updatedAt());
	}

	@Test
	void timestampsOff_neverPopulated() {
		TallyConfig.setGlobal(TallyConfig.global().toBuilder().timestamps(false).build());
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		repository.updateAttribute(address, CITY, "Springfield");
		assertNull(address.createdAt());
		assertNull(repository.reload(address).updatedAt());
	}

	@Test
	void updateAttribute_rejectedValue_nothingSaved() {
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		assertThrows(TypeCastException.class,
			() -> repository.updateAttribute(address, LOCK_VERSION, "not a number"));
		assertNull(repository.reload(address).get(LOCK_VERSION));
	}

	@Test
	void serializedAndRawFields_survive() {
		Address address = repository.create(addresses, Map.of(
			OPTIONS, Map.of("floor", 3L),
			CONFIG, Map.of("nested", "raw")));
		Address found = repository.find(addresses, address.id()).orElseThrow();
		assertEquals(Map.of("floor", 3L), found.get(OPTIONS));
		assertEquals(Map.of("nested", "raw"), found.get(CONFIG));

		Map<String, Object> stored = store.getItem(addresses.tableName(), ItemKey.of(address.id())).orElseThrow();
		assertEquals("{\"floor\":3}", stored.get(OPTIONS));
	}

	@Test
	void itemTooLarge_propagates() {
		Address address = addresses.newInstance(Map.of(CITY, "x".repeat(401 * 1024)));
		ItemTooLargeException e = assertThrows(ItemTooLargeException.class, () -> repository.save(address));
		assertEquals("Item size has exceeded the maximum allowed size", e.getMessage());
		assertEquals(0, store.size(addresses.tableName()));
	}

	@Test
	void save_previousChangesRecorded() {
		Address address = repository.create(addresses, Map.of(CITY, "Chicago"));
		assertThat(address.previousChanges().keySet(), hasItem(CITY));
		address.set(CITY, "Springfield");
		repository.save(address);
		assertEquals(new Change("Chicago", "Springfield"), address.previousChanges().get(CITY));
	}

	private static void useClock(Instant now) {
		TallyConfig.setGlobal(TallyConfig.global().toBuilder()
			.clock(Clock.fixed(now, ZoneOffset.UTC))
			.build());
	}
}
