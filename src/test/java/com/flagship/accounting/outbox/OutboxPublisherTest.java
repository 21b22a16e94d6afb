package com.flagship.accounting.outbox;

import com.flagship.accounting.event.JournalEntryPostedEvent;
import com.flagship.accounting.event.JournalEntryReversedEvent;
import com.flagship.accounting.ledger.Account;
import com.flagship.accounting.ledger.AccountSubType;
import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalService;
import com.flagship.accounting.support.LedgerFixtures;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Publisher against a real broker. The scheduled loop is slowed to once an hour
 * and each test drives a pass through {@link OutboxPublisher#triggerPublish()}.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    private static final String TOPIC = "accounting-events";
    private static final YearMonth NOVEMBER = YearMonth.of(2024, 11);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("accounting_publisher_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("kafka.topic.accounting-events", () -> TOPIC);
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private LedgerFixtures fixtures;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private KafkaConsumer<String, String> consumer;
    private Account cash;
    private Account sales;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE outbox_events, general_ledger, journal_entry_lines, journal_entries, "
            + "document_sequences, financial_periods, accounts CASCADE");
        fixtures.openMonth(NOVEMBER);
        cash = fixtures.leaf(AccountSubType.CASH);
        sales = fixtures.leaf(AccountSubType.SALES_REVENUE);

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(TOPIC));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private List<ConsumerRecord<String, String>> pollFor(String key, int expected) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 30_000;
        while (matching.size() < expected && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            });
        }
        return matching;
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Posted entry reaches the topic keyed by its id and is marked published")
    void testPublish_SendsPostedEvent() {
        JournalEntry entry = fixtures.post(NOVEMBER.atDay(5), cash, sales, "99.00");

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = pollFor(entry.getId().toString(), 1);
        assertEquals(1, records.size());
        ConsumerRecord<String, String> record = records.get(0);
        assertEquals(JournalEntryPostedEvent.EVENT_TYPE, header(record, OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals("JournalEntry", header(record, OutboxPublisher.AGGREGATE_TYPE_HEADER));
        assertTrue(record.value().contains(entry.getEntryNumber()));

        assertTrue(outboxService.getEventsForAggregate("JournalEntry", entry.getId()).get(0).isPublished());
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Events of one entry arrive in commit order on one partition")
    void testPublish_OrderPerAggregate() {
        JournalEntry entry = fixtures.post(NOVEMBER.atDay(6), cash, sales, "10.00");
        journalService.reverse(entry.getId(), NOVEMBER.atDay(7), "keyed twice", LedgerFixtures.CHECKER);

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = pollFor(entry.getId().toString(), 2);
        assertEquals(2, records.size());
        assertEquals(JournalEntryPostedEvent.EVENT_TYPE, header(records.get(0), OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals(JournalEntryReversedEvent.EVENT_TYPE, header(records.get(1), OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals(records.get(0).partition(), records.get(1).partition());
    }

    @Test
    @DisplayName("A second pass sends nothing new")
    void testPublish_NoRepeat() {
        JournalEntry entry = fixtures.post(NOVEMBER.atDay(8), cash, sales, "1.00");

        outboxPublisher.triggerPublish();
        assertEquals(1, pollFor(entry.getId().toString(), 1).size());

        outboxPublisher.triggerPublish();
        assertTrue(pollFor(entry.getId().toString(), 1).isEmpty());
    }
}
