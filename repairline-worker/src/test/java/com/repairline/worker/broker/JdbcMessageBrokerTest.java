package com.repairline.worker.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.test.MutableClock;
import com.repairline.worker.broker.MessageBroker.ReceivedMessage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class JdbcMessageBrokerTest {

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("repairline_test")
        .withUsername("test")
        .withPassword("test");

    private static final Duration DEADLINE = Duration.ofSeconds(30);

    private MutableClock clock;
    private JdbcMessageBroker broker;

    @BeforeAll
    static void startDatabase() {
        POSTGRES.start();
    }

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/repairline-worker-schema.sql")).execute(dataSource);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("TRUNCATE worker_messages");

        clock = MutableClock.at(Instant.parse("2026-03-01T10:00:00Z"));
        broker = new JdbcMessageBroker(jdbcTemplate, new ObjectMapper(), clock);
    }

    @Test
    @DisplayName("Published messages are leased with their attributes and removed on ack")
    void publishPullAck() {
        String id = broker.publish("e30=", Map.of("tenantId", "acme"));

        List<ReceivedMessage> leased = broker.pull(5, DEADLINE);

        assertThat(leased).hasSize(1);
        BrokerMessage message = leased.get(0).message();
        assertThat(message.messageId()).isEqualTo(id);
        assertThat(message.data()).isEqualTo("e30=");
        assertThat(message.attribute("tenantId")).isEqualTo("acme");
        assertThat(message.deliveryAttempt()).isEqualTo(1);
        assertThat(broker.pull(5, DEADLINE)).isEmpty();

        assertThat(broker.ack(leased.get(0).ackId())).isTrue();
        assertThat(broker.outstanding()).isZero();
    }

    @Test
    @DisplayName("An expired lease is handed out again with a new ack id")
    void expiredLeaseIsRedelivered() {
        broker.publish("e30=", Map.of());
        ReceivedMessage first = broker.pull(1, DEADLINE).get(0);

        clock.advance(DEADLINE.plusSeconds(1));
        ReceivedMessage second = broker.pull(1, DEADLINE).get(0);

        assertThat(second.message().deliveryAttempt()).isEqualTo(2);
        assertThat(second.ackId()).isNotEqualTo(first.ackId());
        assertThat(broker.ack(first.ackId())).isFalse();
        assertThat(broker.ack(second.ackId())).isTrue();
    }

    @Test
    @DisplayName("A nack makes the message visible after the delay")
    void nackDelaysRedelivery() {
        broker.publish("e30=", Map.of());
        ReceivedMessage leased = broker.pull(1, DEADLINE).get(0);

        assertThat(broker.nack(leased.ackId(), Duration.ofSeconds(5))).isTrue();

        assertThat(broker.pull(1, DEADLINE)).isEmpty();
        clock.advance(Duration.ofSeconds(5));
        assertThat(broker.pull(1, DEADLINE)).hasSize(1);
    }

    @Test
    @DisplayName("Concurrent consumers never lease the same message")
    void concurrentPullsAreDisjoint() throws Exception {
        for (int i = 0; i < 40; i++) {
            broker.publish("e30=", Map.of());
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Callable<List<ReceivedMessage>>> pulls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            pulls.add(() -> broker.pull(10, DEADLINE));
        }
        Set<String> leasedIds = new HashSet<>();
        int total = 0;
        for (Future<List<ReceivedMessage>> future : executor.invokeAll(pulls)) {
            for (ReceivedMessage received : future.get()) {
                leasedIds.add(received.message().messageId());
                total++;
            }
        }
        executor.shutdown();
        for (ReceivedMessage received : broker.pull(40, DEADLINE)) {
            leasedIds.add(received.message().messageId());
            total++;
        }

        assertThat(total).isEqualTo(40);
        assertThat(leasedIds).hasSize(40);
    }
}
