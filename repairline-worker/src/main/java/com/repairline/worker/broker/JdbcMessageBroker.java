package com.repairline.worker.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PostgreSQL table used as a pull subscription.
 *
 * Leasing is one UPDATE over rows picked with FOR UPDATE SKIP LOCKED, so concurrent
 * consumers never lease the same row. Each lease gets a new ack id; an ack carrying the
 * id of an expired lease no longer matches and is ignored.
 */
public class JdbcMessageBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(JdbcMessageBroker.class);

    private static final TypeReference<Map<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<ReceivedMessage> rowMapper = new ReceivedMessageRowMapper();

    public JdbcMessageBroker(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String publish(String data, Map<String, String> attributes) {
        String sql = """
            INSERT INTO worker_messages (
                message_id, data, attributes, publish_time, delivery_attempt, visible_at
            ) VALUES (?, ?, ?::jsonb, ?, 0, ?)
            """;

        String messageId = UUID.randomUUID().toString();
        Timestamp now = Timestamp.from(now());
        jdbcTemplate.update(sql, messageId, data, toJson(attributes), now, now);
        log.debug("Published message {}", messageId);
        return messageId;
    }

    @Override
    public List<ReceivedMessage> pull(int maxMessages, Duration ackDeadline) {
        String sql = """
            UPDATE worker_messages m SET
                delivery_attempt = m.delivery_attempt + 1,
                ack_id = m.message_id || ':' || (m.delivery_attempt + 1),
                visible_at = ?
            WHERE m.message_id IN (
                SELECT message_id FROM worker_messages
                WHERE visible_at <= ?
                ORDER BY publish_time
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING m.message_id, m.data, m.attributes, m.publish_time, m.delivery_attempt, m.ack_id
            """;

        Instant now = now();
        return jdbcTemplate.query(sql, rowMapper,
            Timestamp.from(now.plus(ackDeadline)),
            Timestamp.from(now),
            maxMessages
        );
    }

    @Override
    public boolean ack(String ackId) {
        return jdbcTemplate.update("DELETE FROM worker_messages WHERE ack_id = ?", ackId) > 0;
    }

    @Override
    public boolean nack(String ackId, Duration redeliveryDelay) {
        String sql = "UPDATE worker_messages SET visible_at = ? WHERE ack_id = ?";
        return jdbcTemplate.update(sql, Timestamp.from(now().plus(redeliveryDelay)), ackId) > 0;
    }

    public int outstanding() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM worker_messages", Integer.class);
        return count != null ? count : 0;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private String toJson(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes != null ? attributes : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message attributes are not serializable", e);
        }
    }

    private class ReceivedMessageRowMapper implements RowMapper<ReceivedMessage> {
        @Override
        public ReceivedMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
            String attributesJson = rs.getString("attributes");
            Map<String, String> attributes;
            try {
                attributes = attributesJson != null ? objectMapper.readValue(attributesJson, ATTRIBUTES_TYPE) : Map.of();
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt attributes on message " + rs.getString("message_id"), e);
            }
            BrokerMessage message = new BrokerMessage(
                rs.getString("message_id"),
                rs.getString("data"),
                attributes,
                rs.getTimestamp("publish_time").toInstant(),
                rs.getInt("delivery_attempt")
            );
            return new ReceivedMessage(rs.getString("ack_id"), message);
        }
    }
}
