package com.repairline.core.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.exception.InvalidIdempotencyKeyException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Logical idempotency key: {@code source:tenant:discriminator}.
 *
 * <pre>
 * github:{tenant}:{deliveryId}
 * slack:{tenant}:{callbackId}
 * scheduler:{tenant}:{scheduleId}:{ISO-8601 timestamp}
 * api:{tenant}:{requestId}
 * </pre>
 *
 * The same event for different tenants or sources always yields different keys.
 * Only {@link #hash()} is stored.
 */
public record IdempotencyKey(
    EventSource source,
    String tenantId,
    List<String> discriminator
) {
    private static final String SEPARATOR = ":";

    public IdempotencyKey {
        requireSegment("tenantId", tenantId);
        if (discriminator == null || discriminator.isEmpty()) {
            throw new InvalidIdempotencyKeyException("discriminator is required");
        }
        discriminator = List.copyOf(discriminator);
    }

    public static IdempotencyKey github(String tenantId, String deliveryId) {
        if (!isUuid(deliveryId)) {
            throw new InvalidIdempotencyKeyException("deliveryId must be a UUID: " + deliveryId);
        }
        return new IdempotencyKey(EventSource.GITHUB, tenantId, List.of(deliveryId));
    }

    public static IdempotencyKey slack(String tenantId, String callbackId) {
        requireValue("callbackId", callbackId);
        return new IdempotencyKey(EventSource.SLACK, tenantId, List.of(callbackId));
    }

    public static IdempotencyKey scheduler(String tenantId, String scheduleId, Instant firedAt) {
        requireSegment("scheduleId", scheduleId);
        return new IdempotencyKey(EventSource.SCHEDULER, tenantId, List.of(scheduleId, firedAt.toString()));
    }

    public static IdempotencyKey api(String tenantId, String requestId) {
        requireValue("requestId", requestId);
        return new IdempotencyKey(EventSource.API, tenantId, List.of(requestId));
    }

    /**
     * The logical key string.
     */
    public String value() {
        return source.prefix() + SEPARATOR + tenantId + SEPARATOR + String.join(SEPARATOR, discriminator);
    }

    /**
     * Fixed-length digest used as the storage identifier.
     */
    public String hash() {
        return KeyHashing.hashKey(value());
    }

    @Override
    public String toString() {
        return value();
    }

    /**
     * Parse a logical key.
     *
     * @return empty when the key does not follow the scheme
     */
    public static Optional<IdempotencyKey> parse(String key) {
        try {
            return Optional.of(parseStrict(key));
        } catch (InvalidIdempotencyKeyException e) {
            return Optional.empty();
        }
    }

    /**
     * Validate a logical key.
     *
     * @throws InvalidIdempotencyKeyException naming the first violated rule
     */
    public static void validate(String key) {
        parseStrict(key);
    }

    public static boolean isValid(String key) {
        return parse(key).isPresent();
    }

    /**
     * Tenant of a request body: {@code tenantId}, then {@code organizationId}, then {@code orgId}.
     */
    public static Optional<String> extractTenantId(JsonNode body) {
        if (body == null) {
            return Optional.empty();
        }
        for (String field : List.of("tenantId", "organizationId", "orgId")) {
            JsonNode value = body.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static IdempotencyKey parseStrict(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidIdempotencyKeyException("key is empty");
        }
        String[] parts = key.split(SEPARATOR, -1);
        EventSource source = EventSource.fromPrefix(parts[0])
            .orElseThrow(() -> new InvalidIdempotencyKeyException("unknown source: " + parts[0]));
        if (parts.length < source.minParts()) {
            throw new InvalidIdempotencyKeyException(
                "expected at least " + source.minParts() + " parts for " + source.prefix());
        }

        String tenantId = parts[1];
        switch (source) {
            case GITHUB -> {
                String deliveryId = join(parts, 2);
                return github(tenantId, deliveryId);
            }
            case SLACK -> {
                return slack(tenantId, join(parts, 2));
            }
            case SCHEDULER -> {
                String timestamp = join(parts, 3);
                parseTimestamp(timestamp);
                requireSegment("scheduleId", parts[2]);
                return new IdempotencyKey(EventSource.SCHEDULER, tenantId, List.of(parts[2], timestamp));
            }
            case API -> {
                return api(tenantId, join(parts, 2));
            }
            default -> throw new InvalidIdempotencyKeyException("unknown source: " + parts[0]);
        }
    }

    private static String join(String[] parts, int from) {
        return String.join(SEPARATOR, Arrays.copyOfRange(parts, from, parts.length));
    }

    private static Instant parseTimestamp(String timestamp) {
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidIdempotencyKeyException("timestamp is not ISO-8601: " + timestamp);
        }
    }

    private static boolean isUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void requireValue(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidIdempotencyKeyException(name + " is required");
        }
    }

    private static void requireSegment(String name, String value) {
        requireValue(name, value);
        if (value.contains(SEPARATOR)) {
            throw new InvalidIdempotencyKeyException(name + " must not contain '" + SEPARATOR + "'");
        }
    }
}
