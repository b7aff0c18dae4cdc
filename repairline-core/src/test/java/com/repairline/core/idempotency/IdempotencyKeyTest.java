package com.repairline.core.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.exception.InvalidIdempotencyKeyException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyKeyTest {

    private static final String DELIVERY_ID = "123e4567-e89b-12d3-a456-426614174000";

    @Test
    void github_shouldComposeSourceTenantAndDelivery() {
        IdempotencyKey key = IdempotencyKey.github("tenant-1", DELIVERY_ID);

        assertEquals("github:tenant-1:" + DELIVERY_ID, key.value());
    }

    @Test
    void github_shouldRejectNonUuidDelivery() {
        assertThrows(InvalidIdempotencyKeyException.class, () -> IdempotencyKey.github("tenant-1", "not-a-uuid"));
    }

    @Test
    void scheduler_shouldIncludeScheduleAndTimestamp() {
        IdempotencyKey key = IdempotencyKey.scheduler("tenant-1", "nightly",
            Instant.parse("2024-01-15T10:30:00Z"));

        assertEquals("scheduler:tenant-1:nightly:2024-01-15T10:30:00Z", key.value());
    }

    @Test
    void sameEvent_forDifferentTenants_shouldNotCollide() {
        IdempotencyKey first = IdempotencyKey.api("tenant-1", "req-1");
        IdempotencyKey second = IdempotencyKey.api("tenant-2", "req-1");

        assertNotEquals(first.value(), second.value());
        assertNotEquals(first.hash(), second.hash());
    }

    @Test
    void sameDiscriminator_forDifferentSources_shouldNotCollide() {
        assertNotEquals(
            IdempotencyKey.api("tenant-1", "cb-1").hash(),
            IdempotencyKey.slack("tenant-1", "cb-1").hash());
    }

    @Test
    void hash_shouldBeFixedLengthHex() {
        String hash = IdempotencyKey.api("tenant-1", "a-very-long-request-id-".repeat(20)).hash();

        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]{64}"));
        assertEquals(hash, IdempotencyKey.api("tenant-1", "a-very-long-request-id-".repeat(20)).hash());
    }

    @Test
    void parse_shouldRoundTripEverySource() {
        for (String key : new String[]{
                "github:tenant-1:" + DELIVERY_ID,
                "slack:tenant-1:callback-9",
                "scheduler:tenant-1:nightly:2024-01-15T10:30:00Z",
                "api:tenant-1:req-42"}) {
            assertEquals(key, IdempotencyKey.parse(key).orElseThrow().value());
        }
    }

    @Test
    void parse_shouldReturnEmptyForInvalidKeys() {
        assertTrue(IdempotencyKey.parse("").isEmpty());
        assertTrue(IdempotencyKey.parse("ftp:tenant-1:x").isEmpty());
        assertTrue(IdempotencyKey.parse("api:tenant-1").isEmpty());
        assertTrue(IdempotencyKey.parse("scheduler:tenant-1:nightly:yesterday").isEmpty());
        assertTrue(IdempotencyKey.parse("github:tenant-1:nope").isEmpty());
    }

    @Test
    void validate_shouldNameTheViolatedRule() {
        InvalidIdempotencyKeyException unknown = assertThrows(InvalidIdempotencyKeyException.class,
            () -> IdempotencyKey.validate("ftp:tenant-1:x"));
        assertTrue(unknown.getMessage().contains("unknown source"));

        InvalidIdempotencyKeyException empty = assertThrows(InvalidIdempotencyKeyException.class,
            () -> IdempotencyKey.validate("  "));
        assertTrue(empty.getMessage().contains("empty"));

        InvalidIdempotencyKeyException parts = assertThrows(InvalidIdempotencyKeyException.class,
            () -> IdempotencyKey.validate("scheduler:tenant-1:nightly"));
        assertTrue(parts.getMessage().contains("parts"));
    }

    @Test
    void tenantId_shouldNotContainSeparator() {
        assertThrows(InvalidIdempotencyKeyException.class, () -> IdempotencyKey.api("tenant:1", "req"));
    }

    @Test
    void extractTenantId_shouldPreferTenantThenOrganization() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("t1", IdempotencyKey.extractTenantId(
            mapper.readTree("{\"tenantId\":\"t1\",\"orgId\":\"o1\"}")).orElseThrow());
        assertEquals("org-9", IdempotencyKey.extractTenantId(
            mapper.readTree("{\"organizationId\":\"org-9\",\"orgId\":\"o1\"}")).orElseThrow());
        assertEquals("o1", IdempotencyKey.extractTenantId(
            mapper.readTree("{\"orgId\":\"o1\"}")).orElseThrow());
        assertTrue(IdempotencyKey.extractTenantId(mapper.readTree("{}")).isEmpty());
    }
}
