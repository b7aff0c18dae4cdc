package com.repairline.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.IdempotencyRecord;
import com.repairline.core.model.IdempotencyStatus;
import com.repairline.core.repository.IdempotencyRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of IdempotencyRepository.
 * For tests and single-process deployments.
 */
public class InMemoryIdempotencyRepository implements IdempotencyRepository {

    private final Map<String, IdempotencyRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<IdempotencyRecord> insertIfAbsent(IdempotencyRecord record) {
        IdempotencyRecord existing = records.putIfAbsent(record.keyHash(), record);
        return Optional.ofNullable(existing);
    }

    @Override
    public Optional<IdempotencyRecord> findByKeyHash(String keyHash) {
        return Optional.ofNullable(records.get(keyHash));
    }

    @Override
    public boolean markCompleted(String keyHash, String runId, JsonNode result, Instant now) {
        synchronized (records) {
            IdempotencyRecord existing = records.get(keyHash);
            if (existing == null || !existing.isPending()) {
                return false;
            }
            records.put(keyHash, existing.withCompleted(runId, result, now));
            return true;
        }
    }

    @Override
    public boolean markFailed(String keyHash, JsonNode result, Instant now) {
        synchronized (records) {
            IdempotencyRecord existing = records.get(keyHash);
            if (existing == null || !existing.isPending()) {
                return false;
            }
            records.put(keyHash, new IdempotencyRecord(
                existing.key(), existing.keyHash(), existing.tenantId(), IdempotencyStatus.FAILED,
                existing.payloadHash(), existing.runId(), result,
                existing.createdAt(), now, existing.expiresAt()
            ));
            return true;
        }
    }

    @Override
    public boolean resetToPending(String keyHash, IdempotencyStatus expectedStatus,
                                  Instant expectedUpdatedAt, Instant now) {
        synchronized (records) {
            IdempotencyRecord existing = records.get(keyHash);
            if (existing == null
                    || existing.status() != expectedStatus
                    || !existing.updatedAt().equals(expectedUpdatedAt)) {
                return false;
            }
            records.put(keyHash, existing.withPending(now));
            return true;
        }
    }

    @Override
    public List<String> findExpiredKeyHashes(Instant now, int limit) {
        return records.values().stream()
            .filter(r -> r.isExpired(now))
            .sorted(Comparator.comparing(IdempotencyRecord::expiresAt))
            .limit(limit)
            .map(IdempotencyRecord::keyHash)
            .toList();
    }

    @Override
    public int deleteExpired(Collection<String> keyHashes, Instant now) {
        int deleted = 0;
        synchronized (records) {
            for (String keyHash : keyHashes) {
                IdempotencyRecord existing = records.get(keyHash);
                if (existing != null && existing.isExpired(now)) {
                    records.remove(keyHash);
                    deleted++;
                }
            }
        }
        return deleted;
    }

    @Override
    public long count() {
        return records.size();
    }
}
