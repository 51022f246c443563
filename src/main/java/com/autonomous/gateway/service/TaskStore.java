package com.autonomous.gateway.service;

import com.autonomous.gateway.model.SortOrder;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.model.TaskState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * In-memory task table. Callers only ever receive copies.
 */
@Slf4j
@Service
public class TaskStore {

    private static final Comparator<TaskRecord> BY_UPDATED = Comparator
        .comparing(TaskRecord::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(TaskRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(TaskRecord::getGatewayId);

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public TaskStore() {
        this(Clock.systemUTC());
    }

    TaskStore(Clock clock) {
        this.clock = clock;
    }

    public String create(TaskRecord record) {
        TaskRecord stored = record.copy();
        if (stored.getGatewayId() == null) {
            stored.setGatewayId(UUID.randomUUID().toString());
        }
        if (stored.getState() == null) {
            stored.setState(TaskState.PENDING);
        }
        Instant now = clock.instant();
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(now);
        }
        if (stored.getUpdatedAt() == null) {
            stored.setUpdatedAt(stored.getCreatedAt());
        }

        lock.writeLock().lock();
        try {
            if (tasks.putIfAbsent(stored.getGatewayId(), stored) != null) {
                throw new IllegalStateException("Task already exists: " + stored.getGatewayId());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Created task {} for {} in state {}", stored.getGatewayId(), stored.getEndpoint(), stored.getState().wireName());
        return stored.getGatewayId();
    }

    public Optional<TaskRecord> get(String gatewayId) {
        if (gatewayId == null) {
            return Optional.empty();
        }
        TaskRecord record = tasks.get(gatewayId);
        return Optional.ofNullable(record).map(TaskRecord::copy);
    }

    public boolean contains(String gatewayId) {
        return gatewayId != null && tasks.containsKey(gatewayId);
    }

    /**
     * No-op on a terminal task. The mutation runs with the key locked and must not call back into the store.
     */
    public Optional<TaskRecord> update(String gatewayId, Consumer<TaskRecord> mutation) {
        AtomicReference<TaskRecord> outcome = new AtomicReference<>();
        lock.readLock().lock();
        try {
            tasks.computeIfPresent(gatewayId, (id, stored) -> {
                if (stored.isTerminal()) {
                    outcome.set(stored);
                    return stored;
                }
                TaskRecord working = stored.copy();
                mutation.accept(working);
                enforceInvariants(stored, working);
                if (working.equals(stored)) {
                    outcome.set(stored);
                    return stored;
                }
                working.setUpdatedAt(nextTimestamp(stored.getUpdatedAt()));
                outcome.set(working);
                return working;
            });
        } finally {
            lock.readLock().unlock();
        }
        return Optional.ofNullable(outcome.get()).map(TaskRecord::copy);
    }

    public int deleteByEndpoint(String endpoint) {
        lock.writeLock().lock();
        try {
            List<String> doomed = tasks.values().stream()
                .filter(t -> Objects.equals(endpoint, t.getEndpoint()))
                .map(TaskRecord::getGatewayId)
                .toList();
            doomed.forEach(tasks::remove);
            log.info("Removed {} tasks for agent {}", doomed.size(), endpoint);
            return doomed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<TaskRecord> list(TaskState stateFilter, SortOrder sortOrder, Integer limit) {
        Comparator<TaskRecord> order = sortOrder == SortOrder.ASCENDING ? BY_UPDATED : BY_UPDATED.reversed();
        lock.writeLock().lock();
        try {
            return tasks.values().stream()
                .filter(t -> stateFilter == null || t.getState() == stateFilter)
                .sorted(order)
                .limit(limit != null && limit > 0 ? limit : Long.MAX_VALUE)
                .map(TaskRecord::copy)
                .toList();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int evictTerminalBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            List<String> expired = tasks.values().stream()
                .filter(TaskRecord::isTerminal)
                .filter(t -> t.getUpdatedAt() != null && t.getUpdatedAt().isBefore(cutoff))
                .map(TaskRecord::getGatewayId)
                .toList();
            expired.forEach(tasks::remove);
            if (!expired.isEmpty()) {
                log.info("Evicted {} finished tasks last updated before {}", expired.size(), cutoff);
            }
            return expired.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return tasks.size();
    }

    public Map<String, TaskRecord> snapshot() {
        lock.writeLock().lock();
        try {
            Map<String, TaskRecord> copy = new LinkedHashMap<>();
            tasks.values().stream()
                .sorted(BY_UPDATED)
                .forEach(t -> copy.put(t.getGatewayId(), t.copy()));
            return copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the whole table. Entries without a state are skipped; the map key wins over an embedded id.
     */
    public void restore(Map<String, TaskRecord> data) {
        lock.writeLock().lock();
        try {
            tasks.clear();
            List<String> skipped = new ArrayList<>();
            data.forEach((id, record) -> {
                if (record == null || record.getState() == null) {
                    skipped.add(id);
                    return;
                }
                TaskRecord copy = record.copy();
                copy.setGatewayId(id);
                tasks.put(id, copy);
            });
            if (!skipped.isEmpty()) {
                log.warn("Skipped {} malformed task entries: {}", skipped.size(), skipped);
            }
            log.info("Loaded {} tasks", tasks.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void enforceInvariants(TaskRecord stored, TaskRecord working) {
        working.setGatewayId(stored.getGatewayId());
        working.setEndpoint(stored.getEndpoint());
        working.setRequestPayload(stored.getRequestPayload());
        working.setCreatedAt(stored.getCreatedAt());
        working.setUpdatedAt(stored.getUpdatedAt());

        if (working.getState() == null || working.getState().rank() < stored.getState().rank()) {
            working.setState(stored.getState());
        }
        if (stored.getAgentId() != null && !stored.getAgentId().equals(working.getAgentId())) {
            log.warn("Task {} keeps agent id {}, ignoring {}", stored.getGatewayId(), stored.getAgentId(), working.getAgentId());
            working.setAgentId(stored.getAgentId());
        }
    }

    private Instant nextTimestamp(Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusNanos(1);
        }
        return now;
    }
}
