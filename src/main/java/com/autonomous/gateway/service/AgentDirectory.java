package com.autonomous.gateway.service;

import com.autonomous.gateway.model.AgentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Registered agents keyed by endpoint URL. {@link #removeThen} waits for any {@link #withRegistered} action
 * on the same directory to finish.
 */
@Slf4j
@Service
public class AgentDirectory {

    private final Map<String, AgentRecord> agents = new ConcurrentHashMap<>();
    private final ReadWriteLock membership = new ReentrantReadWriteLock();

    public AgentRecord put(String endpoint, JsonNode card) {
        AgentRecord record = AgentRecord.builder()
            .endpoint(endpoint)
            .name(card.path("name").asText(endpoint))
            .card(card.deepCopy())
            .registeredAt(Instant.now())
            .build();
        agents.put(endpoint, record);
        log.info("Registered agent '{}' at {}", record.getName(), endpoint);
        return record;
    }

    public Optional<AgentRecord> get(String endpoint) {
        return endpoint == null ? Optional.empty() : Optional.ofNullable(agents.get(endpoint));
    }

    public boolean isRegistered(String endpoint) {
        return endpoint != null && agents.containsKey(endpoint);
    }

    public Optional<AgentRecord> remove(String endpoint) {
        AgentRecord removed = agents.remove(endpoint);
        if (removed != null) {
            log.info("Unregistered agent '{}' at {}", removed.getName(), endpoint);
        }
        return Optional.ofNullable(removed);
    }

    public <T> Optional<T> withRegistered(String endpoint, Function<AgentRecord, T> action) {
        membership.readLock().lock();
        try {
            return get(endpoint).map(action);
        } finally {
            membership.readLock().unlock();
        }
    }

    public <T> Optional<T> removeThen(String endpoint, Function<AgentRecord, T> cleanup) {
        membership.writeLock().lock();
        try {
            return remove(endpoint).map(cleanup);
        } finally {
            membership.writeLock().unlock();
        }
    }

    public List<AgentRecord> list() {
        List<AgentRecord> all = new ArrayList<>(agents.values());
        all.sort(Comparator.comparing(AgentRecord::getRegisteredAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AgentRecord::getEndpoint));
        return all;
    }

    public int size() {
        return agents.size();
    }

    public Map<String, AgentRecord> snapshot() {
        Map<String, AgentRecord> copy = new LinkedHashMap<>();
        list().forEach(a -> copy.put(a.getEndpoint(), a));
        return copy;
    }

    public void restore(Map<String, AgentRecord> data) {
        agents.clear();
        data.forEach((endpoint, record) -> {
            if (record == null || record.getCard() == null) {
                log.error("Failed to load agent data for {}", endpoint);
                return;
            }
            record.setEndpoint(endpoint);
            if (record.getName() == null) {
                record.setName(record.getCard().path("name").asText(endpoint));
            }
            agents.put(endpoint, record);
        });
        log.info("Loaded {} agents", agents.size());
    }
}
