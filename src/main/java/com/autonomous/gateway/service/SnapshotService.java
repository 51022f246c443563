package com.autonomous.gateway.service;

import com.autonomous.gateway.model.AgentRecord;
import com.autonomous.gateway.model.TaskRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Saves the agent registry and the task table as JSON documents and loads them back at startup.
 */
@Slf4j
@Service
public class SnapshotService {

    static final String AGENTS_FILE = "registered_agents.json";
    static final String TASKS_FILE = "tasks.json";

    private static final TypeReference<Map<String, AgentRecord>> AGENTS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, TaskRecord>> TASKS_TYPE = new TypeReference<>() {};

    @Value("${gateway.data.path:data}")
    private String dataPath = "data";

    @Value("${gateway.snapshot.enabled:true}")
    private boolean enabled = true;

    @Value("${gateway.tasks.retention:24h}")
    private Duration retention = Duration.ofHours(24);

    private final AgentDirectory agentDirectory;
    private final TaskStore taskStore;
    private final BackgroundReconciler backgroundReconciler;
    private final ObjectMapper mapper;

    public SnapshotService(AgentDirectory agentDirectory, TaskStore taskStore, BackgroundReconciler backgroundReconciler) {
        this.agentDirectory = agentDirectory;
        this.taskStore = taskStore;
        this.backgroundReconciler = backgroundReconciler;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    @PostConstruct
    public void load() {
        if (!enabled) {
            return;
        }
        log.info("Loading saved data from {}", dataPath);
        agentDirectory.restore(read(AGENTS_FILE, AGENTS_TYPE));
        taskStore.restore(read(TASKS_FILE, TASKS_TYPE));
        dropTasksOfUnknownAgents();

        taskStore.snapshot().values().stream()
            .filter(t -> !t.isTerminal())
            .forEach(t -> backgroundReconciler.track(t.getGatewayId(), null));
    }

    private void dropTasksOfUnknownAgents() {
        taskStore.snapshot().values().stream()
            .map(TaskRecord::getEndpoint)
            .filter(endpoint -> !agentDirectory.isRegistered(endpoint))
            .distinct()
            .forEach(endpoint -> {
                int dropped = taskStore.deleteByEndpoint(endpoint);
                log.warn("Dropped {} saved tasks of agent {}, which is not registered", dropped, endpoint);
            });
    }

    @Scheduled(fixedDelayString = "${gateway.snapshot.interval-ms:300000}",
               initialDelayString = "${gateway.snapshot.interval-ms:300000}")
    public void periodicSave() {
        if (!enabled) {
            return;
        }
        evictExpired();
        saveAll();
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (enabled) {
            log.info("Saving data before exit...");
            saveAll();
        }
    }

    public int evictExpired() {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return 0;
        }
        return taskStore.evictTerminalBefore(Instant.now().minus(retention));
    }

    public void saveAll() {
        write(AGENTS_FILE, agentDirectory.snapshot());
        write(TASKS_FILE, taskStore.snapshot());
        log.info("Data saved to {}", dataPath);
    }

    private <T> Map<String, T> read(String fileName, TypeReference<Map<String, T>> type) {
        Path file = Paths.get(dataPath, fileName);
        if (!Files.exists(file)) {
            log.warn("File not found: {}. Starting with an empty table.", file);
            return Map.of();
        }
        try {
            Map<String, T> data = mapper.readValue(file.toFile(), type);
            return data != null ? data : Map.of();
        } catch (IOException e) {
            log.error("Error reading {}: {}. Starting with an empty table.", file, e.getMessage());
            return Map.of();
        }
    }

    private void write(String fileName, Object data) {
        Path file = Paths.get(dataPath, fileName);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Path temp = file.resolveSibling(fileName + ".tmp");
            mapper.writeValue(temp.toFile(), data);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Error saving data to {}: {}", file, e.getMessage());
        }
    }
}
