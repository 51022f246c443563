package com.autonomous.gateway.service;

import com.autonomous.gateway.model.SortOrder;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.model.TaskResult;
import com.autonomous.gateway.model.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class TaskStoreTest {

    private TickingClock clock;
    private TaskStore store;

    @BeforeEach
    void setUp() {
        clock = new TickingClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new TaskStore(clock);
    }

    @Test
    void shouldCreateAndReturnCopies() {
        String id = store.create(pending("g-1", "http://agent-a"));

        TaskRecord first = store.get(id).orElseThrow();
        first.setState(TaskState.COMPLETED);
        first.getResult().setMessage("tampered");

        TaskRecord second = store.get(id).orElseThrow();
        assertEquals(TaskState.PENDING, second.getState());
        assertNull(second.getResult().getMessage());
        assertNotNull(second.getCreatedAt());
        assertEquals(second.getCreatedAt(), second.getUpdatedAt());
    }

    @Test
    void shouldRejectDuplicateGatewayId() {
        store.create(pending("g-1", "http://agent-a"));

        assertThrows(IllegalStateException.class, () -> store.create(pending("g-1", "http://agent-b")));
    }

    @Test
    void shouldStampUpdatedAtOnlyWhenSomethingChanged() {
        String id = store.create(pending("g-1", "http://agent-a"));
        Instant created = store.get(id).orElseThrow().getUpdatedAt();

        TaskRecord unchanged = store.update(id, r -> r.setState(TaskState.PENDING)).orElseThrow();
        assertEquals(created, unchanged.getUpdatedAt());

        TaskRecord running = store.update(id, r -> r.setState(TaskState.RUNNING)).orElseThrow();
        assertTrue(running.getUpdatedAt().isAfter(created));
    }

    @Test
    void shouldNeverLeaveTerminalStateUnderArbitraryUpdates() {
        Random random = new Random(42);
        List<Consumer<TaskRecord>> mutations = List.of(
            r -> r.setState(TaskState.PENDING),
            r -> r.setState(TaskState.RUNNING),
            r -> r.setState(TaskState.STREAMING),
            r -> r.setState(TaskState.ERROR),
            r -> r.setState(TaskState.CANCELLED),
            r -> r.setResult(TaskResult.builder().message("late").build()),
            r -> r.setAgentId("other"),
            r -> r.fail(-1, "boom")
        );

        for (TaskState terminal : List.of(TaskState.COMPLETED, TaskState.ERROR, TaskState.CANCELLED)) {
            String id = store.create(pending(null, "http://agent-a"));
            store.update(id, r -> {
                r.setState(terminal);
                r.setResult(TaskResult.builder().message("final").build());
            });
            TaskRecord settled = store.get(id).orElseThrow();

            for (int i = 0; i < 200; i++) {
                Consumer<TaskRecord> mutation = mutations.get(random.nextInt(mutations.size()));
                TaskRecord returned = store.update(id, mutation).orElseThrow();
                assertEquals(settled, returned);
            }
            assertEquals(settled, store.get(id).orElseThrow());
        }
    }

    @Test
    void shouldNotMoveStateBackwards() {
        String id = store.create(pending("g-1", "http://agent-a"));
        store.update(id, r -> r.setState(TaskState.RUNNING));

        TaskRecord after = store.update(id, r -> r.setState(TaskState.PENDING)).orElseThrow();

        assertEquals(TaskState.RUNNING, after.getState());
    }

    @Test
    void shouldKeepFirstAgentId() {
        String id = store.create(pending("g-1", "http://agent-a"));
        store.update(id, r -> r.setAgentId("remote-1"));

        TaskRecord after = store.update(id, r -> r.setAgentId("remote-2")).orElseThrow();

        assertEquals("remote-1", after.getAgentId());
    }

    @Test
    void shouldProtectIdentityFields() {
        String id = store.create(pending("g-1", "http://agent-a"));

        TaskRecord after = store.update(id, r -> {
            r.setGatewayId("hijacked");
            r.setEndpoint("http://elsewhere");
            r.setState(TaskState.RUNNING);
        }).orElseThrow();

        assertEquals("g-1", after.getGatewayId());
        assertEquals("http://agent-a", after.getEndpoint());
        assertTrue(store.get("hijacked").isEmpty());
    }

    @Test
    void shouldReturnEmptyWhenUpdatingUnknownTask() {
        assertTrue(store.update("missing", r -> r.setState(TaskState.RUNNING)).isEmpty());
    }

    @Test
    void shouldListCompletedTasksMostRecentFirst() {
        String a = store.create(pending("a", "http://agent-a"));
        String b = store.create(pending("b", "http://agent-a"));
        String c = store.create(pending("c", "http://agent-a"));
        store.create(pending("d", "http://agent-a"));

        complete(b);
        complete(a);
        complete(c);

        List<TaskRecord> listed = store.list(TaskState.COMPLETED, SortOrder.DESCENDING, 2);

        assertEquals(2, listed.size());
        assertEquals("c", listed.get(0).getGatewayId());
        assertEquals("a", listed.get(1).getGatewayId());
    }

    @Test
    void shouldListAscendingWithoutLimit() {
        store.create(pending("a", "http://agent-a"));
        store.create(pending("b", "http://agent-a"));
        complete("a");

        List<TaskRecord> listed = store.list(null, SortOrder.ASCENDING, null);

        assertEquals(List.of("b", "a"), listed.stream().map(TaskRecord::getGatewayId).toList());
    }

    @Test
    void shouldDeleteOnlyTasksOfEndpoint() {
        store.create(pending("a", "http://agent-a"));
        store.create(pending("b", "http://agent-a"));
        store.create(pending("c", "http://agent-b"));

        assertEquals(2, store.deleteByEndpoint("http://agent-a"));
        assertEquals(1, store.size());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    void shouldEvictOnlyOldTerminalTasks() {
        store.create(pending("old-done", "http://agent-a"));
        store.create(pending("old-running", "http://agent-a"));
        complete("old-done");
        store.update("old-running", r -> r.setState(TaskState.RUNNING));
        Instant cutoff = clock.instant();
        store.create(pending("new-done", "http://agent-a"));
        complete("new-done");

        assertEquals(1, store.evictTerminalBefore(cutoff));
        assertTrue(store.get("old-done").isEmpty());
        assertTrue(store.get("old-running").isPresent());
        assertTrue(store.get("new-done").isPresent());
    }

    @Test
    void shouldRestoreSnapshotSkippingEntriesWithoutState() {
        store.create(pending("a", "http://agent-a"));
        Map<String, TaskRecord> snapshot = store.snapshot();
        snapshot.put("broken", new TaskRecord());

        TaskStore restored = new TaskStore(clock);
        restored.restore(snapshot);

        assertEquals(1, restored.size());
        assertEquals(store.get("a"), restored.get("a"));
    }

    @Test
    void shouldSerializeConcurrentUpdatesOfOneTask() throws Exception {
        String id = store.create(pending("g-1", "http://agent-a"));
        store.update(id, r -> r.setResult(TaskResult.builder().artifacts(new ArrayList<>()).build()));

        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        store.update(id, r -> r.getResult().getArtifacts().add(Replies.MAPPER.createObjectNode()));
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, store.get(id).orElseThrow().getResult().getArtifacts().size());
    }

    private void complete(String id) {
        store.update(id, r -> r.setState(TaskState.COMPLETED));
    }

    private TaskRecord pending(String id, String endpoint) {
        return TaskRecord.builder()
            .gatewayId(id)
            .endpoint(endpoint)
            .requestPayload("hi")
            .state(TaskState.PENDING)
            .result(TaskResult.placeholder("waiting"))
            .build();
    }
}
