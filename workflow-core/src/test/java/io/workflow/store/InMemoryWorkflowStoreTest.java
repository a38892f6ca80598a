package io.workflow.store;

import io.workflow.model.MessageDirection;
import io.workflow.model.MessageKind;
import io.workflow.model.WorkflowMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkflowStoreTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryWorkflowStore store = new InMemoryWorkflowStore();

    @Test
    void positionsAreSequentialAcrossAppends() {
        long last = store.append("wf-1", List.of(event("wf-1", "e1"), event("wf-1", "e2"), command("wf-1", "c1")));
        assertEquals(3L, last);

        last = store.append("wf-1", List.of(event("wf-1", "e3"), command("wf-1", "c2")));
        assertEquals(5L, last);

        List<Long> positions = store.readStream("wf-1").stream().map(WorkflowMessage::position).toList();
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), positions);
        assertEquals(List.of("e1", "e2", "c1", "e3", "c2"),
                store.readStream("wf-1").stream().map(WorkflowMessage::message).toList());
    }

    @Test
    void appendRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> store.append("", List.of(event("", "e"))));
        assertThrows(IllegalArgumentException.class, () -> store.append(null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> store.append("wf-2", List.of()));
        assertThrows(IllegalArgumentException.class, () -> store.append("wf-2", List.of(event("other", "e"))));
        assertFalse(store.exists("wf-2"));
    }

    @Test
    void concurrentAppendsToOneWorkflowGetDistinctContiguousPositions() throws Exception {
        int writers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String payload = "e" + i;
                futures.add(pool.submit(() -> {
                    go.await();
                    return store.append("hot", List.of(event("hot", payload)));
                }));
            }
            go.countDown();
            Set<Long> returned = new HashSet<>();
            for (Future<Long> future : futures) {
                returned.add(future.get(10, TimeUnit.SECONDS));
            }

            Set<Long> expected = LongStream.rangeClosed(1, writers).boxed().collect(Collectors.toSet());
            assertEquals(expected, returned);
            Set<Long> stored = store.readStream("hot").stream().map(WorkflowMessage::position).collect(Collectors.toSet());
            assertEquals(expected, stored);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentBatchesAreNotInterleaved() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String batch = "b" + i;
                futures.add(pool.submit(() -> store.append("batch",
                        List.of(event("batch", batch), event("batch", batch), event("batch", batch)))));
            }
            for (Future<Long> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            List<WorkflowMessage> stream = store.readStream("batch");
            assertEquals(60, stream.size());
            for (int i = 0; i < stream.size(); i += 3) {
                assertEquals(stream.get(i).message(), stream.get(i + 1).message());
                assertEquals(stream.get(i).message(), stream.get(i + 2).message());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void readStreamFromPositionIsWindowed() {
        store.append("wf-3", List.of(event("wf-3", "e1"), event("wf-3", "e2"), event("wf-3", "e3"),
                event("wf-3", "e4"), event("wf-3", "e5")));

        assertEquals(List.of(3L, 4L, 5L),
                store.readStream("wf-3", 3).stream().map(WorkflowMessage::position).toList());
        assertEquals(5, store.readStream("wf-3", 0).size());
        assertEquals(5, store.readStream("wf-3", -7).size());
        assertEquals(5, store.readStream("wf-3", Long.MIN_VALUE).size());
        assertTrue(store.readStream("wf-3", 6).isEmpty());
        assertTrue(store.readStream("wf-3", Long.MAX_VALUE).isEmpty());
        assertTrue(store.readStream("missing").isEmpty());
    }

    @Test
    void processedFlagIsNormalisedOnAppend() {
        WorkflowMessage inputCommand = new WorkflowMessage(WorkflowMessage.newMessageId(), "wf-4", 0L,
                MessageKind.COMMAND, MessageDirection.INPUT, "in-cmd", NOW, Boolean.FALSE, Map.of());
        WorkflowMessage eventWithFlag = event("wf-4", "e").withProcessed(Boolean.TRUE);
        WorkflowMessage outputWithoutFlag = command("wf-4", "c").withProcessed(null);

        store.append("wf-4", List.of(inputCommand, eventWithFlag, outputWithoutFlag));

        List<WorkflowMessage> stream = store.readStream("wf-4");
        assertNull(stream.get(0).processed());
        assertNull(stream.get(1).processed());
        assertEquals(Boolean.FALSE, stream.get(2).processed());
    }

    @Test
    void pendingCommandsReturnsOnlyUnprocessedOutputCommands() {
        WorkflowMessage inputCommand = new WorkflowMessage(WorkflowMessage.newMessageId(), "wf-5", 0L,
                MessageKind.COMMAND, MessageDirection.INPUT, "in-cmd", NOW, null, Map.of());
        store.append("wf-5", List.of(event("wf-5", "e1"), command("wf-5", "c1"), inputCommand, command("wf-5", "c2")));
        store.append("wf-6", List.of(command("wf-6", "c3")));
        store.markCommandProcessed("wf-5", 2);

        List<WorkflowMessage> pending = store.pendingCommands(null);
        assertEquals(Set.of("c2", "c3"), pending.stream().map(WorkflowMessage::message).collect(Collectors.toSet()));
        pending.forEach(m -> assertTrue(m.isPendingCommand()));

        assertEquals(List.of("c2"), store.pendingCommands("wf-5").stream().map(WorkflowMessage::message).toList());
        assertTrue(store.pendingCommands("missing").isEmpty());
    }

    @Test
    void pendingCommandsForOneWorkflowAreInPositionOrder() {
        store.append("wf-7", List.of(command("wf-7", "c1"), event("wf-7", "e"), command("wf-7", "c2")));
        store.append("wf-7", List.of(command("wf-7", "c3")));

        assertEquals(List.of(1L, 3L, 4L),
                store.pendingCommands("wf-7").stream().map(WorkflowMessage::position).toList());
        assertEquals(List.of(1L, 3L),
                store.pendingCommands("wf-7", 2).stream().map(WorkflowMessage::position).toList());
        assertThrows(IllegalArgumentException.class, () -> store.pendingCommands("wf-7", 0));
    }

    @Test
    void pendingResultIsASnapshot() {
        store.append("wf-8", List.of(command("wf-8", "c1")));
        List<WorkflowMessage> pending = store.pendingCommands(null);

        store.markCommandProcessed("wf-8", 1);
        store.append("wf-8", List.of(command("wf-8", "c2")));

        assertEquals(1, pending.size());
        assertEquals(Boolean.FALSE, pending.get(0).processed());
    }

    @Test
    void markCommandProcessedFlipsFlagAndRemovesFromPending() {
        store.append("wf-9", List.of(event("wf-9", "e"), command("wf-9", "c")));

        store.markCommandProcessed("wf-9", 2);

        assertTrue(store.pendingCommands("wf-9").isEmpty());
        assertEquals(Boolean.TRUE, store.readStream("wf-9").get(1).processed());
    }

    @Test
    void markCommandProcessedFailuresLeaveLogUnchanged() {
        WorkflowMessage inputCommand = new WorkflowMessage(WorkflowMessage.newMessageId(), "wf-10", 0L,
                MessageKind.COMMAND, MessageDirection.INPUT, "in-cmd", NOW, null, Map.of());
        store.append("wf-10", List.of(event("wf-10", "e"), inputCommand, command("wf-10", "c")));
        store.markCommandProcessed("wf-10", 3);
        List<WorkflowMessage> before = store.readStream("wf-10");

        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("nope", 1));
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-10", 99));
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-10", 0));
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-10", 1));
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-10", 2));
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-10", 3));

        assertEquals(before, store.readStream("wf-10"));
    }

    @Test
    void existsAndDelete() {
        assertFalse(store.exists("wf-11"));
        store.append("wf-11", List.of(command("wf-11", "c")));
        assertTrue(store.exists("wf-11"));

        store.delete("wf-11");

        assertFalse(store.exists("wf-11"));
        assertTrue(store.readStream("wf-11").isEmpty());
        assertTrue(store.pendingCommands(null).isEmpty());
        assertThrows(IllegalStateException.class, () -> store.markCommandProcessed("wf-11", 1));
        store.delete("wf-11");
    }

    @Test
    void appendAfterDeleteStartsAtPositionOne() {
        store.append("wf-12", List.of(event("wf-12", "old1"), event("wf-12", "old2")));
        store.delete("wf-12");

        assertEquals(1L, store.append("wf-12", List.of(event("wf-12", "new"))));
        assertEquals(List.of("new"), store.readStream("wf-12").stream().map(WorkflowMessage::message).toList());
    }

    @Test
    void deleteDoesNotAffectOtherWorkflows() {
        store.append("keep", List.of(command("keep", "c")));
        store.append("drop", List.of(command("drop", "c")));

        store.delete("drop");

        assertTrue(store.exists("keep"));
        assertEquals(1, store.pendingCommands(null).size());
    }

    @Test
    void instancesDoNotShareState() {
        store.append("wf-13", List.of(event("wf-13", "e")));

        assertFalse(new InMemoryWorkflowStore().exists("wf-13"));
    }

    @Test
    void concurrentAppendAndDeleteNeverLoseAcknowledgedAppends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                if (i % 10 == 0) {
                    futures.add(pool.submit(() -> store.delete("churn")));
                } else {
                    futures.add(pool.submit(() -> store.append("churn", List.of(event("churn", "e")))));
                }
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            List<WorkflowMessage> stream = store.readStream("churn");
            for (int i = 0; i < stream.size(); i++) {
                assertEquals(i + 1L, stream.get(i).position());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    static WorkflowMessage event(String workflowId, Object payload) {
        return WorkflowMessage.event(workflowId, MessageDirection.INPUT, payload, NOW, Map.of());
    }

    static WorkflowMessage command(String workflowId, Object payload) {
        return WorkflowMessage.command(workflowId, payload, NOW, Map.of());
    }
}
