package io.workflow;

import io.workflow.fixtures.ApprovalWorkflow;
import io.workflow.fixtures.ApprovalWorkflow.AwaitingReview;
import io.workflow.fixtures.ApprovalWorkflow.Final;
import io.workflow.fixtures.ApprovalWorkflow.Initial;
import io.workflow.fixtures.ApprovalWorkflow.Reviewed;
import io.workflow.fixtures.ApprovalWorkflow.Submitted;
import io.workflow.model.MessageDirection;
import io.workflow.model.MessageKind;
import io.workflow.model.WorkflowMessage;
import io.workflow.spi.MetricsExporter;
import io.workflow.store.InMemoryWorkflowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowProcessorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private InMemoryWorkflowStore store;
    private WorkflowProcessor<ApprovalWorkflow.Input, ApprovalWorkflow.State, ApprovalWorkflow.Output> processor;
    private final AtomicInteger appended = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
        processor = WorkflowProcessor.<ApprovalWorkflow.Input, ApprovalWorkflow.State, ApprovalWorkflow.Output>builder()
                .workflow(new ApprovalWorkflow())
                .store(store)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .metrics(new CountingMetrics(appended))
                .build();
    }

    @Test
    void firstInputBeginsWorkflowAndRecordsEventsThenCommands() {
        ProcessingResult<ApprovalWorkflow.Input, ApprovalWorkflow.State, ApprovalWorkflow.Output> result =
                processor.process("req-1", new Submitted("req-1"));

        assertEquals(new AwaitingReview("req-1"), result.state());
        assertEquals(4L, result.lastPosition());
        assertFalse(result.completed());

        List<WorkflowMessage> stream = store.readStream("req-1");
        assertEquals(4, stream.size());
        assertMessage(stream.get(0), 1, MessageKind.EVENT, MessageDirection.INPUT, null);
        assertMessage(stream.get(1), 2, MessageKind.EVENT, MessageDirection.INPUT, null);
        assertMessage(stream.get(2), 3, MessageKind.EVENT, MessageDirection.OUTPUT, null);
        assertMessage(stream.get(3), 4, MessageKind.COMMAND, MessageDirection.OUTPUT, Boolean.FALSE);
        assertInstanceOf(WorkflowEvent.Began.class, stream.get(0).message());
        assertInstanceOf(WorkflowEvent.InitiatedBy.class, stream.get(1).message());
        assertInstanceOf(WorkflowEvent.Sent.class, stream.get(2).message());
        assertInstanceOf(WorkflowCommand.Send.class, stream.get(3).message());
        assertEquals(NOW, stream.get(3).timestamp());
        assertEquals(4, appended.get());
    }

    @Test
    void secondInputIsReceivedAndCompletesWorkflow() {
        processor.process("req-2", new Submitted("req-2"));
        var result = processor.process("req-2", new Reviewed("req-2", true));

        assertEquals(new Final(true), result.state());
        assertTrue(result.completed());
        assertEquals(9L, result.lastPosition());
        assertInstanceOf(WorkflowEvent.Received.class, store.readStream("req-2", 5).get(0).message());
        assertEquals(3, store.pendingCommands("req-2").size());
    }

    @Test
    void currentStateIsRebuiltFromStoredEvents() {
        assertEquals(new Initial(), processor.currentState("unknown"));

        processor.process("req-3", new Submitted("req-3"));
        assertEquals(new AwaitingReview("req-3"), processor.currentState("req-3"));

        processor.process("req-3", new Reviewed("req-3", false));
        assertEquals(new Final(false), processor.currentState("req-3"));
        assertEquals(6, processor.load("req-3").eventHistory().size());
    }

    @Test
    void rejectedInputWritesNothing() {
        processor.process("req-4", new Submitted("req-4"));

        assertThrows(UnsupportedTransitionException.class,
                () -> processor.process("req-4", new Submitted("req-4")));
        assertEquals(4, store.readStream("req-4").size());
        assertFalse(store.exists("req-5"));
        assertThrows(UnsupportedTransitionException.class,
                () -> processor.process("req-5", new Reviewed("req-5", true)));
        assertFalse(store.exists("req-5"));
    }

    @Test
    void headersAreCopiedAndLinkedToTheInputEntry() {
        processor.process("req-6", new Submitted("req-6"), Map.of("tenant", "acme"));

        List<WorkflowMessage> stream = store.readStream("req-6");
        String inputId = stream.get(1).messageId();
        assertNull(stream.get(1).header(WorkflowProcessor.CAUSATION_ID));
        for (WorkflowMessage message : stream) {
            assertEquals("acme", message.header("tenant"));
            assertEquals("req-6", message.header(WorkflowProcessor.CORRELATION_ID));
        }
        assertEquals(inputId, stream.get(2).header(WorkflowProcessor.CAUSATION_ID));
        assertEquals(inputId, stream.get(3).header(WorkflowProcessor.CAUSATION_ID));
    }

    @Test
    void callerCorrelationIdIsKept() {
        processor.process("req-7", new Submitted("req-7"), Map.of(WorkflowProcessor.CORRELATION_ID, "http-123"));

        assertEquals("http-123", store.readStream("req-7").get(0).header(WorkflowProcessor.CORRELATION_ID));
    }

    @Test
    void incompatibleHistoryRaisesReplayInconsistency() {
        store.append("req-8", List.of(WorkflowMessage.event("req-8", MessageDirection.INPUT,
                new WorkflowEvent.Received<ApprovalWorkflow.Input, ApprovalWorkflow.Output>(new Reviewed("req-8", true)),
                NOW, Map.of())));

        var ex = assertThrows(ReplayInconsistencyException.class, () -> processor.currentState("req-8"));
        assertEquals("req-8", ex.workflowId());
        assertEquals(1L, ex.position());
        assertInstanceOf(UnsupportedTransitionException.class, ex.getCause());
    }

    @Test
    void nonEventPayloadRaisesReplayInconsistency() {
        store.append("req-9", List.of(WorkflowMessage.event("req-9", MessageDirection.INPUT, "raw", NOW, Map.of())));

        var ex = assertThrows(ReplayInconsistencyException.class, () -> processor.currentState("req-9"));
        assertInstanceOf(ClassCastException.class, ex.getCause());
    }

    @Test
    void blankWorkflowIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> processor.process(" ", new Submitted("x")));
    }

    private static void assertMessage(WorkflowMessage message, long position, MessageKind kind,
            MessageDirection direction, Boolean processed) {
        assertEquals(position, message.position());
        assertEquals(kind, message.kind());
        assertEquals(direction, message.direction());
        assertEquals(processed, message.processed());
    }

    private static final class CountingMetrics extends MetricsExporterAdapter {
        private final AtomicInteger appended;

        CountingMetrics(AtomicInteger appended) {
            this.appended = appended;
        }

        @Override
        public void incrementMessagesAppended(int count) {
            appended.addAndGet(count);
        }
    }

    private abstract static class MetricsExporterAdapter implements MetricsExporter {
        @Override
        public void incrementMessagesAppended(int count) {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchParked() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
