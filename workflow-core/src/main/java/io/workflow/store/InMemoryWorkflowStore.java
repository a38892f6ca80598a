package io.workflow.store;

import io.workflow.model.WorkflowMessage;
import io.workflow.spi.WorkflowStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Heap-backed {@link WorkflowStore} for tests, development and single-process hosts.
 *
 * <p>Each workflow id owns a stream object whose monitor guards every read and write of that
 * stream, so operations on different ids never wait for each other. Pending output commands
 * are tracked in a per-stream index of positions that is updated on append and on
 * acknowledgement, which keeps {@link #pendingCommands} proportional to the number of
 * pending entries rather than the size of the log.
 *
 * <p>Instances are independent: two stores never share state.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryWorkflowStore implements WorkflowStore {
    private static final Logger logger = Logger.getLogger(InMemoryWorkflowStore.class.getName());

    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    @Override
    public long append(String workflowId, List<WorkflowMessage> messages) {
        requireWorkflowId(workflowId);
        Objects.requireNonNull(messages, "messages");
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        for (WorkflowMessage message : messages) {
            Objects.requireNonNull(message, "message");
            if (!workflowId.equals(message.workflowId())) {
                throw new IllegalArgumentException("Message " + message.messageId()
                        + " belongs to workflowId=" + message.workflowId() + ", not " + workflowId);
            }
        }

        while (true) {
            Stream stream = streams.computeIfAbsent(workflowId, id -> new Stream());
            synchronized (stream) {
                if (stream.deleted) {
                    // lost a race with delete(); the next lookup creates a fresh stream
                    continue;
                }
                long base = stream.messages.size();
                List<WorkflowMessage> stored = new ArrayList<>(messages.size());
                for (int i = 0; i < messages.size(); i++) {
                    stored.add(messages.get(i).normalizedAt(base + i + 1));
                }
                for (WorkflowMessage message : stored) {
                    stream.messages.add(message);
                    if (message.isPendingCommand()) {
                        stream.pending.add(message.position());
                    }
                }
                long last = base + stored.size();
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Appended " + stored.size() + " message(s) to workflowId=" + workflowId
                            + ", last position " + last);
                }
                return last;
            }
        }
    }

    @Override
    public List<WorkflowMessage> readStream(String workflowId, long fromPosition) {
        requireWorkflowId(workflowId);
        Stream stream = streams.get(workflowId);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            if (stream.deleted) {
                return List.of();
            }
            long first = Math.max(1L, fromPosition);
            int from = (int) Math.min(first - 1, stream.messages.size());
            return List.copyOf(stream.messages.subList(from, stream.messages.size()));
        }
    }

    @Override
    public List<WorkflowMessage> pendingCommands(String workflowId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        List<WorkflowMessage> result = new ArrayList<>();
        if (workflowId != null) {
            Stream stream = streams.get(workflowId);
            if (stream != null) {
                collectPending(stream, limit, result);
            }
            return Collections.unmodifiableList(result);
        }
        for (Stream stream : streams.values()) {
            if (result.size() >= limit) {
                break;
            }
            collectPending(stream, limit, result);
        }
        return Collections.unmodifiableList(result);
    }

    private static void collectPending(Stream stream, int limit, List<WorkflowMessage> into) {
        synchronized (stream) {
            if (stream.deleted) {
                return;
            }
            for (Long position : stream.pending) {
                if (into.size() >= limit) {
                    return;
                }
                into.add(stream.messages.get((int) (position - 1)));
            }
        }
    }

    @Override
    public void markCommandProcessed(String workflowId, long position) {
        requireWorkflowId(workflowId);
        Stream stream = streams.get(workflowId);
        if (stream == null) {
            throw new IllegalStateException("Workflow " + workflowId + " not found");
        }
        synchronized (stream) {
            if (stream.deleted) {
                throw new IllegalStateException("Workflow " + workflowId + " not found");
            }
            if (position < 1 || position > stream.messages.size()) {
                throw new IllegalStateException(
                        "Message at position " + position + " not found in workflow " + workflowId);
            }
            int index = (int) (position - 1);
            WorkflowMessage message = stream.messages.get(index);
            if (!message.isOutputCommand()) {
                throw new IllegalStateException("Message at position " + position + " in workflow "
                        + workflowId + " is not an output command");
            }
            if (!message.isPendingCommand()) {
                throw new IllegalStateException("Command at position " + position + " in workflow "
                        + workflowId + " is already processed");
            }
            stream.messages.set(index, message.withProcessed(Boolean.TRUE));
            stream.pending.remove(position);
        }
    }

    @Override
    public boolean exists(String workflowId) {
        requireWorkflowId(workflowId);
        Stream stream = streams.get(workflowId);
        if (stream == null) {
            return false;
        }
        synchronized (stream) {
            return !stream.deleted && !stream.messages.isEmpty();
        }
    }

    @Override
    public void delete(String workflowId) {
        requireWorkflowId(workflowId);
        Stream stream = streams.get(workflowId);
        if (stream == null) {
            return;
        }
        synchronized (stream) {
            stream.deleted = true;
            streams.remove(workflowId, stream);
        }
        logger.fine("Deleted workflowId=" + workflowId);
    }

    private static void requireWorkflowId(String workflowId) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId must not be blank");
        }
    }

    private static final class Stream {
        private final List<WorkflowMessage> messages = new ArrayList<>();
        private final NavigableSet<Long> pending = new TreeSet<>();
        private boolean deleted;
    }
}
