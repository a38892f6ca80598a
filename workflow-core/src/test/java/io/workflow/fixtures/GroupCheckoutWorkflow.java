package io.workflow.fixtures;

import io.workflow.UnsupportedTransitionException;
import io.workflow.Workflow;
import io.workflow.WorkflowCommand;
import io.workflow.WorkflowEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks out a group of guests: one checkout command per guest, a timeout reminder, and a
 * summary once every guest has either checked out or failed.
 */
public final class GroupCheckoutWorkflow
        implements Workflow<GroupCheckoutWorkflow.Input, GroupCheckoutWorkflow.State, GroupCheckoutWorkflow.Output> {

    public static final Duration TIMEOUT = Duration.ofMinutes(15);

    public enum GuestStatus {
        PENDING,
        COMPLETED,
        FAILED
    }

    public sealed interface Input permits InitiateGroupCheckout, GuestCheckedOut, GuestCheckoutFailed, TimeoutGroupCheckout {
    }

    public record InitiateGroupCheckout(String groupId, List<String> guestIds) implements Input {
    }

    public record GuestCheckedOut(String guestId) implements Input {
    }

    public record GuestCheckoutFailed(String guestId, String reason) implements Input {
    }

    public record TimeoutGroupCheckout(String groupId) implements Input {
    }

    public sealed interface Output permits CheckOut, GroupCheckoutCompleted, GroupCheckoutFailed, GroupCheckoutTimedOut {
    }

    public record CheckOut(String guestId) implements Output {
    }

    public record GroupCheckoutCompleted(String groupId, List<String> completed) implements Output {
    }

    public record GroupCheckoutFailed(String groupId, List<String> completed, List<String> failed) implements Output {
    }

    public record GroupCheckoutTimedOut(String groupId, List<String> pending) implements Output {
    }

    public sealed interface State permits NotExisting, Pending, Finished {
    }

    public record NotExisting() implements State {
    }

    public record Pending(String groupId, Map<String, GuestStatus> guests) implements State {
        public Pending {
            guests = Collections.unmodifiableMap(new LinkedHashMap<>(guests));
        }

        Pending with(String guestId, GuestStatus status) {
            Map<String, GuestStatus> updated = new LinkedHashMap<>(guests);
            updated.replace(guestId, status);
            return new Pending(groupId, updated);
        }

        boolean allSettled() {
            return guests.values().stream().noneMatch(s -> s == GuestStatus.PENDING);
        }

        List<String> guestsIn(GuestStatus status) {
            List<String> result = new ArrayList<>();
            guests.forEach((id, s) -> {
                if (s == status) {
                    result.add(id);
                }
            });
            return result;
        }
    }

    public record Finished() implements State {
    }

    @Override
    public State initialState() {
        return new NotExisting();
    }

    @Override
    public List<WorkflowCommand<Output>> decide(Input input, State state) {
        if (input instanceof InitiateGroupCheckout initiate && state instanceof NotExisting) {
            List<WorkflowCommand<Output>> commands = new ArrayList<>();
            for (String guestId : initiate.guestIds()) {
                commands.add(WorkflowCommand.send(new CheckOut(guestId)));
            }
            commands.add(WorkflowCommand.schedule(TIMEOUT, new GroupCheckoutTimedOut(initiate.groupId(), List.of())));
            return commands;
        }
        if (input instanceof GuestCheckedOut out && state instanceof Pending pending) {
            return settle(pending.with(out.guestId(), GuestStatus.COMPLETED));
        }
        if (input instanceof GuestCheckoutFailed failed && state instanceof Pending pending) {
            return settle(pending.with(failed.guestId(), GuestStatus.FAILED));
        }
        if (input instanceof TimeoutGroupCheckout && state instanceof Pending pending) {
            return List.of(
                    WorkflowCommand.publish(new GroupCheckoutTimedOut(pending.groupId(), pending.guestsIn(GuestStatus.PENDING))),
                    WorkflowCommand.complete());
        }
        throw UnsupportedTransitionException.forInput(input, state);
    }

    private static List<WorkflowCommand<Output>> settle(Pending next) {
        if (!next.allSettled()) {
            return List.of();
        }
        List<String> failed = next.guestsIn(GuestStatus.FAILED);
        Output summary = failed.isEmpty()
                ? new GroupCheckoutCompleted(next.groupId(), next.guestsIn(GuestStatus.COMPLETED))
                : new GroupCheckoutFailed(next.groupId(), next.guestsIn(GuestStatus.COMPLETED), failed);
        return List.of(WorkflowCommand.publish(summary), WorkflowCommand.complete());
    }

    @Override
    public State evolve(State state, WorkflowEvent<Input, Output> event) {
        return switch (event.kind()) {
            case INITIATED_BY, RECEIVED -> apply(state, event);
            case BEGAN, REPLIED, SENT, PUBLISHED, SCHEDULED, COMPLETED -> state;
        };
    }

    private State apply(State state, WorkflowEvent<Input, Output> event) {
        Input input = event.input();
        if (state instanceof NotExisting && input instanceof InitiateGroupCheckout initiate) {
            Map<String, GuestStatus> guests = new LinkedHashMap<>();
            initiate.guestIds().forEach(id -> guests.put(id, GuestStatus.PENDING));
            return new Pending(initiate.groupId(), guests);
        }
        if (state instanceof Pending pending && input instanceof GuestCheckedOut out) {
            Pending next = pending.with(out.guestId(), GuestStatus.COMPLETED);
            return next.allSettled() ? new Finished() : next;
        }
        if (state instanceof Pending pending && input instanceof GuestCheckoutFailed failed) {
            Pending next = pending.with(failed.guestId(), GuestStatus.FAILED);
            return next.allSettled() ? new Finished() : next;
        }
        if (state instanceof Pending && input instanceof TimeoutGroupCheckout) {
            return new Finished();
        }
        throw UnsupportedTransitionException.forEvent(event, state);
    }
}
