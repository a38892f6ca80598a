package io.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps a decision to the events that record it.
 *
 * <p>A decision on a new workflow is recorded as {@code [Began, InitiatedBy(input)]}, one
 * on an existing workflow as {@code [Received(input)]}. Each command then contributes its
 * past-tense counterpart in the same order.
 */
public final class WorkflowTranslator {

    private WorkflowTranslator() {
    }

    /**
     * @param begins   whether {@code input} is the first message of the workflow
     * @param input    the message the decision was made for
     * @param commands the commands returned by {@link Workflow#decide}
     * @return an unmodifiable list of {@code (begins ? 2 : 1) + commands.size()} events
     */
    public static <I, O> List<WorkflowEvent<I, O>> translate(
            boolean begins, I input, List<WorkflowCommand<O>> commands) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(commands, "commands");

        List<WorkflowEvent<I, O>> events = new ArrayList<>(commands.size() + 2);
        if (begins) {
            events.add(new WorkflowEvent.Began<>());
            events.add(new WorkflowEvent.InitiatedBy<>(input));
        } else {
            events.add(new WorkflowEvent.Received<>(input));
        }
        for (WorkflowCommand<O> command : commands) {
            events.add(toEvent(command));
        }
        return Collections.unmodifiableList(events);
    }

    /**
     * Returns the event recorded for a single command.
     */
    public static <I, O> WorkflowEvent<I, O> toEvent(WorkflowCommand<O> command) {
        Objects.requireNonNull(command, "command");
        return switch (command.kind()) {
            case REPLY -> new WorkflowEvent.Replied<>(command.output());
            case SEND -> new WorkflowEvent.Sent<>(command.output());
            case PUBLISH -> new WorkflowEvent.Published<>(command.output());
            case SCHEDULE -> {
                WorkflowCommand.Schedule<O> schedule = (WorkflowCommand.Schedule<O>) command;
                yield new WorkflowEvent.Scheduled<>(schedule.after(), schedule.output());
            }
            case COMPLETE -> new WorkflowEvent.Completed<>();
        };
    }
}
