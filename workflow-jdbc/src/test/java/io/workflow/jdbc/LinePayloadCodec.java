package io.workflow.jdbc;

import io.workflow.WorkflowCommand;
import io.workflow.WorkflowEvent;
import io.workflow.spi.PayloadCodec;

import java.time.Duration;

/**
 * Encodes string-typed events and commands as {@code E|KIND|delayMs|value} or
 * {@code C|KIND|delayMs|value}.
 */
final class LinePayloadCodec implements PayloadCodec {

    @Override
    public String encode(Object payload) {
        if (payload instanceof WorkflowEvent<?, ?> event) {
            return line("E", event.kind().name(), delayOf(event), valueOf(event));
        }
        if (payload instanceof WorkflowCommand<?> command) {
            String delay = command instanceof WorkflowCommand.Schedule<?> s ? String.valueOf(s.after().toMillis()) : "";
            String value = command.kind() == WorkflowCommand.Kind.COMPLETE ? "" : (String) command.output();
            return line("C", command.kind().name(), delay, value);
        }
        throw new IllegalArgumentException("Cannot encode " + payload);
    }

    @Override
    public Object decode(String text) {
        String[] parts = text.split("\\|", 4);
        String value = parts[3];
        Duration delay = parts[2].isEmpty() ? Duration.ZERO : Duration.ofMillis(Long.parseLong(parts[2]));
        if (parts[0].equals("C")) {
            return switch (WorkflowCommand.Kind.valueOf(parts[1])) {
                case REPLY -> WorkflowCommand.reply(value);
                case SEND -> WorkflowCommand.send(value);
                case PUBLISH -> WorkflowCommand.publish(value);
                case SCHEDULE -> WorkflowCommand.schedule(delay, value);
                case COMPLETE -> WorkflowCommand.<String>complete();
            };
        }
        return switch (WorkflowEvent.Kind.valueOf(parts[1])) {
            case BEGAN -> new WorkflowEvent.Began<String, String>();
            case INITIATED_BY -> new WorkflowEvent.InitiatedBy<String, String>(value);
            case RECEIVED -> new WorkflowEvent.Received<String, String>(value);
            case REPLIED -> new WorkflowEvent.Replied<String, String>(value);
            case SENT -> new WorkflowEvent.Sent<String, String>(value);
            case PUBLISHED -> new WorkflowEvent.Published<String, String>(value);
            case SCHEDULED -> new WorkflowEvent.Scheduled<String, String>(delay, value);
            case COMPLETED -> new WorkflowEvent.Completed<String, String>();
        };
    }

    private static String delayOf(WorkflowEvent<?, ?> event) {
        return event instanceof WorkflowEvent.Scheduled<?, ?> s ? String.valueOf(s.after().toMillis()) : "";
    }

    private static String valueOf(WorkflowEvent<?, ?> event) {
        return switch (event.kind()) {
            case INITIATED_BY, RECEIVED -> (String) event.input();
            case REPLIED, SENT, PUBLISHED, SCHEDULED -> (String) event.output();
            case BEGAN, COMPLETED -> "";
        };
    }

    private static String line(String type, String kind, String delay, String value) {
        return type + "|" + kind + "|" + delay + "|" + value;
    }
}
