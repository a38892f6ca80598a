package io.workflow.spring.boot;

import io.workflow.WorkflowCommand;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one or more command types.
 *
 * <p>The annotated bean must implement {@link io.workflow.dispatch.CommandHandler}.
 *
 * <pre>{@code
 * @Component
 * @WorkflowCommandHandler(kinds = WorkflowCommand.Kind.SEND)
 * public class MailSender implements CommandHandler {
 *   public void handle(PendingCommand command) { ... }
 * }
 * }</pre>
 *
 * <p>At least one of {@link #kinds()}, {@link #types()} or {@link #fallback()} must be set.
 *
 * @see WorkflowCommandHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface WorkflowCommandHandler {

    /**
     * Command kinds handled by the bean.
     */
    WorkflowCommand.Kind[] kinds() default {};

    /**
     * Command type names handled by the bean, for payloads that are not engine commands.
     */
    String[] types() default {};

    /**
     * Whether the bean receives commands no other handler claims.
     */
    boolean fallback() default false;
}
