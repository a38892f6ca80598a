/**
 * Decider-pattern workflow engine.
 *
 * <p>A {@link io.workflow.Workflow} is three pure functions over a state type:
 * <ul>
 *   <li>{@code decide(input, state)} returns the {@link io.workflow.WorkflowCommand}s to issue,</li>
 *   <li>{@link io.workflow.WorkflowTranslator} turns the input and those commands into
 *       {@link io.workflow.WorkflowEvent}s,</li>
 *   <li>{@code evolve(state, event)} folds each event into the next state.</li>
 * </ul>
 *
 * <p>{@link io.workflow.WorkflowOrchestrator} runs that pipeline on in-memory snapshots.
 * {@link io.workflow.WorkflowProcessor} runs it against a {@link io.workflow.spi.WorkflowStore},
 * rebuilding state from stored events and recording the new events and pending commands.
 * A {@link io.workflow.dispatch.CommandDispatcher} then delivers the pending commands.
 *
 * <h2>Quick start</h2>
 * <pre>{@code
 * WorkflowStore store = new InMemoryWorkflowStore();
 * WorkflowProcessor<Input, State, Output> processor = WorkflowProcessor.<Input, State, Output>builder()
 *     .workflow(new ApprovalWorkflow())
 *     .store(store)
 *     .build();
 *
 * processor.process("order-42", new Input.Submit("order-42"));
 *
 * CommandDispatcher dispatcher = CommandDispatcher.builder()
 *     .store(store)
 *     .handlers(new CommandHandlerRegistry().register(WorkflowCommand.Kind.SEND, bus::send))
 *     .build();
 * dispatcher.start();
 * }</pre>
 */
package io.workflow;
