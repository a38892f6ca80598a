/**
 * Spring Boot auto-configuration for the workflow engine.
 *
 * <p>{@link io.workflow.spring.boot.WorkflowAutoConfiguration} wires the store, the handler
 * registry, the processor factory and the dispatcher from {@code workflow.*} properties.
 * {@link io.workflow.spring.boot.WorkflowMicrometerAutoConfiguration} adds Micrometer metrics.
 */
package io.workflow.spring.boot;
