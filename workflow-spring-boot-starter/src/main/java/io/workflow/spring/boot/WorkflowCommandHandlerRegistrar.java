package io.workflow.spring.boot;

import io.workflow.WorkflowCommand;
import io.workflow.dispatch.CommandHandler;
import io.workflow.dispatch.CommandHandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;

/**
 * Scans for beans annotated with {@link WorkflowCommandHandler} and registers them in the
 * {@link CommandHandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * before the dispatcher starts polling.
 */
public class WorkflowCommandHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final CommandHandlerRegistry registry;

    public WorkflowCommandHandlerRegistrar(ListableBeanFactory beanFactory, CommandHandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(WorkflowCommandHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof CommandHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @WorkflowCommandHandler must implement CommandHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation from getAnnotation
            WorkflowCommandHandler annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), WorkflowCommandHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @WorkflowCommandHandler annotation on " + bean.getClass().getName());
            }
            if (annotation.kinds().length == 0 && annotation.types().length == 0 && !annotation.fallback()) {
                throw new BeanCreationException(beanName,
                        "@WorkflowCommandHandler must specify kinds, types or fallback");
            }

            try {
                for (WorkflowCommand.Kind kind : annotation.kinds()) {
                    registry.register(kind, handler);
                }
                for (String type : annotation.types()) {
                    registry.register(type, handler);
                }
                if (annotation.fallback()) {
                    registry.fallback(handler);
                }
            } catch (IllegalStateException e) {
                throw new BeanCreationException(beanName, e.getMessage(), e);
            }
        }
    }
}
