package com.phillippitts.sessioncore.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Copies the submitting thread's Log4j2 ThreadContext onto the thread that runs the task, and
 * restores the worker's own context afterwards.
 *
 * <p>Used by the upload executor and, through {@code AckCoordinator}, by acknowledgment timeouts
 * ({@code ThreadPoolTaskScheduler} has no decorator hook in this Spring line).
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
