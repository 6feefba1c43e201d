package com.phillippitts.sessioncore.config.properties;

import com.phillippitts.sessioncore.domain.PriorityLevel;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the priority queue.
 */
@Validated
@ConfigurationProperties(prefix = "queue")
public class QueueProperties {

    /**
     * Bucket assigned by {@code enqueue} when the caller does not name one. Default: LOW (10).
     */
    @Min(0)
    private final int defaultPriority;

    @ConstructorBinding
    public QueueProperties(Integer defaultPriority) {
        this.defaultPriority = defaultPriority == null ? PriorityLevel.LOW.value() : defaultPriority;
    }

    /**
     * Defaults for tests.
     */
    public QueueProperties() {
        this(null);
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }
}
