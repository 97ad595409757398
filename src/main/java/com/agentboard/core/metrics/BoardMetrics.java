package com.agentboard.core.metrics;

import com.agentboard.core.model.Priority;
import com.agentboard.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for task board activity.
 */
@Service
public class BoardMetrics {

    private final MeterRegistry registry;

    public BoardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskCreated(Priority priority) {
        Counter.builder("agentboard.tasks.created")
                .tag("priority", priority.name())
                .register(registry)
                .increment();
    }

    public void recordTaskMoved(TaskStatus from, TaskStatus to) {
        Counter.builder("agentboard.tasks.moved")
                .description("Task status transitions")
                .tag("from", from.directoryName())
                .tag("to", to.directoryName())
                .register(registry)
                .increment();
    }

    public void recordComment(String agent) {
        Counter.builder("agentboard.comments.total")
                .tag("agent", agent)
                .register(registry)
                .increment();
    }

    public void recordNotificationsQueued(int count) {
        if (count <= 0) return;
        Counter.builder("agentboard.notifications.queued")
                .register(registry)
                .increment(count);
    }

    public void recordNotificationsDelivered(int count) {
        if (count <= 0) return;
        Counter.builder("agentboard.notifications.delivered")
                .register(registry)
                .increment(count);
    }

    /**
     * Records a retried file-system operation.
     *
     * @param operation "read", "write", "append", "move" or "list"
     */
    public void recordIoRetry(String operation) {
        Counter.builder("agentboard.io.retries")
                .description("File operations retried after a transient I/O failure")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
