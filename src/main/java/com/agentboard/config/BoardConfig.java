package com.agentboard.config;

import com.agentboard.core.activity.ActivityLog;
import com.agentboard.core.codec.TaskRecordCodec;
import com.agentboard.core.io.ResourceLocks;
import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.notification.NotificationLedger;
import com.agentboard.core.store.TaskStore;
import com.agentboard.core.subscription.SubscriptionIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the board components against the configured workspace directory.
 */
@Configuration
public class BoardConfig {

    private static final Logger log = LoggerFactory.getLogger(BoardConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Workspace workspace(BoardProperties properties) {
        Workspace workspace = new Workspace(Path.of(properties.getWorkspace()));
        log.info("Using board workspace {}", workspace.root());
        return workspace;
    }

    @Bean
    public WorkspaceFiles workspaceFiles(BoardProperties properties, BoardMetrics metrics) {
        return new WorkspaceFiles(properties.getIo().getMaxAttempts(), properties.getIo().getBackoffMillis(), metrics);
    }

    @Bean
    public ResourceLocks resourceLocks(Workspace workspace, BoardProperties properties) {
        return new ResourceLocks(workspace, properties.getLocking().isFileLocks());
    }

    @Bean
    public TaskRecordCodec taskRecordCodec() {
        return new TaskRecordCodec();
    }

    @Bean
    public ActivityLog activityLog(Workspace workspace, WorkspaceFiles files, Clock clock) {
        return new ActivityLog(workspace, files, clock);
    }

    @Bean
    public SubscriptionIndex subscriptionIndex(Workspace workspace, WorkspaceFiles files,
                                               ResourceLocks locks, Clock clock) {
        return new SubscriptionIndex(workspace, files, locks, clock);
    }

    @Bean
    public NotificationLedger notificationLedger(Workspace workspace, WorkspaceFiles files, ResourceLocks locks,
                                                 Clock clock, BoardMetrics metrics) {
        return new NotificationLedger(workspace, files, locks, clock, metrics);
    }

    @Bean
    public TaskStore taskStore(Workspace workspace, TaskRecordCodec codec, WorkspaceFiles files, ResourceLocks locks,
                               ActivityLog activityLog, NotificationLedger notificationLedger,
                               SubscriptionIndex subscriptionIndex, BoardMetrics metrics, Clock clock,
                               BoardProperties properties) {
        return new TaskStore(workspace, codec, files, locks, activityLog, notificationLedger,
                subscriptionIndex, metrics, clock, properties);
    }
}
