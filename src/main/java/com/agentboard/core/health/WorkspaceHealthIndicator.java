package com.agentboard.core.health;

import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.model.TaskStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Actuator health indicator for the board workspace.
 * <p>
 * Reports UP when the workspace root and its {@code tasks} directory exist and
 * are writable, with the number of records per status. DOWN otherwise.
 */
@Component("workspaceHealthIndicator")
public class WorkspaceHealthIndicator implements HealthIndicator {

    private final Workspace workspace;
    private final WorkspaceFiles files;

    public WorkspaceHealthIndicator(Workspace workspace, WorkspaceFiles files) {
        this.workspace = workspace;
        this.files = files;
    }

    @Override
    public Health health() {
        Path root = workspace.root();
        Path tasks = workspace.tasksDir();
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return Health.down().withDetail("workspace", root.toString())
                    .withDetail("reason", "workspace root missing or not writable").build();
        }
        if (!Files.isDirectory(tasks) || !Files.isWritable(tasks)) {
            return Health.down().withDetail("workspace", root.toString())
                    .withDetail("reason", "tasks directory missing or not writable").build();
        }

        var counts = new LinkedHashMap<String, Integer>();
        int total = 0;
        try {
            for (TaskStatus status : TaskStatus.values()) {
                int count = files.listMarkdown(workspace.statusDir(status)).size();
                counts.put(status.directoryName(), count);
                total += count;
            }
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("workspace", root.toString()).build();
        }

        return Health.up()
                .withDetail("workspace", root.toString())
                .withDetail("tasks", counts)
                .withDetail("total", total)
                .build();
    }
}
