package com.agentboard.core.health;

import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkspaceHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private final WorkspaceFiles files = new WorkspaceFiles(1, 0, new BoardMetrics(new SimpleMeterRegistry()));

    @Test
    @DisplayName("DOWN when the workspace does not exist")
    void missingWorkspace() {
        var indicator = new WorkspaceHealthIndicator(new Workspace(tempDir.resolve("absent")), files);
        Health health = indicator.health();
        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(health.getDetails().get("reason").toString().contains("workspace root"));
    }

    @Test
    @DisplayName("DOWN when the tasks directory is missing")
    void missingTasksDir() {
        var indicator = new WorkspaceHealthIndicator(new Workspace(tempDir), files);
        Health health = indicator.health();
        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(health.getDetails().get("reason").toString().contains("tasks directory"));
    }

    @Test
    @DisplayName("UP with per-status counts")
    @SuppressWarnings("unchecked")
    void up() throws IOException {
        Workspace workspace = new Workspace(tempDir);
        Files.createDirectories(workspace.statusDir(TaskStatus.INBOX));
        Files.writeString(workspace.taskFile(TaskStatus.INBOX, "task-001"), "");
        Files.writeString(workspace.taskFile(TaskStatus.INBOX, "task-002"), "");

        Health health = new WorkspaceHealthIndicator(workspace, files).health();

        assertEquals(Status.UP, health.getStatus());
        var counts = (Map<String, Integer>) health.getDetails().get("tasks");
        assertEquals(2, counts.get("inbox"));
        assertEquals(0, counts.get("blocked"));
        assertEquals(2, health.getDetails().get("total"));
    }

    @Test
    @DisplayName("DOWN with the error when listing fails")
    void listingFails() throws IOException {
        Workspace workspace = new Workspace(tempDir);
        Files.createDirectories(workspace.tasksDir());
        WorkspaceFiles failing = mock(WorkspaceFiles.class);
        when(failing.listMarkdown(any())).thenThrow(new IllegalStateException("io down"));

        Health health = new WorkspaceHealthIndicator(workspace, failing).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(health.getDetails().get("error").toString().contains("io down"));
    }
}
