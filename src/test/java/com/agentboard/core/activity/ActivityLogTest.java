package com.agentboard.core.activity;

import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.metrics.BoardMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityLogTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-02T14:30:15Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("appends one timestamped line per event")
    void appendsLines() throws IOException {
        Workspace workspace = new Workspace(tempDir);
        ActivityLog activity = new ActivityLog(workspace,
                new WorkspaceFiles(1, 0, new BoardMetrics(new SimpleMeterRegistry())), clock);

        activity.log(ActivityLog.SYSTEM_ACTOR, "Created task task-001: Login");
        activity.log("qa", "Commented on task-001");

        assertEquals(List.of(
                "2026-02-02T14:30:15 | system | Created task task-001: Login",
                "2026-02-02T14:30:15 | qa | Commented on task-001"
        ), Files.readAllLines(workspace.activityLog()));
    }

    @Test
    @DisplayName("multi-line messages are flattened onto one line")
    void flattensNewlines() {
        String line = ActivityLog.formatLine(LocalDateTime.of(2026, 2, 2, 9, 0), "pm", "first\r\nsecond");
        assertEquals("2026-02-02T09:00:00 | pm | first second\n", line);
    }
}
