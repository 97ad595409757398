package com.agentboard.core.subscription;

import com.agentboard.core.codec.MalformedRecordException;
import com.agentboard.core.io.ResourceLocks;
import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.model.Subscription;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionIndexTest {

    @TempDir
    Path tempDir;

    private Workspace workspace;
    private WorkspaceFiles files;
    private ResourceLocks locks;
    private final Clock clock = Clock.fixed(Instant.parse("2026-02-02T14:30:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        workspace = new Workspace(tempDir);
        files = new WorkspaceFiles(1, 0, new BoardMetrics(new SimpleMeterRegistry()));
        locks = new ResourceLocks(workspace, false);
    }

    @Test
    @DisplayName("subscribe records the time and reason")
    void subscribe() {
        var index = new SubscriptionIndex(workspace, files, locks, clock);

        assertTrue(index.subscribe("qa", "task-001"));
        assertTrue(index.subscribe("qa", "task-002", "assignment"));

        Map<String, Subscription> subs = index.subscriptions("qa");
        assertEquals(List.of("task-001", "task-002"), List.copyOf(subs.keySet()));
        assertEquals(new Subscription("2026-02-02T14:30:00", "interaction"), subs.get("task-001"));
        assertEquals("assignment", subs.get("task-002").reason());
        assertTrue(index.isSubscribed("qa", "task-002"));
        assertFalse(index.isSubscribed("pm", "task-002"));
    }

    @Test
    @DisplayName("subscribing twice keeps the original time and reason")
    void idempotent() {
        new SubscriptionIndex(workspace, files, locks, clock).subscribe("qa", "task-001", "comment");
        var later = new SubscriptionIndex(workspace, files, locks, Clock.offset(clock, Duration.ofHours(2)));

        assertFalse(later.subscribe("qa", "task-001", "assignment"));

        Subscription sub = later.subscriptions("qa").get("task-001");
        assertEquals("2026-02-02T14:30:00", sub.subscribedAt());
        assertEquals("comment", sub.reason());
    }

    @Test
    @DisplayName("writes snake_case JSON under agents/<agent>")
    void fileFormat() throws IOException {
        new SubscriptionIndex(workspace, files, locks, clock).subscribe("engineer", "task-003");

        String json = Files.readString(tempDir.resolve("agents/engineer/subscriptions.json"));
        assertTrue(json.contains("\"task-003\""));
        assertTrue(json.contains("\"subscribed_at\" : \"2026-02-02T14:30:00\""), json);
        assertTrue(json.contains("\"reason\" : \"interaction\""), json);
    }

    @Test
    @DisplayName("an agent with no file has no subscriptions")
    void emptyForUnknownAgent() {
        var index = new SubscriptionIndex(workspace, files, locks, clock);
        assertTrue(index.subscriptions("devops").isEmpty());
    }

    @Test
    @DisplayName("corrupt subscription files raise MalformedRecordException")
    void corruptFile() throws IOException {
        Path file = tempDir.resolve("agents/qa/subscriptions.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        var index = new SubscriptionIndex(workspace, files, locks, clock);
        var e = assertThrows(MalformedRecordException.class, () -> index.subscriptions("qa"));
        assertEquals(file, e.getSource());
    }
}
