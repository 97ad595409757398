package com.agentboard.core.io;

import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceFilesTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private WorkspaceFiles files;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        files = new WorkspaceFiles(3, 0, new BoardMetrics(registry));
    }

    // ── Reads and writes ─────────────────────────────────────────────

    @Nested
    @DisplayName("file operations")
    class Operations {

        @Test
        @DisplayName("writeAtomically creates parent directories and leaves no temp file")
        void writeAtomically() throws IOException {
            Path target = tempDir.resolve("tasks/inbox/task-001.md");
            files.writeAtomically(target, "first");
            files.writeAtomically(target, "second");

            assertEquals("second", Files.readString(target));
            try (var listing = Files.list(target.getParent())) {
                assertEquals(List.of(target), listing.toList());
            }
        }

        @Test
        @DisplayName("readIfExists is empty for a missing file")
        void readIfExists() {
            assertTrue(files.readIfExists(tempDir.resolve("missing.md")).isEmpty());
            files.writeAtomically(tempDir.resolve("present.md"), "x");
            assertEquals("x", files.readIfExists(tempDir.resolve("present.md")).orElseThrow());
        }

        @Test
        @DisplayName("append adds to the end of a file")
        void append() throws IOException {
            Path log = tempDir.resolve("activity.log");
            files.append(log, "one\n");
            files.append(log, "two\n");
            assertEquals("one\ntwo\n", Files.readString(log));
        }

        @Test
        @DisplayName("move relocates a file into a new directory")
        void move() throws IOException {
            Path source = tempDir.resolve("tasks/inbox/task-001.md");
            Path target = tempDir.resolve("tasks/blocked/task-001.md");
            files.writeAtomically(source, "record");

            files.move(source, target);

            assertFalse(Files.exists(source));
            assertEquals("record", Files.readString(target));
        }

        @Test
        @DisplayName("listMarkdown returns visible markdown files sorted by name")
        void listMarkdown() throws IOException {
            Path dir = tempDir.resolve("tasks/inbox");
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("task-010.md"), "");
            Files.writeString(dir.resolve("task-002.md"), "");
            Files.writeString(dir.resolve(".task-003.md.tmp"), "");
            Files.writeString(dir.resolve(".hidden.md"), "");
            Files.writeString(dir.resolve("notes.txt"), "");

            assertEquals(List.of(dir.resolve("task-002.md"), dir.resolve("task-010.md")), files.listMarkdown(dir));
            assertTrue(files.listMarkdown(tempDir.resolve("nope")).isEmpty());
        }

        @Test
        @DisplayName("reading a missing file raises StorageException without retrying")
        void missingFile() {
            var e = assertThrows(StorageException.class, () -> files.read(tempDir.resolve("missing.md")));
            assertInstanceOf(NoSuchFileException.class, e.getCause());
            assertNull(registry.find("agentboard.io.retries").counter());
        }
    }

    // ── Retry ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("withRetry")
    class Retry {

        @Test
        @DisplayName("retries transient failures and records each retry")
        void retriesTransientFailure() {
            var calls = new AtomicInteger();
            String result = files.withRetry("read", tempDir, () -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IOException("device busy");
                }
                return "ok";
            });

            assertEquals("ok", result);
            assertEquals(3, calls.get());
            assertEquals(2.0, registry.find("agentboard.io.retries").tag("operation", "read").counter().count());
        }

        @Test
        @DisplayName("gives up after the configured number of attempts")
        void givesUp() {
            var calls = new AtomicInteger();
            var e = assertThrows(StorageException.class, () -> files.withRetry("write", tempDir, () -> {
                calls.incrementAndGet();
                throw new IOException("disk full");
            }));

            assertEquals(3, calls.get());
            assertTrue(e.getMessage().contains("after 3 attempt(s)"), e.getMessage());
            assertInstanceOf(IOException.class, e.getCause());
        }

        @Test
        @DisplayName("does not retry a missing file")
        void permanentFailure() {
            var calls = new AtomicInteger();
            assertThrows(StorageException.class, () -> files.withRetry("read", tempDir, () -> {
                calls.incrementAndGet();
                throw new NoSuchFileException("gone");
            }));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("rejects fewer than one attempt")
        void invalidAttempts() {
            assertThrows(IllegalArgumentException.class,
                    () -> new WorkspaceFiles(0, 0, new BoardMetrics(registry)));
        }
    }

    // ── Layout ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Workspace layout")
    class Layout {

        @Test
        @DisplayName("resolves record, ledger and subscription paths under the root")
        void paths() {
            Workspace ws = new Workspace(tempDir.resolve("workspace"));
            assertEquals(ws.root().resolve("tasks/ready-to-build/task-001.md"),
                    ws.taskFile(TaskStatus.READY_TO_BUILD, "task-001"));
            assertEquals(ws.root().resolve("notifications.md"), ws.notificationsFile());
            assertEquals(ws.root().resolve("agents/qa/subscriptions.json"), ws.subscriptionsFile("qa"));
            assertEquals(ws.root().resolve("tasks/.sequence"), ws.sequenceFile());
        }

        @Test
        @DisplayName("links are prefixed with the workspace directory name")
        void link() {
            Workspace ws = new Workspace(tempDir.resolve("workspace"));
            assertEquals("workspace/tasks/in-qa/task-004.md", ws.link(TaskStatus.IN_QA, "task-004"));
        }

        @Test
        @DisplayName("agent names that could escape the workspace are rejected")
        void agentNames() {
            Workspace ws = new Workspace(tempDir);
            assertTrue(Workspace.isValidAgentName("engineer-2"));
            assertFalse(Workspace.isValidAgentName(""));
            assertFalse(Workspace.isValidAgentName(null));
            assertThrows(IllegalArgumentException.class, () -> ws.subscriptionsFile("../etc"));
            assertThrows(IllegalArgumentException.class, () -> ws.subscriptionsFile("a/b"));
        }
    }
}
