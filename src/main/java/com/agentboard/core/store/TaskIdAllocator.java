package com.agentboard.core.store;

import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hands out {@code task-NNN} identifiers.
 * <p>
 * The next number is one past the larger of the highest suffix found on disk and
 * the high-water mark in {@code tasks/.sequence}, so ids stay unique even after a
 * record is deleted. Callers must hold the {@code tasks} resource.
 */
class TaskIdAllocator {

    private static final Logger log = LoggerFactory.getLogger(TaskIdAllocator.class);

    static final Pattern TASK_ID = Pattern.compile("task-(\\d+)");
    private static final Pattern TASK_FILE = Pattern.compile("task-(\\d+)\\.md");

    private final Workspace workspace;
    private final WorkspaceFiles files;

    TaskIdAllocator(Workspace workspace, WorkspaceFiles files) {
        this.workspace = workspace;
        this.files = files;
    }

    String next() {
        long highest = Math.max(highestOnDisk(), highWaterMark());
        long next = highest + 1;
        files.writeAtomically(workspace.sequenceFile(), next + "\n");
        return format(next);
    }

    static String format(long number) {
        return String.format("task-%03d", number);
    }

    static boolean isTaskId(String id) {
        return id != null && TASK_ID.matcher(id).matches();
    }

    private long highestOnDisk() {
        long max = 0;
        for (TaskStatus status : TaskStatus.values()) {
            for (Path file : files.listMarkdown(workspace.statusDir(status))) {
                Matcher m = TASK_FILE.matcher(file.getFileName().toString());
                if (m.matches()) {
                    max = Math.max(max, parse(m.group(1)));
                }
            }
        }
        return max;
    }

    private long highWaterMark() {
        return files.readIfExists(workspace.sequenceFile())
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(s -> {
                    try {
                        return Long.parseLong(s);
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring unreadable id sequence '{}' in {}", s, workspace.sequenceFile());
                        return 0L;
                    }
                })
                .orElse(0L);
    }

    private static long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return 0;  // overflows a long
        }
    }
}
