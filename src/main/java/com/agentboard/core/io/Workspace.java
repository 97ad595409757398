package com.agentboard.core.io;

import com.agentboard.core.model.TaskStatus;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Explicit handle on a board workspace and the layout beneath it:
 * <pre>
 * &lt;root&gt;/tasks/&lt;status&gt;/&lt;task-id&gt;.md
 * &lt;root&gt;/tasks/.sequence
 * &lt;root&gt;/activity.log
 * &lt;root&gt;/notifications.md
 * &lt;root&gt;/agents/&lt;agent&gt;/subscriptions.json
 * &lt;root&gt;/.locks/&lt;resource&gt;.lock
 * </pre>
 */
public final class Workspace {

    /** Agent names become directory names, so keep them to a safe alphabet. */
    private static final Pattern AGENT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final Path root;

    public Workspace(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path tasksDir() {
        return root.resolve("tasks");
    }

    public Path statusDir(TaskStatus status) {
        return tasksDir().resolve(status.directoryName());
    }

    public Path taskFile(TaskStatus status, String taskId) {
        return statusDir(status).resolve(taskId + ".md");
    }

    public Path sequenceFile() {
        return tasksDir().resolve(".sequence");
    }

    public Path activityLog() {
        return root.resolve("activity.log");
    }

    public Path notificationsFile() {
        return root.resolve("notifications.md");
    }

    public Path subscriptionsFile(String agent) {
        requireAgentName(agent);
        return root.resolve("agents").resolve(agent).resolve("subscriptions.json");
    }

    public Path locksDir() {
        return root.resolve(".locks");
    }

    /**
     * Link to a task record as written into notifications, relative to the
     * workspace's parent directory (e.g. {@code workspace/tasks/inbox/task-001.md}).
     */
    public String link(TaskStatus status, String taskId) {
        Path name = root.getFileName();
        String prefix = name == null ? "" : name + "/";
        return prefix + "tasks/" + status.directoryName() + "/" + taskId + ".md";
    }

    public static boolean isValidAgentName(String agent) {
        return agent != null && AGENT_NAME.matcher(agent).matches();
    }

    public static String requireAgentName(String agent) {
        if (!isValidAgentName(agent)) {
            throw new IllegalArgumentException("Invalid agent name: '" + agent + "'");
        }
        return agent;
    }

    @Override
    public String toString() {
        return "Workspace[" + root + "]";
    }
}
