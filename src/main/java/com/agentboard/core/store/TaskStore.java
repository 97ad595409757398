package com.agentboard.core.store;

import com.agentboard.config.BoardProperties;
import com.agentboard.core.activity.ActivityLog;
import com.agentboard.core.codec.TaskRecordCodec;
import com.agentboard.core.io.ResourceLocks;
import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.logging.MdcContext;
import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.model.AgentRole;
import com.agentboard.core.model.Comment;
import com.agentboard.core.model.Notification;
import com.agentboard.core.model.Priority;
import com.agentboard.core.model.Task;
import com.agentboard.core.model.TaskStatus;
import com.agentboard.core.notification.NotificationLedger;
import com.agentboard.core.subscription.MentionMatching;
import com.agentboard.core.subscription.SubscriptionIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The task board. Each task is one markdown record whose directory under
 * {@code tasks/} is its status.
 * <p>
 * Every mutation runs under the {@code tasks} resource lock: locate the record,
 * decode it, apply the change, encode and write it atomically, then append to
 * the activity log. Comments additionally fan out notifications to the task's
 * subscribers. Reads take no lock; they see either the old or the new version of
 * a record because records are only ever replaced by rename.
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    static final String TASKS_RESOURCE = "tasks";

    static final Set<String> UPDATABLE_FIELDS = Set.of(
            "title", "description", "priority", "assigned", "subscribers", "tags", "prd", "plan", "pr");

    private final Workspace workspace;
    private final TaskRecordCodec codec;
    private final WorkspaceFiles files;
    private final ResourceLocks locks;
    private final ActivityLog activity;
    private final NotificationLedger notifications;
    private final SubscriptionIndex subscriptions;
    private final BoardMetrics metrics;
    private final Clock clock;
    private final TaskIdAllocator ids;
    private final int previewLength;
    private final MentionMatching mentionMatching;
    private final UnknownFieldPolicy unknownFieldPolicy;

    public TaskStore(Workspace workspace, TaskRecordCodec codec, WorkspaceFiles files, ResourceLocks locks,
                     ActivityLog activity, NotificationLedger notifications, SubscriptionIndex subscriptions,
                     BoardMetrics metrics, Clock clock, BoardProperties properties) {
        this.workspace = workspace;
        this.codec = codec;
        this.files = files;
        this.locks = locks;
        this.activity = activity;
        this.notifications = notifications;
        this.subscriptions = subscriptions;
        this.metrics = metrics;
        this.clock = clock;
        this.ids = new TaskIdAllocator(workspace, files);
        this.previewLength = properties.getNotification().getPreviewLength();
        this.mentionMatching = properties.getMentions().getMatching();
        this.unknownFieldPolicy = properties.getUpdates().getUnknownFields();
    }

    /** A record on disk together with the directory it was found in. */
    private record Located(Path path, TaskStatus status, Task task) {}

    // ── Create ──────────────────────────────────────────────────────

    public Task createTask(String title, String description) {
        return createTask(title, description, Priority.P2, List.of());
    }

    /**
     * Creates a task in {@code inbox} under the next free id.
     *
     * @throws IllegalArgumentException if the title is blank or spans several lines
     */
    public Task createTask(String title, String description, Priority priority, List<String> tags) {
        String cleanTitle = requireTitle(title);
        String cleanDescription = freeText(description);
        Priority effectivePriority = priority == null ? Priority.P2 : priority;

        Task task = locks.withExclusive(TASKS_RESOURCE, () -> {
            String id = ids.next();
            LocalDateTime now = now();
            Task created = new Task(id, cleanTitle, cleanDescription, TaskStatus.INBOX, effectivePriority,
                    List.of(), List.of(), tags, now, now, null, null, null, List.of());
            files.writeAtomically(workspace.taskFile(TaskStatus.INBOX, id), codec.encode(created));
            activity.log(ActivityLog.SYSTEM_ACTOR, "Created task " + id + ": " + cleanTitle);
            return created;
        });

        metrics.recordTaskCreated(effectivePriority);
        MdcContext.setTask(task.id());
        try {
            log.info("Created {} ({}): {}", task.id(), effectivePriority, cleanTitle);
        } finally {
            MdcContext.clear();
        }
        return task;
    }

    // ── Lookup ──────────────────────────────────────────────────────

    /**
     * Looks a task up by id, scanning the pipeline statuses in order and then
     * {@code blocked}. Ids that are not of the form {@code task-<digits>} are
     * never found.
     */
    public Optional<Task> findTask(String taskId) {
        return locate(taskId).map(Located::task);
    }

    /**
     * @throws TaskNotFoundException if no status directory holds the task
     */
    public Task getTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Every task, in status order and file-name order within a status. */
    public List<Task> listTasks() {
        var tasks = new ArrayList<Task>();
        for (TaskStatus status : TaskStatus.values()) {
            tasks.addAll(listTasks(status));
        }
        return tasks;
    }

    public List<Task> listTasks(TaskStatus status) {
        var tasks = new ArrayList<Task>();
        for (Path file : files.listMarkdown(workspace.statusDir(status))) {
            tasks.add(decode(file, status, files.read(file)));
        }
        return tasks;
    }

    /**
     * Tasks whose raw record text mentions {@code @agent} anywhere: title,
     * description, frontmatter or thread.
     */
    public List<Task> findMentions(String agent) {
        Workspace.requireAgentName(agent);
        var mentioned = new ArrayList<Task>();
        for (TaskStatus status : TaskStatus.values()) {
            for (Path file : files.listMarkdown(workspace.statusDir(status))) {
                String content = files.read(file);
                if (mentionMatching.mentions(content, agent)) {
                    mentioned.add(decode(file, status, content));
                }
            }
        }
        return mentioned;
    }

    /**
     * Picks the next task for an agent: the first task assigned to it, else the
     * first task mentioning it, else the first unassigned task in the status its
     * role draws from. Roles without a queue only get the first two.
     */
    public Optional<Task> findWork(String role) {
        Workspace.requireAgentName(role);
        List<Task> all = listTasks();

        Optional<Task> assigned = all.stream().filter(t -> t.isAssignedTo(role)).findFirst();
        if (assigned.isPresent()) {
            log.debug("Work for {}: assigned {}", role, assigned.get().id());
            return assigned;
        }

        List<Task> mentions = findMentions(role);
        if (!mentions.isEmpty()) {
            log.debug("Work for {}: mentioned in {}", role, mentions.get(0).id());
            return Optional.of(mentions.get(0));
        }

        Optional<AgentRole> agentRole = AgentRole.fromName(role);
        if (agentRole.isEmpty()) {
            return Optional.empty();
        }
        Optional<Task> queued = listTasks(agentRole.get().queue()).stream()
                .filter(Task::isUnassigned)
                .findFirst();
        queued.ifPresent(t -> log.debug("Work for {}: unassigned {} in {}", role, t.id(), t.status()));
        return queued;
    }

    // ── Mutations ───────────────────────────────────────────────────

    /**
     * Applies field updates to a task and rewrites it in place.
     * <p>
     * Accepted fields: {@code title}, {@code description}, {@code priority}
     * ({@link Priority} or its label), {@code assigned}, {@code subscribers},
     * {@code tags} (collections of strings), {@code prd}, {@code plan},
     * {@code pr}. Any other name, including {@code id}, {@code status},
     * {@code created}, {@code updated} and {@code thread}, is handled by the
     * configured {@link UnknownFieldPolicy}. Assigned agents are always kept
     * among the subscribers.
     *
     * @throws TaskNotFoundException    if the task does not exist
     * @throws IllegalArgumentException if a value has the wrong type, or a field
     *                                  is rejected under {@link UnknownFieldPolicy#REJECT}
     */
    public Task updateTask(String taskId, Map<String, ?> fieldUpdates) {
        return withTaskContext(taskId, null,
                () -> locks.withExclusive(TASKS_RESOURCE, () -> applyUpdates(taskId, fieldUpdates)));
    }

    private Task applyUpdates(String taskId, Map<String, ?> fieldUpdates) {
        Located current = require(taskId);
        Task.Builder builder = current.task().toBuilder();

        for (Map.Entry<String, ?> entry : fieldUpdates.entrySet()) {
            String field = entry.getKey();
            if (!UPDATABLE_FIELDS.contains(field)) {
                if (unknownFieldPolicy == UnknownFieldPolicy.REJECT) {
                    throw new IllegalArgumentException("Field '" + field + "' cannot be updated on " + taskId);
                }
                log.warn("Ignoring update of field '{}' on {}", field, taskId);
                continue;
            }
            apply(builder, field, entry.getValue());
        }

        Task updated = builder.updated(touch(current.task())).build();
        write(current.path(), updated);
        log.debug("Updated {} fields {}", taskId, fieldUpdates.keySet());
        return updated;
    }

    public Task moveTask(String taskId, String statusName) {
        return moveTask(taskId, TaskStatus.fromDirectoryName(statusName));
    }

    /**
     * Moves a task to another status directory. The record is renamed into the
     * new directory and then rewritten there, so at no point do two copies exist.
     * Moving a task to the status it already has rewrites it in place.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public Task moveTask(String taskId, TaskStatus newStatus) {
        return withTaskContext(taskId, null, () -> {
            Located result = locks.withExclusive(TASKS_RESOURCE, () -> {
                Located current = require(taskId);
                Path target = workspace.taskFile(newStatus, taskId);
                if (!current.path().equals(target)) {
                    files.move(current.path(), target);
                }
                Task moved = current.task().withStatus(newStatus, touch(current.task()));
                write(target, moved);
                activity.log(ActivityLog.SYSTEM_ACTOR,
                        "Moved " + taskId + " from " + current.status() + " to " + newStatus);
                return new Located(target, current.status(), moved);
            });
            metrics.recordTaskMoved(result.status(), newStatus);
            log.info("Moved {} from {} to {}", taskId, result.status(), newStatus);
            return result.task();
        });
    }

    /**
     * Appends a comment to a task's thread, subscribes the author and queues a
     * notification for every other subscriber.
     *
     * @throws TaskNotFoundException    if the task does not exist
     * @throws IllegalArgumentException if the agent name is invalid
     */
    public Task addComment(String taskId, String agent, String message) {
        Workspace.requireAgentName(agent);
        String text = freeText(message);

        return withTaskContext(taskId, agent, () -> {
            Task commented = locks.withExclusive(TASKS_RESOURCE, () -> {
                Located current = require(taskId);
                LocalDateTime now = touch(current.task());
                Task updated = current.task().withComment(new Comment(now, agent, text), now);
                write(current.path(), updated);
                activity.log(agent, "Commented on " + taskId);
                notifySubscribers(updated, agent, text);
                subscriptions.subscribe(agent, taskId, "comment");
                return updated;
            });
            metrics.recordComment(agent);
            log.info("{} commented on {}", agent, taskId);
            return commented;
        });
    }

    /**
     * Adds an agent to a task's assignees and subscribers. Assigning an agent
     * that is already assigned changes nothing.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public Task assignTask(String taskId, String agent) {
        Workspace.requireAgentName(agent);
        return withTaskContext(taskId, agent, () -> locks.withExclusive(TASKS_RESOURCE, () -> {
            Task current = getTask(taskId);
            if (current.isAssignedTo(agent)) {
                log.debug("{} already assigned to {}", taskId, agent);
                return current;
            }
            var assigned = new ArrayList<>(current.assigned());
            assigned.add(agent);
            Task updated = applyUpdates(taskId, Map.of("assigned", assigned));
            subscriptions.subscribe(agent, taskId, "assignment");
            activity.log(ActivityLog.SYSTEM_ACTOR, "Assigned " + taskId + " to " + agent);
            log.info("Assigned {} to {}", taskId, agent);
            return updated;
        }));
    }

    // ── Internals ───────────────────────────────────────────────────

    private void notifySubscribers(Task task, String author, String message) {
        String preview = preview(message);
        String link = workspace.link(task.status(), task.id());
        LocalDateTime time = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        var pending = new ArrayList<Notification>();
        for (String subscriber : task.subscribers()) {
            if (!subscriber.equals(author)) {
                pending.add(Notification.pending(subscriber, author, preview, time, task.id(), link));
            }
        }
        notifications.addNotifications(pending);
    }

    String preview(String message) {
        if (message.length() <= previewLength) {
            return message;
        }
        return message.substring(0, previewLength) + "...";
    }

    private Optional<Located> locate(String taskId) {
        if (!TaskIdAllocator.isTaskId(taskId)) {
            return Optional.empty();
        }
        for (TaskStatus status : TaskStatus.values()) {
            Path file = workspace.taskFile(status, taskId);
            Optional<String> content = files.readIfExists(file);
            if (content.isPresent()) {
                return Optional.of(new Located(file, status, decode(file, status, content.get())));
            }
        }
        return Optional.empty();
    }

    private Located require(String taskId) {
        return locate(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private Task decode(Path file, TaskStatus directory, String content) {
        Task task = codec.decode(content, file);
        if (task.status() != directory) {
            log.warn("{} says status {} but is stored in {}; using {}",
                    file.getFileName(), task.status(), directory, directory);
            return task.toBuilder().status(directory).build();
        }
        return task;
    }

    private void write(Path file, Task task) {
        files.writeAtomically(file, codec.encode(task));
    }

    private void apply(Task.Builder builder, String field, Object value) {
        switch (field) {
            case "title" -> builder.title(requireTitle(asString(field, value)));
            case "description" -> builder.description(freeText(asString(field, value)));
            case "priority" -> builder.priority(asPriority(value));
            case "assigned" -> {
                List<String> agents = asStringList(field, value);
                agents.forEach(Workspace::requireAgentName);
                builder.assigned(agents);
            }
            case "subscribers" -> {
                List<String> agents = asStringList(field, value);
                agents.forEach(Workspace::requireAgentName);
                builder.subscribers(agents);
            }
            case "tags" -> builder.tags(asStringList(field, value));
            case "prd" -> builder.prd(asReference(field, value));
            case "plan" -> builder.plan(asReference(field, value));
            case "pr" -> builder.pr(asReference(field, value));
            default -> throw new IllegalStateException("Unhandled field " + field);
        }
    }

    private static String asString(String field, Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException("Field '" + field + "' expects text, got " + value.getClass().getSimpleName());
    }

    /** A single-line frontmatter value; null or blank clears the reference. */
    private static String asReference(String field, Object value) {
        String text = asString(field, value);
        if (text == null || text.isBlank()) {
            return null;
        }
        if (text.contains("\n") || text.contains("\r")) {
            throw new IllegalArgumentException("Field '" + field + "' must be a single line");
        }
        return text.strip();
    }

    private static Priority asPriority(Object value) {
        if (value instanceof Priority priority) {
            return priority;
        }
        if (value instanceof String label) {
            return Priority.fromLabel(label);
        }
        throw new IllegalArgumentException("Field 'priority' expects P0..P3, got " + value);
    }

    private static List<String> asStringList(String field, Object value) {
        if (!(value instanceof Collection<?> values)) {
            throw new IllegalArgumentException("Field '" + field + "' expects a list, got " + value);
        }
        var result = new ArrayList<String>(values.size());
        for (Object element : values) {
            if (!(element instanceof String s)) {
                throw new IllegalArgumentException("Field '" + field + "' expects strings, got " + element);
            }
            result.add(s);
        }
        return result;
    }

    /** Description and comment text: {@code \n} line endings, no surrounding whitespace. */
    private static String freeText(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n').strip();
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title must not be blank");
        }
        String stripped = title.strip();
        if (stripped.contains("\n") || stripped.contains("\r")) {
            throw new IllegalArgumentException("Task title must be a single line");
        }
        return stripped;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    /** The new {@code updated} time for a task, never earlier than its creation. */
    private LocalDateTime touch(Task task) {
        LocalDateTime now = now();
        return task.created() != null && now.isBefore(task.created()) ? task.created() : now;
    }

    private static <T> T withTaskContext(String taskId, String agent, Supplier<T> action) {
        MdcContext.setTask(taskId, agent);
        try {
            return action.get();
        } finally {
            MdcContext.clear();
        }
    }
}
