package com.agentboard.core.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A unit of work on the board, stored as one markdown record under
 * {@code tasks/<status>/<id>.md}.
 *
 * @param id          stable identifier ({@code task-001})
 * @param title       single-line title
 * @param description free text
 * @param status      current pipeline status; determines the record's directory
 * @param priority    urgency, {@code P0} highest
 * @param assigned    agents working the task, in assignment order
 * @param subscribers agents notified of activity on the task
 * @param tags        free-form labels
 * @param created     creation time
 * @param updated     last mutation time, never before {@code created}
 * @param prd         optional reference to a product requirements document
 * @param plan        optional reference to an implementation plan
 * @param pr          optional reference to a pull request
 * @param thread      comments, oldest first; append-only
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    Priority priority,
    List<String> assigned,
    List<String> subscribers,
    List<String> tags,
    LocalDateTime created,
    LocalDateTime updated,
    String prd,
    String plan,
    String pr,
    List<Comment> thread
) {
    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(priority, "priority");
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        assigned = distinct(assigned);
        subscribers = distinct(subscribers);
        tags = tags == null ? List.of() : List.copyOf(tags);
        thread = thread == null ? List.of() : List.copyOf(thread);
        prd = blankToNull(prd);
        plan = blankToNull(plan);
        pr = blankToNull(pr);
    }

    public boolean isAssignedTo(String agent) {
        return assigned.contains(agent);
    }

    public boolean isUnassigned() {
        return assigned.isEmpty();
    }

    public boolean isSubscribed(String agent) {
        return subscribers.contains(agent);
    }

    public Task withStatus(TaskStatus newStatus, LocalDateTime now) {
        return toBuilder().status(newStatus).updated(now).build();
    }

    /**
     * Appends a comment and subscribes its author.
     */
    public Task withComment(Comment comment, LocalDateTime now) {
        var newThread = new ArrayList<>(thread);
        newThread.add(comment);
        return toBuilder()
                .thread(newThread)
                .subscribers(append(subscribers, comment.agent()))
                .updated(now)
                .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    static List<String> append(List<String> values, String value) {
        if (values.contains(value)) {
            return values;
        }
        var copy = new ArrayList<>(values);
        copy.add(value);
        return copy;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(values));
    }

    /**
     * Copy-and-modify builder used by the store when applying field updates.
     */
    public static final class Builder {
        private final String id;
        private String title;
        private String description;
        private TaskStatus status;
        private Priority priority;
        private List<String> assigned;
        private List<String> subscribers;
        private List<String> tags;
        private final LocalDateTime created;
        private LocalDateTime updated;
        private String prd;
        private String plan;
        private String pr;
        private List<Comment> thread;

        private Builder(Task task) {
            this.id = task.id;
            this.title = task.title;
            this.description = task.description;
            this.status = task.status;
            this.priority = task.priority;
            this.assigned = task.assigned;
            this.subscribers = task.subscribers;
            this.tags = task.tags;
            this.created = task.created;
            this.updated = task.updated;
            this.prd = task.prd;
            this.plan = task.plan;
            this.pr = task.pr;
            this.thread = task.thread;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder status(TaskStatus status) { this.status = status; return this; }
        public Builder priority(Priority priority) { this.priority = priority; return this; }
        public Builder assigned(List<String> assigned) { this.assigned = assigned; return this; }
        public Builder subscribers(List<String> subscribers) { this.subscribers = subscribers; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder updated(LocalDateTime updated) { this.updated = updated; return this; }
        public Builder prd(String prd) { this.prd = prd; return this; }
        public Builder plan(String plan) { this.plan = plan; return this; }
        public Builder pr(String pr) { this.pr = pr; return this; }
        public Builder thread(List<Comment> thread) { this.thread = thread; return this; }

        /**
         * Builds the task, folding every assigned agent into the subscribers.
         */
        public Task build() {
            List<String> subs = subscribers == null ? List.of() : subscribers;
            if (assigned != null) {
                for (String agent : assigned) {
                    subs = append(subs, agent);
                }
            }
            return new Task(id, title, description, status, priority, assigned, subs, tags,
                    created, updated, prd, plan, pr, thread);
        }
    }
}
