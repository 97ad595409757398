package com.agentboard.core.notification;

import com.agentboard.core.io.ResourceLocks;
import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.metrics.BoardMetrics;
import com.agentboard.core.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The shared {@code notifications.md} ledger that agents check on startup.
 * <p>
 * New notifications go to the head of the Pending section, so pending entries
 * read most-recent-first. Acknowledged entries move to the end of the Delivered
 * section with a delivery time. Every change is a parse, modify, render, atomic
 * write cycle under the {@code notifications} resource lock.
 */
public class NotificationLedger {

    private static final Logger log = LoggerFactory.getLogger(NotificationLedger.class);

    static final String RESOURCE = "notifications";

    private final Workspace workspace;
    private final WorkspaceFiles files;
    private final ResourceLocks locks;
    private final Clock clock;
    private final BoardMetrics metrics;

    public NotificationLedger(Workspace workspace, WorkspaceFiles files, ResourceLocks locks,
                              Clock clock, BoardMetrics metrics) {
        this.workspace = workspace;
        this.files = files;
        this.locks = locks;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Queues a notification for {@code to}.
     *
     * @param taskId related task, may be null
     * @param link   link to the related record, may be null
     * @throws IllegalArgumentException if {@code to} or {@code from} is not a valid agent name
     */
    public Notification addNotification(String to, String from, String message, String taskId, String link) {
        Workspace.requireAgentName(to);
        Workspace.requireAgentName(from);
        Notification notification = Notification.pending(to, from, message, now(), taskId, link);
        addNotifications(List.of(notification));
        return notification;
    }

    /**
     * Queues several notifications in one write. Each is inserted at the head of
     * Pending in turn, so the last one in the list ends up first in the ledger.
     */
    public void addNotifications(List<Notification> notifications) {
        if (notifications.isEmpty()) {
            return;
        }
        for (Notification n : notifications) {
            Workspace.requireAgentName(n.to());
            Workspace.requireAgentName(n.from());
        }
        update(doc -> {
            for (Notification n : notifications) {
                doc.pending().add(0, n);
            }
            return null;
        });
        metrics.recordNotificationsQueued(notifications.size());
        log.debug("Queued {} notification(s)", notifications.size());
    }

    /**
     * Pending notifications addressed to {@code agent}, most recent first.
     */
    public List<Notification> getNotifications(String agent) {
        return read().pending().stream().filter(n -> n.to().equals(agent)).toList();
    }

    /**
     * Delivered notifications addressed to {@code agent}, oldest delivery first.
     */
    public List<Notification> getDelivered(String agent) {
        return read().delivered().stream().filter(n -> n.to().equals(agent)).toList();
    }

    /**
     * Moves every pending notification for {@code agent} to Delivered.
     * Does nothing, and writes nothing, when the agent has none pending.
     *
     * @return the number of notifications delivered
     */
    public int markDelivered(String agent) {
        int count = locks.withExclusive(RESOURCE, () -> {
            LedgerDocument doc = read();
            var mine = new ArrayList<Notification>();
            doc.pending().removeIf(n -> {
                if (n.to().equals(agent)) {
                    mine.add(n);
                    return true;
                }
                return false;
            });
            if (mine.isEmpty()) {
                return 0;
            }
            LocalDateTime deliveredAt = now();
            mine.forEach(n -> doc.delivered().add(n.withDelivered(deliveredAt)));
            write(doc);
            return mine.size();
        });
        if (count > 0) {
            metrics.recordNotificationsDelivered(count);
            log.info("Delivered {} notification(s) to {}", count, agent);
        }
        return count;
    }

    private <T> T update(Function<LedgerDocument, T> change) {
        return locks.withExclusive(RESOURCE, () -> {
            LedgerDocument doc = read();
            T result = change.apply(doc);
            write(doc);
            return result;
        });
    }

    private LedgerDocument read() {
        Path file = workspace.notificationsFile();
        return files.readIfExists(file)
                .map(content -> LedgerDocument.parse(content, file))
                .orElseGet(LedgerDocument::empty);
    }

    private void write(LedgerDocument doc) {
        files.writeAtomically(workspace.notificationsFile(), doc.render());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
    }
}
