package com.agentboard.core.notification;

import com.agentboard.core.codec.MalformedRecordException;
import com.agentboard.core.model.Notification;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of {@code notifications.md}:
 * <pre>
 * # Notifications
 *
 * ## Pending
 *
 * ### @qa
 * From: engineer (task-001)
 * Message: Ready for testing
 * Time: 2026-02-02T14:30
 * Link: workspace/tasks/ready-for-testing/task-001.md
 *
 * ## Delivered
 *
 * ### @pm
 * From: architect (task-002)
 * Message: Plan is up
 * Time: 2026-02-02T09:10
 * Delivered: 2026-02-02T09:45
 * </pre>
 * Both sections are kept in document order; the ledger decides where entries go.
 */
final class LedgerDocument {

    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private static final String TITLE = "# Notifications";
    private static final String PENDING_HEADING = "## Pending";
    private static final String DELIVERED_HEADING = "## Delivered";
    private static final String ENTRY_PREFIX = "### @";

    /** {@code engineer (task-001)} or just {@code engineer}. */
    private static final Pattern FROM = Pattern.compile("^(.*?)(?:\\s+\\(([^)]*)\\))?$");

    private final List<Notification> pending;
    private final List<Notification> delivered;

    private LedgerDocument(List<Notification> pending, List<Notification> delivered) {
        this.pending = pending;
        this.delivered = delivered;
    }

    static LedgerDocument empty() {
        return new LedgerDocument(new ArrayList<>(), new ArrayList<>());
    }

    List<Notification> pending() {
        return pending;
    }

    List<Notification> delivered() {
        return delivered;
    }

    static LedgerDocument parse(String content, Path source) {
        String[] lines = content.replace("\r\n", "\n").split("\n", -1);
        var pending = new ArrayList<Notification>();
        var delivered = new ArrayList<Notification>();
        List<Notification> section = null;
        boolean sawPending = false;
        boolean sawDelivered = false;
        EntryBuilder entry = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.equals(PENDING_HEADING) || line.equals(DELIVERED_HEADING)) {
                flush(entry, section);
                entry = null;
                boolean isPending = line.equals(PENDING_HEADING);
                section = isPending ? pending : delivered;
                sawPending |= isPending;
                sawDelivered |= !isPending;
            } else if (line.startsWith(ENTRY_PREFIX)) {
                if (section == null) {
                    throw new MalformedRecordException(source, "line " + (i + 1) + ": notification outside a section");
                }
                flush(entry, section);
                entry = new EntryBuilder(line.substring(ENTRY_PREFIX.length()).strip());
            } else if (entry != null && !line.isEmpty()) {
                entry.field(line, i + 1, source);
            }
        }
        flush(entry, section);

        if (!sawPending || !sawDelivered) {
            throw new MalformedRecordException(source,
                    "expected '" + PENDING_HEADING + "' and '" + DELIVERED_HEADING + "' sections");
        }
        return new LedgerDocument(pending, delivered);
    }

    String render() {
        var sb = new StringBuilder();
        sb.append(TITLE).append("\n\n");
        sb.append(PENDING_HEADING).append("\n\n");
        pending.forEach(n -> renderEntry(sb, n));
        sb.append(DELIVERED_HEADING).append("\n\n");
        delivered.forEach(n -> renderEntry(sb, n));
        return sb.toString();
    }

    private static void renderEntry(StringBuilder sb, Notification n) {
        sb.append(ENTRY_PREFIX).append(n.to()).append('\n');
        sb.append("From: ").append(n.from());
        if (n.taskId() != null) {
            sb.append(" (").append(n.taskId()).append(')');
        }
        sb.append('\n');
        sb.append("Message: ").append(singleLine(n.message())).append('\n');
        if (n.time() != null) {
            sb.append("Time: ").append(TIME.format(n.time())).append('\n');
        }
        if (n.link() != null) {
            sb.append("Link: ").append(n.link()).append('\n');
        }
        if (n.delivered() != null) {
            sb.append("Delivered: ").append(TIME.format(n.delivered())).append('\n');
        }
        sb.append('\n');
    }

    static String singleLine(String message) {
        return message == null ? "" : message.replace("\r", "").replace('\n', ' ');
    }

    private static void flush(EntryBuilder entry, List<Notification> section) {
        if (entry != null) {
            section.add(entry.build());
        }
    }

    private static final class EntryBuilder {
        private final String to;
        private String from = "";
        private String taskId;
        private String message = "";
        private LocalDateTime time;
        private String link;
        private LocalDateTime delivered;

        EntryBuilder(String to) {
            this.to = to;
        }

        void field(String line, int lineNumber, Path source) {
            if (line.startsWith("From:")) {
                Matcher m = FROM.matcher(value(line, "From:"));
                if (m.matches()) {
                    from = m.group(1).strip();
                    taskId = m.group(2) == null || m.group(2).isBlank() ? null : m.group(2).strip();
                }
            } else if (line.startsWith("Message:")) {
                message = value(line, "Message:");
            } else if (line.startsWith("Time:")) {
                time = parseTime(value(line, "Time:"), lineNumber, source);
            } else if (line.startsWith("Link:")) {
                String v = value(line, "Link:");
                link = v.isEmpty() ? null : v;
            } else if (line.startsWith("Delivered:")) {
                delivered = parseTime(value(line, "Delivered:"), lineNumber, source);
            }
        }

        Notification build() {
            return new Notification(to, from, message, time, taskId, link, delivered);
        }

        private static String value(String line, String prefix) {
            return line.substring(prefix.length()).strip();
        }

        private static LocalDateTime parseTime(String value, int lineNumber, Path source) {
            try {
                return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            } catch (DateTimeParseException e) {
                throw new MalformedRecordException(source, "line " + lineNumber + ": invalid time '" + value + "'", e);
            }
        }
    }
}
