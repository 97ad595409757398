package com.agentboard.core.codec;

import com.agentboard.core.model.Comment;
import com.agentboard.core.model.InvalidStatusException;
import com.agentboard.core.model.Priority;
import com.agentboard.core.model.Task;
import com.agentboard.core.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a {@link Task} to and from its markdown record:
 * <pre>
 * ---
 * id: task-001
 * title: Add login
 * status: inbox
 * priority: P2
 * created: 2026-02-02T14:30:00
 * updated: 2026-02-02T14:30:00
 * assigned: ["engineer"]
 * subscribers: ["engineer"]
 * tags: []
 * ---
 *
 * # Add login
 *
 * ## Description
 * Implement OAuth
 *
 * ## Thread
 *
 * ### 2026-02-02T14:35 - engineer
 * Started work
 * </pre>
 * List-valued keys are JSON arrays. {@code prd}, {@code plan} and {@code pr}
 * are written only when set, and the thread section only when non-empty.
 * Description and message lines starting with {@code #} or {@code \} are
 * written with a {@code \} prefix so free text never reads as a heading.
 */
public class TaskRecordCodec {

    private static final Logger log = LoggerFactory.getLogger(TaskRecordCodec.class);

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    public static final DateTimeFormatter COMMENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private static final String DELIMITER = "---";
    private static final String DESCRIPTION_HEADING = "## Description";
    private static final String THREAD_HEADING = "## Thread";

    /** {@code ### 2026-02-02T14:35 - engineer} */
    private static final Pattern COMMENT_HEADER = Pattern.compile(
            "^### (\\d{4}-\\d{2}-\\d{2}T[\\d:.]+) - (.+)$");

    private static final Set<String> LIST_KEYS = Set.of("assigned", "subscribers", "tags");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public TaskRecordCodec() {
        this.objectMapper = new ObjectMapper();
    }

    public String encode(Task task) {
        var lines = new ArrayList<String>();
        lines.add(DELIMITER);
        lines.add("id: " + task.id());
        lines.add("title: " + task.title());
        lines.add("status: " + task.status().directoryName());
        lines.add("priority: " + task.priority().name());
        lines.add("created: " + formatTimestamp(task.created()));
        lines.add("updated: " + formatTimestamp(task.updated()));
        lines.add("assigned: " + toJson(task.assigned()));
        lines.add("subscribers: " + toJson(task.subscribers()));
        lines.add("tags: " + toJson(task.tags()));
        addOptional(lines, "prd", task.prd());
        addOptional(lines, "plan", task.plan());
        addOptional(lines, "pr", task.pr());
        lines.add(DELIMITER);

        lines.add("");
        lines.add("# " + task.title());
        lines.add("");
        lines.add(DESCRIPTION_HEADING);
        lines.add(escape(task.description()));
        lines.add("");

        if (!task.thread().isEmpty()) {
            lines.add(THREAD_HEADING);
            lines.add("");
            for (Comment comment : task.thread()) {
                lines.add("### " + COMMENT_TIME.format(comment.timestamp()) + " - " + comment.agent());
                lines.add(escape(comment.message()));
                lines.add("");
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Parses a record.
     *
     * @param document the full file content
     * @param source   where the content was read from, used in diagnostics
     * @throws MalformedRecordException if the frontmatter block is missing or a value cannot be parsed
     */
    public Task decode(String document, Path source) {
        String[] lines = document.replace("\r\n", "\n").split("\n", -1);
        if (lines.length == 0 || !lines[0].strip().equals(DELIMITER)) {
            throw new MalformedRecordException(source, "missing opening frontmatter delimiter");
        }
        int closing = -1;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].strip().equals(DELIMITER)) {
                closing = i;
                break;
            }
        }
        if (closing < 0) {
            throw new MalformedRecordException(source, "missing closing frontmatter delimiter");
        }

        Map<String, String> frontmatter = parseFrontmatter(lines, closing, source);
        List<String> body = List.of(lines).subList(closing + 1, lines.length);

        String id = require(frontmatter, "id", source);
        String title = frontmatter.containsKey("title") ? frontmatter.get("title") : headingTitle(body);

        TaskStatus status = TaskStatus.INBOX;
        if (frontmatter.containsKey("status")) {
            try {
                status = TaskStatus.fromDirectoryName(frontmatter.get("status"));
            } catch (InvalidStatusException e) {
                throw new MalformedRecordException(source, "unknown status '" + frontmatter.get("status") + "'", e);
            }
        }
        Priority priority = Priority.P2;
        if (frontmatter.containsKey("priority")) {
            try {
                priority = Priority.fromLabel(frontmatter.get("priority"));
            } catch (IllegalArgumentException e) {
                throw new MalformedRecordException(source, "unknown priority '" + frontmatter.get("priority") + "'", e);
            }
        }

        return new Task(
                id,
                title,
                parseDescription(body),
                status,
                priority,
                parseList(frontmatter, "assigned", source),
                parseList(frontmatter, "subscribers", source),
                parseList(frontmatter, "tags", source),
                parseTimestamp(require(frontmatter, "created", source), "created", source),
                parseTimestamp(require(frontmatter, "updated", source), "updated", source),
                optional(frontmatter, "prd"),
                optional(frontmatter, "plan"),
                optional(frontmatter, "pr"),
                parseThread(body, source)
        );
    }

    private Map<String, String> parseFrontmatter(String[] lines, int closing, Path source) {
        var frontmatter = new LinkedHashMap<String, String>();
        for (int i = 1; i < closing; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new MalformedRecordException(source,
                        "frontmatter line " + (i + 1) + " is not a 'key: value' pair");
            }
            String key = line.substring(0, colon).strip();
            String value = line.substring(colon + 1).strip();
            if (frontmatter.put(key, value) != null) {
                log.debug("Duplicate frontmatter key '{}' in {}, last value wins", key, source);
            }
        }
        for (String key : frontmatter.keySet()) {
            if (!isKnownKey(key)) {
                log.debug("Ignoring unknown frontmatter key '{}' in {}", key, source);
            }
        }
        return frontmatter;
    }

    private static boolean isKnownKey(String key) {
        return LIST_KEYS.contains(key) || switch (key) {
            case "id", "title", "status", "priority", "created", "updated", "prd", "plan", "pr" -> true;
            default -> false;
        };
    }

    private static String headingTitle(List<String> body) {
        for (String line : body) {
            if (line.startsWith("# ")) {
                return line.substring(2).strip();
            }
        }
        return "";
    }

    private static String parseDescription(List<String> body) {
        int start = body.indexOf(DESCRIPTION_HEADING);
        if (start < 0) {
            return "";
        }
        int end = indexOf(body, THREAD_HEADING, start + 1);
        return unescape(body.subList(start + 1, end < 0 ? body.size() : end));
    }

    private static List<Comment> parseThread(List<String> body, Path source) {
        int descriptionStart = body.indexOf(DESCRIPTION_HEADING);
        int start = indexOf(body, THREAD_HEADING, descriptionStart < 0 ? 0 : descriptionStart + 1);
        if (start < 0) {
            return List.of();
        }

        var thread = new ArrayList<Comment>();
        LocalDateTime timestamp = null;
        String agent = null;
        var message = new ArrayList<String>();
        for (String line : body.subList(start + 1, body.size())) {
            Matcher header = COMMENT_HEADER.matcher(line);
            if (header.matches()) {
                if (agent != null) {
                    thread.add(new Comment(timestamp, agent, unescape(message)));
                }
                timestamp = parseTimestamp(header.group(1), "comment timestamp", source);
                agent = header.group(2).strip();
                message.clear();
            } else if (agent != null) {
                message.add(line);
            }
        }
        if (agent != null) {
            thread.add(new Comment(timestamp, agent, unescape(message)));
        }
        return thread;
    }

    private List<String> parseList(Map<String, String> frontmatter, String key, Path source) {
        String value = frontmatter.get(key);
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        if (!value.startsWith("[")) {
            throw new MalformedRecordException(source, "'" + key + "' is not a JSON list: " + value);
        }
        try {
            return objectMapper.readValue(value, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(source, "'" + key + "' is not a JSON list: " + value, e);
        }
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            // a list of strings always serializes
            throw new IllegalStateException("Cannot serialize " + values, e);
        }
    }

    private static LocalDateTime parseTimestamp(String value, String field, Path source) {
        try {
            return LocalDateTime.parse(value, TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(source, "invalid " + field + " '" + value + "'", e);
        }
    }

    private static String formatTimestamp(LocalDateTime value) {
        return value == null ? "" : TIMESTAMP.format(value);
    }

    private static String require(Map<String, String> frontmatter, String key, Path source) {
        String value = frontmatter.get(key);
        if (value == null || value.isEmpty()) {
            throw new MalformedRecordException(source, "missing required key '" + key + "'");
        }
        return value;
    }

    private static String optional(Map<String, String> frontmatter, String key) {
        String value = frontmatter.get(key);
        return value == null || value.isEmpty() ? null : value;
    }

    private static void addOptional(List<String> lines, String key, String value) {
        if (value != null && !value.isEmpty()) {
            lines.add(key + ": " + value);
        }
    }

    static String escape(String text) {
        var escaped = new ArrayList<String>();
        for (String line : text.split("\n", -1)) {
            escaped.add(line.startsWith("#") || line.startsWith("\\") ? "\\" + line : line);
        }
        return String.join("\n", escaped);
    }

    static String unescape(List<String> lines) {
        var unescaped = new ArrayList<String>(lines.size());
        for (String line : lines) {
            unescaped.add(line.startsWith("\\") ? line.substring(1) : line);
        }
        return String.join("\n", unescaped).strip();
    }

    private static int indexOf(List<String> lines, String target, int from) {
        for (int i = Math.max(from, 0); i < lines.size(); i++) {
            if (lines.get(i).equals(target)) {
                return i;
            }
        }
        return -1;
    }
}
