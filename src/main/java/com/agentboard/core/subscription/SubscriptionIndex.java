package com.agentboard.core.subscription;

import com.agentboard.core.codec.MalformedRecordException;
import com.agentboard.core.io.ResourceLocks;
import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import com.agentboard.core.model.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-agent subscription records, stored as
 * {@code agents/<agent>/subscriptions.json}:
 * <pre>
 * {
 *   "task-001" : {
 *     "subscribed_at" : "2026-02-02T14:30:00",
 *     "reason" : "interaction"
 *   }
 * }
 * </pre>
 * Subscribing is idempotent: an existing entry keeps its original time and reason.
 */
public class SubscriptionIndex {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionIndex.class);

    public static final String DEFAULT_REASON = "interaction";

    private static final TypeReference<LinkedHashMap<String, Subscription>> SUBSCRIPTIONS = new TypeReference<>() {};

    private final Workspace workspace;
    private final WorkspaceFiles files;
    private final ResourceLocks locks;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public SubscriptionIndex(Workspace workspace, WorkspaceFiles files, ResourceLocks locks, Clock clock) {
        this.workspace = workspace;
        this.files = files;
        this.locks = locks;
        this.clock = clock;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public boolean subscribe(String agent, String taskId) {
        return subscribe(agent, taskId, DEFAULT_REASON);
    }

    /**
     * Subscribes {@code agent} to {@code taskId}.
     *
     * @return true if a new subscription was recorded, false if one already existed
     */
    public boolean subscribe(String agent, String taskId, String reason) {
        Path file = workspace.subscriptionsFile(agent);
        return locks.withExclusive(resource(agent), () -> {
            var subscriptions = load(file);
            if (subscriptions.containsKey(taskId)) {
                return false;
            }
            String now = DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.now(clock));
            subscriptions.put(taskId, new Subscription(now, reason));
            files.writeAtomically(file, toJson(subscriptions, file));
            log.debug("Subscribed {} to {} ({})", agent, taskId, reason);
            return true;
        });
    }

    public boolean isSubscribed(String agent, String taskId) {
        return load(workspace.subscriptionsFile(agent)).containsKey(taskId);
    }

    /**
     * All subscriptions of an agent keyed by task id, in the order they were recorded.
     */
    public Map<String, Subscription> subscriptions(String agent) {
        return Collections.unmodifiableMap(load(workspace.subscriptionsFile(agent)));
    }

    private LinkedHashMap<String, Subscription> load(Path file) {
        var content = files.readIfExists(file);
        if (content.isEmpty() || content.get().isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Subscription> parsed = objectMapper.readValue(content.get(), SUBSCRIPTIONS);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(file, "invalid subscriptions JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Map<String, Subscription> subscriptions, Path file) {
        try {
            return objectMapper.writeValueAsString(subscriptions) + "\n";
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(file, "cannot serialize subscriptions", e);
        }
    }

    private static String resource(String agent) {
        return "subscriptions/" + agent;
    }
}
