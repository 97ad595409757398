package com.agentboard.core.activity;

import com.agentboard.core.io.Workspace;
import com.agentboard.core.io.WorkspaceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Append-only activity feed shared by all agents, one line per event:
 * {@code <ISO-8601 timestamp> | <agent> | <message>}.
 */
public class ActivityLog {

    private static final Logger log = LoggerFactory.getLogger(ActivityLog.class);

    public static final String SYSTEM_ACTOR = "system";

    private final Workspace workspace;
    private final WorkspaceFiles files;
    private final Clock clock;

    public ActivityLog(Workspace workspace, WorkspaceFiles files, Clock clock) {
        this.workspace = workspace;
        this.files = files;
        this.clock = clock;
    }

    public void log(String agent, String message) {
        String line = formatLine(LocalDateTime.now(clock), agent, message);
        files.append(workspace.activityLog(), line);
        log.debug("Activity: {} | {}", agent, message);
    }

    static String formatLine(LocalDateTime timestamp, String agent, String message) {
        // a multi-line message would break the one-event-per-line format
        String flat = message.replace("\r", "").replace('\n', ' ');
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp) + " | " + agent + " | " + flat + "\n";
    }
}
