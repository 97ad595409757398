package com.agentboard.config;

import com.agentboard.core.store.UnknownFieldPolicy;
import com.agentboard.core.subscription.MentionMatching;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds {@code agentboard.*} from application.yml / environment variables.
 *
 * <pre>
 * agentboard:
 *   workspace: workspace
 *   notification:
 *     preview-length: 100
 *   mentions:
 *     matching: SUBSTRING
 *   updates:
 *     unknown-fields: IGNORE
 *   locking:
 *     file-locks: true
 *   io:
 *     max-attempts: 3
 *     backoff-millis: 50
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "agentboard")
public class BoardProperties {

    private String workspace = "workspace";
    private Notification notification = new Notification();
    private Mentions mentions = new Mentions();
    private Updates updates = new Updates();
    private Locking locking = new Locking();
    private Io io = new Io();

    public String getWorkspace() { return workspace; }
    public void setWorkspace(String workspace) { this.workspace = workspace; }
    public Notification getNotification() { return notification; }
    public void setNotification(Notification notification) { this.notification = notification; }
    public Mentions getMentions() { return mentions; }
    public void setMentions(Mentions mentions) { this.mentions = mentions; }
    public Updates getUpdates() { return updates; }
    public void setUpdates(Updates updates) { this.updates = updates; }
    public Locking getLocking() { return locking; }
    public void setLocking(Locking locking) { this.locking = locking; }
    public Io getIo() { return io; }
    public void setIo(Io io) { this.io = io; }

    public static class Notification {
        /** Comment text longer than this is cut and suffixed with "..." in notifications. */
        private int previewLength = 100;

        public int getPreviewLength() { return previewLength; }
        public void setPreviewLength(int previewLength) { this.previewLength = previewLength; }
    }

    public static class Mentions {
        private MentionMatching matching = MentionMatching.SUBSTRING;

        public MentionMatching getMatching() { return matching; }
        public void setMatching(MentionMatching matching) { this.matching = matching; }
    }

    public static class Updates {
        private UnknownFieldPolicy unknownFields = UnknownFieldPolicy.IGNORE;

        public UnknownFieldPolicy getUnknownFields() { return unknownFields; }
        public void setUnknownFields(UnknownFieldPolicy unknownFields) { this.unknownFields = unknownFields; }
    }

    public static class Locking {
        private boolean fileLocks = true;

        public boolean isFileLocks() { return fileLocks; }
        public void setFileLocks(boolean fileLocks) { this.fileLocks = fileLocks; }
    }

    public static class Io {
        private int maxAttempts = 3;
        private long backoffMillis = 50;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBackoffMillis() { return backoffMillis; }
        public void setBackoffMillis(long backoffMillis) { this.backoffMillis = backoffMillis; }
    }
}
