package com.agentboard.core.subscription;

import java.util.regex.Pattern;

/**
 * How an {@code @agent} mention is recognised in raw record text.
 */
public enum MentionMatching {

    /**
     * Literal {@code @agent} substring. {@code @qa} also matches inside {@code @qa2}.
     */
    SUBSTRING {
        @Override
        public boolean mentions(String text, String agent) {
            return text.contains("@" + agent);
        }
    },

    /**
     * {@code @agent} not followed by another name character.
     */
    TOKEN {
        @Override
        public boolean mentions(String text, String agent) {
            return Pattern.compile("@" + Pattern.quote(agent) + "(?![A-Za-z0-9_.-]*[A-Za-z0-9_-])")
                    .matcher(text)
                    .find();
        }
    };

    public abstract boolean mentions(String text, String agent);
}
