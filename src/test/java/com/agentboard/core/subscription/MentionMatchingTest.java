package com.agentboard.core.subscription;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MentionMatchingTest {

    @Test
    @DisplayName("SUBSTRING matches the literal @agent anywhere, including longer names")
    void substring() {
        assertTrue(MentionMatching.SUBSTRING.mentions("ping @qa please", "qa"));
        assertTrue(MentionMatching.SUBSTRING.mentions("ping @qa2 please", "qa"));
        assertFalse(MentionMatching.SUBSTRING.mentions("qa without at-sign", "qa"));
    }

    @Test
    @DisplayName("TOKEN requires the name to end at a boundary")
    void token() {
        assertTrue(MentionMatching.TOKEN.mentions("ping @qa please", "qa"));
        assertTrue(MentionMatching.TOKEN.mentions("ping @qa.", "qa"));
        assertTrue(MentionMatching.TOKEN.mentions("(@qa)", "qa"));
        assertTrue(MentionMatching.TOKEN.mentions("@qa", "qa"));
        assertFalse(MentionMatching.TOKEN.mentions("ping @qa2 please", "qa"));
        assertFalse(MentionMatching.TOKEN.mentions("ping @qa-lead please", "qa"));
    }

    @Test
    @DisplayName("TOKEN treats regex characters in names literally")
    void tokenQuotesName() {
        assertTrue(MentionMatching.TOKEN.mentions("hey @dev.ops", "dev.ops"));
        assertFalse(MentionMatching.TOKEN.mentions("hey @devXops", "dev.ops"));
    }
}
