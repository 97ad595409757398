package com.agentboard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of an agent's {@code subscriptions.json}, keyed there by task id.
 *
 * @param subscribedAt ISO-8601 time of the first subscription
 * @param reason       why the agent was subscribed (interaction, comment, assignment)
 */
public record Subscription(
    @JsonProperty("subscribed_at") String subscribedAt,
    @JsonProperty("reason") String reason
) {}
