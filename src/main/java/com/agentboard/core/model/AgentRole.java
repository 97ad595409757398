package com.agentboard.core.model;

import java.util.Optional;

/**
 * The agent roles that pick up unassigned work, each from the status
 * directory it is responsible for.
 */
public enum AgentRole {
    PM("pm", TaskStatus.INBOX),
    ARCHITECT("architect", TaskStatus.IN_PLANNING),
    ENGINEER("engineer", TaskStatus.READY_TO_BUILD),
    QA("qa", TaskStatus.READY_FOR_TESTING),
    SECURITY("security", TaskStatus.IN_PROGRESS),  // reviews ongoing work
    DEVOPS("devops", TaskStatus.READY_TO_DEPLOY);

    private final String roleName;
    private final TaskStatus queue;

    AgentRole(String roleName, TaskStatus queue) {
        this.roleName = roleName;
        this.queue = queue;
    }

    public String roleName() {
        return roleName;
    }

    /** Status directory this role draws unassigned work from. */
    public TaskStatus queue() {
        return queue;
    }

    public static Optional<AgentRole> fromName(String name) {
        for (AgentRole role : values()) {
            if (role.roleName.equals(name)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
