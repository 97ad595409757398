package com.agentboard.core.model;

/**
 * Task priority, {@code P0} being the most urgent.
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3;

    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Priority label must not be blank");
        }
        try {
            return valueOf(label.strip().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + label, e);
        }
    }
}
