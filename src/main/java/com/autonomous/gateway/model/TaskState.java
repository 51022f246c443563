package com.autonomous.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskState {
    PENDING(0),
    RUNNING(1),
    STREAMING(1),
    COMPLETED(2),
    ERROR(2),
    CANCELLED(2);

    private final int rank;

    TaskState(int rank) {
        this.rank = rank;
    }

    /**
     * Position on the way to a terminal state. A stored state is never replaced by one of lower rank.
     */
    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskState fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task state must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task state: " + value);
        }
    }
}
