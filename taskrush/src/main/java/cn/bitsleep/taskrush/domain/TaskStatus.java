package cn.bitsleep.taskrush.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TaskStatus {
    ACTIVE("active"),
    BACKLOG("backlog"),
    DONE("done");

    public final String value;
    TaskStatus(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    public static Optional<TaskStatus> lookup(String value) {
        for (var v : values()) if (v.value.equals(value)) return Optional.of(v);
        return Optional.empty();
    }

    public static TaskStatus fromValue(String value) {
        return lookup(value).orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }
}
