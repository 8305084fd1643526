package cn.bitsleep.taskrush.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Task priority tiers and the weight each contributes to the urgency score.
 */
public enum Priority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 5);

    public final String value;
    public final int weight;

    Priority(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String value() { return value; }

    public int weight() { return weight; }

    public static Optional<Priority> lookup(String value) {
        for (var v : values()) if (v.value.equals(value)) return Optional.of(v);
        return Optional.empty();
    }

    public static Priority fromValue(String value) {
        return lookup(value).orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + value));
    }
}
