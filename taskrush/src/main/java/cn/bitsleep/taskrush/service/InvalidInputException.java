package cn.bitsleep.taskrush.service;

import lombok.Getter;

/**
 * A task field is missing, malformed or outside its domain. {@link #getField()} names it.
 */
@Getter
public class InvalidInputException extends IllegalArgumentException {
    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
