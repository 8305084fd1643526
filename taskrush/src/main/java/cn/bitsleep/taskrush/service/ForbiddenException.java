package cn.bitsleep.taskrush.service;

import lombok.Getter;

/**
 * The task exists but belongs to another owner.
 */
@Getter
public class ForbiddenException extends RuntimeException {
    private final String taskId;

    public ForbiddenException(String taskId) {
        super("Not authorized");
        this.taskId = taskId;
    }
}
