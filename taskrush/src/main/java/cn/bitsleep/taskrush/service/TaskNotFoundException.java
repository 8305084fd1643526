package cn.bitsleep.taskrush.service;

import lombok.Getter;

@Getter
public class TaskNotFoundException extends RuntimeException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found");
        this.taskId = taskId;
    }
}
