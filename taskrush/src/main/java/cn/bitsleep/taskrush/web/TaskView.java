package cn.bitsleep.taskrush.web;

import cn.bitsleep.taskrush.domain.Task;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * JSON shape of a task. Deadline is rendered as its {@code yyyy-MM-dd} date in the deadline
 * zone, createdAt as ISO-8601.
 */
@Value
@Builder
public class TaskView {
    String id;
    String title;
    String priority;
    double estimateHrs;
    String deadline;
    String notes;
    boolean important;
    String status;
    BigDecimal urgencyScore;
    String createdAt;

    public static TaskView from(Task t, ZoneId deadlineZone) {
        return TaskView.builder()
                .id(t.getId())
                .title(t.getTitle())
                .priority(t.getPriority().value())
                .estimateHrs(t.getEstimateHrs())
                .deadline(t.getDeadline() == null ? null : t.getDeadline().atZone(deadlineZone).toLocalDate().toString())
                .notes(t.getNotes() == null ? "" : t.getNotes())
                .important(t.isImportant())
                .status(t.getStatus().value())
                .urgencyScore(t.getUrgencyScore())
                .createdAt(t.getCreatedAt() == null ? null : t.getCreatedAt().toString())
                .build();
    }
}
