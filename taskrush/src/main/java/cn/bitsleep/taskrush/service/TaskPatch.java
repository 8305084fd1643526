package cn.bitsleep.taskrush.service;

import lombok.Builder;
import lombok.Value;

/**
 * Unvalidated fields of a partial update. Absent fields keep their stored value.
 */
@Value
@Builder
public class TaskPatch {
    @Builder.Default FieldPatch<String> title = FieldPatch.absent();
    @Builder.Default FieldPatch<String> priority = FieldPatch.absent();
    @Builder.Default FieldPatch<Double> estimateHrs = FieldPatch.absent();
    @Builder.Default FieldPatch<String> deadline = FieldPatch.absent();
    @Builder.Default FieldPatch<String> notes = FieldPatch.absent();
    @Builder.Default FieldPatch<Boolean> important = FieldPatch.absent();
    @Builder.Default FieldPatch<String> status = FieldPatch.absent();

    public static TaskPatch empty() {
        return TaskPatch.builder().build();
    }
}
