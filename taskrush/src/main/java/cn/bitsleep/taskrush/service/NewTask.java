package cn.bitsleep.taskrush.service;

import lombok.Builder;
import lombok.Value;

/**
 * Unvalidated fields of a create request. Only title, priority and estimateHrs are required.
 */
@Value
@Builder
public class NewTask {
    String title;
    String priority;
    Double estimateHrs;
    String deadline;
    String notes;
    Boolean important;
    String status;
}
