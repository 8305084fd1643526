package cn.bitsleep.taskrush.service;

import cn.bitsleep.taskrush.domain.Priority;
import cn.bitsleep.taskrush.domain.TaskStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Checks raw task fields against their domains. Each method returns the normalized
 * value or throws {@link InvalidInputException} naming the field; nothing is clamped.
 */
@Component
public class TaskFieldValidator {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final double MAX_ESTIMATE_HRS = 100.0;
    private static final int ISO_DATE_LENGTH = 10; // yyyy-MM-dd

    private final ZoneId deadlineZone;

    public TaskFieldValidator(@Value("${taskrush.urgency.deadline-zone:UTC}") String deadlineZone) {
        this.deadlineZone = ZoneId.of(deadlineZone);
    }

    public String title(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("title", "Title required");
        }
        String title = raw.trim();
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new InvalidInputException("title", "Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    public Priority priority(String raw) {
        return Priority.lookup(raw)
                .orElseThrow(() -> new InvalidInputException("priority", "Invalid priority"));
    }

    public double estimateHrs(Double raw) {
        if (raw == null || raw.isNaN() || raw.isInfinite() || raw <= 0 || raw > MAX_ESTIMATE_HRS) {
            throw new InvalidInputException("estimateHrs", "Invalid estimate");
        }
        return raw;
    }

    /**
     * Blank or {@code null} means "no deadline". An ISO date is the start of that day in the
     * deadline zone; an ISO date-time keeps its time of day, and without an offset it is
     * read in the deadline zone as well.
     */
    public Instant deadline(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        try {
            if (s.length() <= ISO_DATE_LENGTH) {
                return LocalDate.parse(s).atStartOfDay(deadlineZone).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(deadlineZone).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("deadline", "Invalid deadline date");
        }
    }

    /** Blank or {@code null} falls back to {@link TaskStatus#ACTIVE}; used on create. */
    public TaskStatus statusOrDefault(String raw) {
        return raw == null || raw.isBlank() ? TaskStatus.ACTIVE : status(raw);
    }

    public TaskStatus status(String raw) {
        return TaskStatus.lookup(raw)
                .orElseThrow(() -> new InvalidInputException("status", "Invalid status"));
    }
}
