package cn.bitsleep.taskrush.service;

import cn.bitsleep.taskrush.domain.Priority;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives a task's urgency score from its priority and deadline.
 *
 * <p>Without a deadline the score is the priority weight. With one, the score is the
 * weight per day-equivalent left: {@code weight / (hoursUntilDeadline / 24)}, rounded
 * half-up to two decimals. Hours left are floored at one, so overdue tasks score
 * {@code weight * 24} and never divide by zero.
 *
 * <p>The current instant is always passed in; nothing here reads the clock.
 */
@Component
public class UrgencyCalculator {

    private static final double MIN_HOURS = 1.0;
    private static final double HOURS_PER_DAY = 24.0;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    /** A {@code null} deadline yields the flat priority weight. */
    public BigDecimal computeUrgency(Priority priority, Instant deadline, Instant now) {
        if (deadline == null) {
            return baseline(priority);
        }
        double hours = Math.max(MIN_HOURS, Duration.between(now, deadline).toMillis() / MILLIS_PER_HOUR);
        double score = priority.weight() / (hours / HOURS_PER_DAY);
        return BigDecimal.valueOf(score).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal baseline(Priority priority) {
        return BigDecimal.valueOf(priority.weight()).setScale(2, RoundingMode.HALF_UP);
    }
}
