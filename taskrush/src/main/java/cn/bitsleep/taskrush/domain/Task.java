package cn.bitsleep.taskrush.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "task", indexes = {
        @Index(name = "idx_task_owner_created", columnList = "owner_id, created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @Setter(AccessLevel.NONE)
    @Column(name = "id", nullable = false, updatable = false)
    private String id; // UUID as string

    @Setter(AccessLevel.NONE)
    @Column(name = "owner_id", nullable = false, updatable = false)
    private String owner;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "priority", nullable = false, length = 16)
    private Priority priority;

    @Column(name = "estimate_hrs", nullable = false)
    private double estimateHrs;

    @Column(name = "deadline")
    private Instant deadline;

    @Builder.Default
    @Column(name = "notes", nullable = false, columnDefinition = "text")
    private String notes = "";

    @Column(name = "important", nullable = false)
    private boolean important;

    @Builder.Default
    @Column(name = "status", nullable = false, length = 16)
    private TaskStatus status = TaskStatus.ACTIVE;

    @Column(name = "urgency_score", nullable = false, precision = 12, scale = 2)
    private BigDecimal urgencyScore;

    @Setter(AccessLevel.NONE)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isOwnedBy(String candidate) {
        return owner.equals(candidate);
    }
}
