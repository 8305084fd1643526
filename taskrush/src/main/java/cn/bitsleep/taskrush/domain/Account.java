package cn.bitsleep.taskrush.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "account", uniqueConstraints = {
        @UniqueConstraint(name = "uq_account_username", columnNames = {"username"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Account {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id; // UUID

    @Column(name = "username", nullable = false)
    private String username; // trimmed, lower-case

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
