package com.example.taskreminder.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A chat participant who can be assigned to tasks.
 * <p>
 * The opt-in flag decides whether this person is named in reminder
 * messages at all; per-task reminder offsets only decide when those
 * messages go out.
 */
@Entity
@Table(name = "participants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    /**
     * Chat platform user id
     */
    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Primary handle used for mentions, without the leading @
     */
    @Column(name = "handle", length = 100)
    private String handle;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "reminders_enabled", nullable = false)
    @Builder.Default
    private boolean remindersEnabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
