package com.mentorship.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Minimal directory record for a platform user. Profile management lives elsewhere;
 * this table only backs {@link com.mentorship.scheduling.port.UserDirectory}.
 */
@Entity
@Table(name = "user_account")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(length = 200)
    private String email;

    @Column(name = "push_token", length = 255)
    private String pushToken;

    /** IANA zone id, e.g. Europe/London */
    @Column(length = 64)
    private String timezone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
