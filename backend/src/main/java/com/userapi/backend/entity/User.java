package com.userapi.backend.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Data
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = User.EMAIL_UNIQUE_CONSTRAINT, columnNames = {"email"})
        },
        indexes = {
                @Index(columnList = "email")
        }
)
public class User {

    public static final String DEFAULT_ROLE = "user";
    public static final String EMAIL_UNIQUE_CONSTRAINT = "uk_users_email";
    public static final int EMAIL_MAX_LENGTH = 256;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = EMAIL_MAX_LENGTH)
    private String email;

    @ToString.Exclude
    @Column(nullable = false, length = 256)
    private String passwordHash;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 32)
    private String role = DEFAULT_ROLE;

    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (role == null || role.isBlank()) role = DEFAULT_ROLE;
    }
}
