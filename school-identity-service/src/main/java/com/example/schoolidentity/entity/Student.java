package com.example.schoolidentity.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Learner accounts ('students' table). Always scoped to a school.
 * Email is unique per school only, so the same address may exist in several schools.
 */
@Entity
@Table(name = "students",
        uniqueConstraints = @UniqueConstraint(name = "uk_students_school_email", columnNames = {"school_id", "email"}),
        indexes = {
            @Index(name = "idx_students_email", columnList = "email"),
            @Index(name = "idx_students_class", columnList = "class_id")
        })
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@NoArgsConstructor
public class Student implements AccountRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "roll_number", length = 50)
    private String rollNumber;

    @Column(name = "class_id", length = 64)
    private String classId;

    @Column(name = "school_id", nullable = false, length = 64)
    private String schoolId;

    // Nullable for rows imported before role tagging; filled by LegacyRoleBackfill
    @Column(length = 30)
    @Convert(converter = RoleTagConverter.class)
    private Role role;

    @Column(nullable = false)
    private boolean active = true;

    @Embedded
    private LockoutState lockout = new LockoutState();

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
        if (role == null) {
            role = Role.STUDENT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @Override
    public PrincipalKind getKind() {
        return PrincipalKind.STUDENT;
    }

    @Override
    public Set<String> getMarkerAttributes() {
        Set<String> markers = new HashSet<>();
        if (rollNumber != null) {
            markers.add("rollNumber");
        }
        return markers;
    }

    @Override
    public boolean isDeleted() {
        return deletedAt != null;
    }
}
