package com.example.schoolidentity.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Guardian accounts ('guardians' table).
 *
 * Linked learners are one ordered, duplicate-free relation. The historical
 * single-child link survives only as the read alias {@link #getStudentId()}.
 * The school is optional; when absent it is derived from the first linked learner.
 */
@Entity
@Table(name = "guardians",
        indexes = @Index(name = "idx_guardians_email", columnList = "email"))
@SQLRestriction("deleted_at IS NULL")
@Getter
@Setter
@NoArgsConstructor
public class Guardian implements AccountRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "parent_type", length = 20)
    private ParentType parentType;

    @Column(name = "school_id", length = 64)
    private String schoolId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "guardian_students", joinColumns = @JoinColumn(name = "guardian_id"))
    @OrderColumn(name = "position")
    @Column(name = "student_id", nullable = false, length = 64)
    @Setter(lombok.AccessLevel.NONE)
    private List<String> studentIds = new ArrayList<>();

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
            role = Role.PARENT;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public List<String> getStudentIds() {
        return Collections.unmodifiableList(studentIds);
    }

    /**
     * @return true if the learner was not linked yet
     */
    public boolean linkStudent(String studentId) {
        if (studentIds.contains(studentId)) {
            return false;
        }
        return studentIds.add(studentId);
    }

    public boolean unlinkStudent(String studentId) {
        return studentIds.remove(studentId);
    }

    /**
     * First linked learner.
     *
     * @deprecated single-child link kept for old clients, use {@link #getStudentIds()}
     */
    @Deprecated
    public String getStudentId() {
        return studentIds.isEmpty() ? null : studentIds.get(0);
    }

    @Override
    public PrincipalKind getKind() {
        return PrincipalKind.GUARDIAN;
    }

    @Override
    public Set<String> getMarkerAttributes() {
        Set<String> markers = new HashSet<>();
        if (parentType != null) {
            markers.add("parentType");
        }
        return markers;
    }

    @Override
    public boolean isDeleted() {
        return deletedAt != null;
    }
}
