package com.example.schoolidentity.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.util.Set;

/**
 * Staff and administrator accounts ('staff_accounts' table).
 *
 * One shared store for admin, school_admin, teacher, librarian and accountant;
 * the role decides authorization scope inside the school.
 *
 * Soft Delete Implementation:
 * - Uses @SQLRestriction to filter deleted accounts by default
 * - deleted_at: timestamp when soft deleted (NULL = not deleted)
 */
@Entity
@Table(name = "staff_accounts", indexes = {
    @Index(name = "idx_staff_email", columnList = "email"),
    @Index(name = "idx_staff_school", columnList = "school_id"),
    @Index(name = "idx_staff_deleted_at", columnList = "deleted_at")
})
@SQLRestriction("deleted_at IS NULL")
public class StaffAccount implements AccountRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 30)
    @Convert(converter = RoleTagConverter.class)
    private Role role;

    // NULL only for global admins
    @Column(name = "school_id", length = 64)
    private String schoolId;

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
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public StaffAccount() {
    }

    @Override
    public PrincipalKind getKind() {
        return PrincipalKind.STAFF;
    }

    @Override
    public Set<String> getMarkerAttributes() {
        return Set.of();
    }

    @Override
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @Override
    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    @Override
    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    @Override
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    @Override
    public String getSchoolId() {
        return schoolId;
    }

    public void setSchoolId(String schoolId) {
        this.schoolId = schoolId;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public LockoutState getLockout() {
        return lockout;
    }

    public void setLockout(LockoutState lockout) {
        this.lockout = lockout;
    }

    public Instant getLastLoginAt() {
        return lastLoginAt;
    }

    @Override
    public void setLastLoginAt(Instant lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(Instant deletedAt) {
        this.deletedAt = deletedAt;
    }

    @Override
    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Soft delete this account.
     */
    public void softDelete() {
        this.deletedAt = Instant.now();
    }
}
