package com.example.schoolidentity.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit log of security-sensitive operations on accounts.
 *
 * Rows are never updated or deleted. The account is addressed by store kind plus id
 * because ids are unique only inside their own store.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_principal", columnList = "principal_kind, principal_id"),
    @Index(name = "idx_audit_actor", columnList = "actor_id"),
    @Index(name = "idx_audit_action", columnList = "action"),
    @Index(name = "idx_audit_created_at", columnList = "created_at"),
    @Index(name = "idx_audit_outcome", columnList = "outcome")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Which account (NULL kind/id when the login email matched nothing)
    @Column(name = "principal_kind", length = 20)
    @Enumerated(EnumType.STRING)
    private PrincipalKind principalKind;

    @Column(name = "principal_id", length = 64)
    private String principalId;

    // What action was performed
    @Column(nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    // Who performed the action (NULL for system/anonymous actions)
    @Column(name = "actor_id", length = 64)
    private String actorId;

    @Column(name = "actor_email", length = 255)
    private String actorEmail;

    // When
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Request context
    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    // Free-text detail (JSON snapshot or failure reason)
    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    // Outcome
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private AuditOutcome outcome = AuditOutcome.SUCCESS;

    public enum AuditOutcome {
        SUCCESS,  // Action completed successfully
        FAILURE,  // Action failed (e.g., wrong password)
        DENIED    // Action denied (e.g., account locked or deactivated)
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
