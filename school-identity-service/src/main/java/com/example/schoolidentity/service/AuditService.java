package com.example.schoolidentity.service;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.AuditAction;
import com.example.schoolidentity.entity.AuditLog;
import com.example.schoolidentity.entity.AuditLog.AuditOutcome;
import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.repository.AuditLogRepository;
import com.example.schoolidentity.security.CorrelationIdFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Service for creating audit logs.
 *
 * Design Decisions:
 * 1. @Async: audit writes never delay a login
 * 2. REQUIRES_NEW: rows survive a rollback of the calling transaction
 * 3. Failures are logged and dropped, the main operation is unaffected
 * 4. Request context (client IP, user agent) comes from MDC, which
 *    MdcTaskDecorator copies onto the async thread
 *
 * Callers pass ids and emails rather than entities since the entity is
 * detached by the time the async task runs.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    // ==================== Authentication Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginSuccess(PrincipalKind kind, String principalId, String email) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.LOGIN_SUCCESS)
                .actorId(principalId)
                .actorEmail(email)
                .outcome(AuditOutcome.SUCCESS));
    }

    /**
     * Wrong password or unknown email. kind and principalId are null when nothing matched.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginFailure(PrincipalKind kind, String principalId, String email, String reason) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.LOGIN_FAILED)
                .actorId(principalId)
                .actorEmail(email)
                .detail(reason)
                .outcome(AuditOutcome.FAILURE));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginDenied(PrincipalKind kind, String principalId, String email, String reason) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.LOGIN_DENIED)
                .actorId(principalId)
                .actorEmail(email)
                .detail(reason)
                .outcome(AuditOutcome.DENIED));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAccountLocked(PrincipalKind kind, String principalId, String email, int failedAttempts) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.ACCOUNT_LOCKED)
                .actorEmail(email)
                .detail(toJson(Map.of("failedAttempts", failedAttempts)))
                .outcome(AuditOutcome.DENIED));
    }

    /**
     * Open real-time connection closed because its principal no longer authenticates.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logSessionRevoked(PrincipalKind kind, String principalId, String reason) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.SESSION_REVOKED)
                .detail(reason)
                .outcome(AuditOutcome.DENIED));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordChanged(PrincipalKind kind, String principalId, String email) {
        save(AuditLog.builder()
                .principalKind(kind)
                .principalId(principalId)
                .action(AuditAction.PASSWORD_CHANGED)
                .actorId(principalId)
                .actorEmail(email)
                .outcome(AuditOutcome.SUCCESS));
    }

    // ==================== Account Lifecycle Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAccountCreated(AccountSnapshot account, String actorId, String actorEmail) {
        save(AuditLog.builder()
                .principalKind(account.kind())
                .principalId(account.id())
                .action(AuditAction.CREATE)
                .actorId(actorId)
                .actorEmail(actorEmail)
                .detail(toJson(account))
                .outcome(AuditOutcome.SUCCESS));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logGuardianLink(String guardianId, String studentId, boolean linked, String actorId) {
        save(AuditLog.builder()
                .principalKind(PrincipalKind.GUARDIAN)
                .principalId(guardianId)
                .action(linked ? AuditAction.GUARDIAN_LINKED : AuditAction.GUARDIAN_UNLINKED)
                .actorId(actorId)
                .detail(toJson(Map.of("studentId", studentId)))
                .outcome(AuditOutcome.SUCCESS));
    }

    // ==================== Internal ====================

    private void save(AuditLog.AuditLogBuilder builder) {
        builder.ipAddress(MDC.get(CorrelationIdFilter.MDC_CLIENT_IP))
                .userAgent(truncate(MDC.get(CorrelationIdFilter.MDC_USER_AGENT), 500));
        AuditLog entry = builder.build();
        try {
            auditLogRepository.save(entry);
            log.debug("Audit log created: {} {} on {}:{}",
                    entry.getAction(), entry.getOutcome(), entry.getPrincipalKind(), entry.getPrincipalId());
        } catch (RuntimeException e) {
            log.error("Failed to create audit log: {} {} on {}:{}",
                    entry.getAction(), entry.getOutcome(), entry.getPrincipalKind(), entry.getPrincipalId(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit detail", e);
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    /**
     * Audit view of an account without the password hash.
     */
    public record AccountSnapshot(PrincipalKind kind, String id, String email, String role, String schoolId) {

        public static AccountSnapshot of(AccountRecord account) {
            return new AccountSnapshot(
                    account.getKind(),
                    account.getId(),
                    account.getEmail(),
                    account.getRole() != null ? account.getRole().tag() : null,
                    account.getSchoolId());
        }
    }
}
