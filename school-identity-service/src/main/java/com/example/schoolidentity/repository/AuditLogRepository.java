package com.example.schoolidentity.repository;

import com.example.schoolidentity.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for AuditLog entity.
 *
 * Rows are written by AuditService and never changed.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
}
