package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.Student;

import java.util.List;

/**
 * The one shape every store resolves into. Attached to the security context for
 * HTTP requests and, reduced to id/role/tenant, to real-time connections.
 */
public record ResolvedPrincipal(
        String id,
        PrincipalKind kind,
        Role role,
        String tenantId,
        String email,
        String name,
        boolean active,
        boolean locked,
        List<String> linkedStudentIds,
        String classId) {

    public ResolvedPrincipal {
        linkedStudentIds = linkedStudentIds == null ? List.of() : List.copyOf(linkedStudentIds);
    }

    static ResolvedPrincipal of(AccountRecord account, Role role, String tenantId, boolean locked) {
        List<String> linked = account instanceof Guardian guardian ? guardian.getStudentIds() : List.of();
        String classId = account instanceof Student student ? student.getClassId() : null;
        return new ResolvedPrincipal(
                account.getId(),
                account.getKind(),
                role,
                tenantId,
                account.getEmail(),
                account.getName(),
                account.isActive(),
                locked,
                linked,
                classId);
    }
}
