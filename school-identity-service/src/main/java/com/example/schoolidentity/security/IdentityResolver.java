package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.StaffAccount;
import com.example.schoolidentity.entity.Student;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StaffAccountRepository;
import com.example.schoolidentity.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Turns verified claims into a concrete principal.
 *
 * Store selection by role tag:
 * <ol>
 *   <li>student: learner store, role forced to student</li>
 *   <li>parent: guardian store, role forced to parent, school derived from the first
 *       linked learner when the guardian has none</li>
 *   <li>any other known role: staff store, stored role must match the tag</li>
 *   <li>no tag (or the inferred "user" tag): staff store, then learner store.
 *       The guardian store is never searched on this path.</li>
 * </ol>
 * Unknown tags are rejected as malformed. Soft-deleted rows never resolve.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityResolver {

    private final StaffAccountRepository staffAccountRepository;
    private final StudentRepository studentRepository;
    private final GuardianRepository guardianRepository;
    private final Clock clock;

    public ResolvedPrincipal resolve(CredentialClaims claims) {
        String id = claims.principalId();

        if (!claims.hasRoleTag() || RoleInference.LEGACY_USER_TAG.equals(claims.roleTag())) {
            return resolveLegacy(id);
        }

        Role role = Role.fromTag(claims.roleTag())
                .orElseThrow(() -> {
                    log.warn("Unknown role tag '{}' in credential for principal {}", claims.roleTag(), id);
                    return new AuthenticationFailedException(AuthFailureReason.MALFORMED_CREDENTIAL);
                });

        return switch (role) {
            case STUDENT -> resolveStudent(id);
            case PARENT -> resolveGuardian(id);
            default -> resolveStaff(id, role);
        };
    }

    private ResolvedPrincipal resolveStudent(String id) {
        Student student = live(studentRepository.findById(id))
                .orElseThrow(() -> notFound(id, "students"));
        return toPrincipal(student, Role.STUDENT, student.getSchoolId());
    }

    private ResolvedPrincipal resolveGuardian(String id) {
        Guardian guardian = live(guardianRepository.findById(id))
                .orElseThrow(() -> notFound(id, "guardians"));

        String tenantId = guardian.getSchoolId();
        if (tenantId == null) {
            tenantId = deriveGuardianSchool(guardian);
        }
        return toPrincipal(guardian, Role.PARENT, tenantId);
    }

    private ResolvedPrincipal resolveStaff(String id, Role claimedRole) {
        StaffAccount staff = live(staffAccountRepository.findById(id))
                .orElseThrow(() -> notFound(id, "staff_accounts"));

        if (staff.getRole() != claimedRole) {
            log.warn("Credential role '{}' does not match stored role '{}' for staff {}",
                    claimedRole, staff.getRole(), id);
            throw new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_NOT_FOUND);
        }
        return toPrincipal(staff, staff.getRole(), staff.getSchoolId());
    }

    private ResolvedPrincipal resolveLegacy(String id) {
        Optional<StaffAccount> staff = live(staffAccountRepository.findById(id));
        if (staff.isPresent()) {
            StaffAccount account = staff.get();
            return toPrincipal(account, account.getRole(), account.getSchoolId());
        }

        Student student = live(studentRepository.findById(id))
                .orElseThrow(() -> notFound(id, "staff_accounts, students"));
        log.debug("Legacy credential for {} resolved in learner store", id);
        return toPrincipal(student, Role.STUDENT, student.getSchoolId());
    }

    /**
     * School of the first linked learner. Lookup failures are logged and the guardian
     * is returned without a school rather than rejected.
     */
    private String deriveGuardianSchool(Guardian guardian) {
        String firstStudentId = guardian.getStudentIds().isEmpty() ? null : guardian.getStudentIds().get(0);
        if (firstStudentId == null) {
            return null;
        }
        try {
            return studentRepository.findById(firstStudentId)
                    .map(Student::getSchoolId)
                    .orElse(null);
        } catch (DataAccessException e) {
            log.warn("Could not derive school for guardian {} from student {}: {}",
                    guardian.getId(), firstStudentId, e.getMessage());
            return null;
        }
    }

    private ResolvedPrincipal toPrincipal(AccountRecord account, Role role, String tenantId) {
        boolean locked = account.getLockout() != null && account.getLockout().isLockedAt(clock.instant());
        return ResolvedPrincipal.of(account, role, tenantId, locked);
    }

    private static <T extends AccountRecord> Optional<T> live(Optional<T> account) {
        return account.filter(a -> !a.isDeleted());
    }

    private static AuthenticationFailedException notFound(String id, String searched) {
        log.warn("Principal {} not found (searched: {})", id, searched);
        return new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_NOT_FOUND);
    }
}
