package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.LockoutState;
import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.StaffAccount;
import com.example.schoolidentity.entity.Student;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StaffAccountRepository;
import com.example.schoolidentity.repository.StudentRepository;
import com.example.schoolidentity.support.MutableClock;
import com.example.schoolidentity.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final Instant NOW = Instant.parse("2024-09-01T08:00:00Z");

    @Mock
    private StaffAccountRepository staffAccountRepository;
    @Mock
    private StudentRepository studentRepository;
    @Mock
    private GuardianRepository guardianRepository;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(staffAccountRepository, studentRepository, guardianRepository,
                new MutableClock(NOW));
    }

    private static CredentialClaims claims(String id, String role) {
        return new CredentialClaims(id, role, null, null, NOW, NOW.plus(Duration.ofDays(7)));
    }

    @Test
    void studentTagResolvesInLearnerStore() {
        Student student = TestAccounts.student("s-1", "school-1", "class-7");
        when(studentRepository.findById("s-1")).thenReturn(Optional.of(student));

        ResolvedPrincipal principal = resolver.resolve(claims("s-1", "student"));

        assertEquals(PrincipalKind.STUDENT, principal.kind());
        assertEquals(Role.STUDENT, principal.role());
        assertEquals("school-1", principal.tenantId());
        assertEquals("class-7", principal.classId());
        verify(staffAccountRepository, never()).findById("s-1");
    }

    @Test
    void parentTagResolvesInGuardianStoreWithLinks() {
        Guardian guardian = TestAccounts.guardian("g-1", "school-1", "s-1", "s-2");
        when(guardianRepository.findById("g-1")).thenReturn(Optional.of(guardian));

        ResolvedPrincipal principal = resolver.resolve(claims("g-1", "parent"));

        assertEquals(Role.PARENT, principal.role());
        assertEquals("school-1", principal.tenantId());
        assertEquals(List.of("s-1", "s-2"), principal.linkedStudentIds());
    }

    @Test
    void guardianWithoutSchoolTakesSchoolOfFirstLinkedStudent() {
        Guardian guardian = TestAccounts.guardian("g-1", null, "s-9", "s-2");
        when(guardianRepository.findById("g-1")).thenReturn(Optional.of(guardian));
        when(studentRepository.findById("s-9")).thenReturn(Optional.of(TestAccounts.student("s-9", "school-9", null)));

        assertEquals("school-9", resolver.resolve(claims("g-1", "parent")).tenantId());
    }

    @Test
    void guardianSchoolLookupFailureStillResolves() {
        Guardian guardian = TestAccounts.guardian("g-1", null, "s-1");
        when(guardianRepository.findById("g-1")).thenReturn(Optional.of(guardian));
        when(studentRepository.findById("s-1")).thenThrow(new DataAccessResourceFailureException("down"));

        ResolvedPrincipal principal = resolver.resolve(claims("g-1", "parent"));

        assertEquals("g-1", principal.id());
        assertNull(principal.tenantId());
    }

    @Test
    void staffRoleMustMatchStoredRole() {
        when(staffAccountRepository.findById("t-1"))
                .thenReturn(Optional.of(TestAccounts.staff("t-1", Role.TEACHER, "school-1")));

        assertEquals(Role.TEACHER, resolver.resolve(claims("t-1", "teacher")).role());

        AuthenticationFailedException ex = assertThrows(AuthenticationFailedException.class,
                () -> resolver.resolve(claims("t-1", "school_admin")));
        assertEquals(AuthFailureReason.PRINCIPAL_NOT_FOUND, ex.getReason());
    }

    @Test
    void untaggedCredentialTriesStaffThenLearners() {
        when(staffAccountRepository.findById("s-1")).thenReturn(Optional.empty());
        when(studentRepository.findById("s-1")).thenReturn(Optional.of(TestAccounts.student("s-1", "school-1", null)));

        ResolvedPrincipal principal = resolver.resolve(claims("s-1", null));

        assertEquals(Role.STUDENT, principal.role());
    }

    @Test
    void userTagFindsStaffFirst() {
        when(staffAccountRepository.findById("a-1")).thenReturn(Optional.of(TestAccounts.staff("a-1", Role.ADMIN, null)));

        assertEquals(Role.ADMIN, resolver.resolve(claims("a-1", "user")).role());
        verify(studentRepository, never()).findById("a-1");
    }

    @Test
    void untaggedCredentialNeverReachesGuardians() {
        when(staffAccountRepository.findById("g-1")).thenReturn(Optional.empty());
        when(studentRepository.findById("g-1")).thenReturn(Optional.empty());

        AuthenticationFailedException ex = assertThrows(AuthenticationFailedException.class,
                () -> resolver.resolve(claims("g-1", null)));

        assertEquals(AuthFailureReason.PRINCIPAL_NOT_FOUND, ex.getReason());
        verify(guardianRepository, never()).findById("g-1");
    }

    @Test
    void unknownRoleTagIsMalformed() {
        AuthenticationFailedException ex = assertThrows(AuthenticationFailedException.class,
                () -> resolver.resolve(claims("x-1", "superuser")));
        assertEquals(AuthFailureReason.MALFORMED_CREDENTIAL, ex.getReason());
    }

    @Test
    void softDeletedRowDoesNotResolve() {
        Student student = TestAccounts.student("s-1", "school-1", null);
        student.setDeletedAt(NOW.minusSeconds(60));
        when(studentRepository.findById("s-1")).thenReturn(Optional.of(student));

        AuthenticationFailedException ex = assertThrows(AuthenticationFailedException.class,
                () -> resolver.resolve(claims("s-1", "student")));
        assertEquals(AuthFailureReason.PRINCIPAL_NOT_FOUND, ex.getReason());
    }

    @Test
    void lockIsEvaluatedAgainstTheClock() {
        Student locked = TestAccounts.student("s-1", "school-1", null);
        locked.setLockout(new LockoutState(5, NOW.plus(Duration.ofHours(1))));
        Student expired = TestAccounts.student("s-2", "school-1", null);
        expired.setLockout(new LockoutState(5, NOW.minusSeconds(1)));
        when(studentRepository.findById("s-1")).thenReturn(Optional.of(locked));
        when(studentRepository.findById("s-2")).thenReturn(Optional.of(expired));

        assertTrue(resolver.resolve(claims("s-1", "student")).locked());
        assertFalse(resolver.resolve(claims("s-2", "student")).locked());
    }

    @Test
    void resolverDoesNotJudgeActiveFlag() {
        StaffAccount inactive = TestAccounts.staff("t-1", Role.TEACHER, "school-1");
        inactive.setActive(false);
        when(staffAccountRepository.findById("t-1")).thenReturn(Optional.of(inactive));

        assertFalse(resolver.resolve(claims("t-1", "teacher")).active());
    }
}
