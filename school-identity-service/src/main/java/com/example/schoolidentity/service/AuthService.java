package com.example.schoolidentity.service;

import com.example.schoolidentity.dto.ChangePasswordRequest;
import com.example.schoolidentity.dto.CreateStaffRequest;
import com.example.schoolidentity.dto.LoginRequest;
import com.example.schoolidentity.dto.LoginResponse;
import com.example.schoolidentity.dto.PrincipalResponse;
import com.example.schoolidentity.dto.RegisterAdminRequest;
import com.example.schoolidentity.dto.SchoolLoginRequest;
import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.StaffAccount;
import com.example.schoolidentity.entity.Student;
import com.example.schoolidentity.exception.AmbiguousAccountException;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import com.example.schoolidentity.exception.BadRequestException;
import com.example.schoolidentity.exception.ConflictException;
import com.example.schoolidentity.exception.ForbiddenException;
import com.example.schoolidentity.exception.InvalidCredentialsException;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StaffAccountRepository;
import com.example.schoolidentity.repository.StudentRepository;
import com.example.schoolidentity.security.CredentialCodec;
import com.example.schoolidentity.security.ResolvedPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Login for the three account stores, plus admin bootstrap and staff creation.
 *
 * Every login loads the account row with a pessimistic write lock so the failed-attempt
 * counter is updated atomically. Failures are committed, not rolled back, which is why the
 * login methods declare noRollbackFor on the rejection exceptions.
 */
@Service
@Slf4j
public class AuthService {

    private final StaffAccountRepository staffAccountRepository;
    private final StudentRepository studentRepository;
    private final GuardianRepository guardianRepository;
    private final PasswordEncoder passwordEncoder;
    private final CredentialCodec credentialCodec;
    private final LockoutTracker lockoutTracker;
    private final AuditService auditService;
    private final Clock clock;
    private final String registrationSecret;

    public AuthService(
            StaffAccountRepository staffAccountRepository,
            StudentRepository studentRepository,
            GuardianRepository guardianRepository,
            PasswordEncoder passwordEncoder,
            CredentialCodec credentialCodec,
            LockoutTracker lockoutTracker,
            AuditService auditService,
            Clock clock,
            @Value("${identity.admin.registration-secret:}") String registrationSecret) {
        this.staffAccountRepository = staffAccountRepository;
        this.studentRepository = studentRepository;
        this.guardianRepository = guardianRepository;
        this.passwordEncoder = passwordEncoder;
        this.credentialCodec = credentialCodec;
        this.lockoutTracker = lockoutTracker;
        this.auditService = auditService;
        this.clock = clock;
        this.registrationSecret = registrationSecret;
    }

    // ==================== Login ====================

    /**
     * Staff and administrator login by email.
     *
     * @throws InvalidCredentialsException unknown email or wrong password (401)
     * @throws AuthenticationFailedException account locked or deactivated (401)
     */
    @Transactional(noRollbackFor = {InvalidCredentialsException.class, AuthenticationFailedException.class})
    public LoginResponse staffLogin(LoginRequest request) {
        String email = normalizeEmail(request.email());
        StaffAccount account = staffAccountRepository.findByEmailForUpdate(email)
                .orElseThrow(() -> unknownEmail(email));
        return login(account, request.password());
    }

    /**
     * Learner login. Emails are unique per school only.
     *
     * @throws AmbiguousAccountException email found in several schools and no schoolId given (400)
     */
    @Transactional(noRollbackFor = {InvalidCredentialsException.class, AuthenticationFailedException.class})
    public LoginResponse studentLogin(SchoolLoginRequest request) {
        String email = normalizeEmail(request.email());
        Student candidate = pickCandidate(studentRepository.findAllByEmail(email), request.schoolId(),
                Student::getSchoolId, email);
        Student student = studentRepository.findByIdForUpdate(candidate.getId())
                .orElseThrow(() -> unknownEmail(email));
        return login(student, request.password());
    }

    @Transactional(noRollbackFor = {InvalidCredentialsException.class, AuthenticationFailedException.class})
    public LoginResponse guardianLogin(SchoolLoginRequest request) {
        String email = normalizeEmail(request.email());
        Guardian candidate = pickCandidate(guardianRepository.findAllByEmail(email), request.schoolId(),
                Guardian::getSchoolId, email);
        Guardian guardian = guardianRepository.findByIdForUpdate(candidate.getId())
                .orElseThrow(() -> unknownEmail(email));
        return login(guardian, request.password());
    }

    /**
     * Lock check, then password, then the active flag. The active flag is checked only
     * after a correct password so deactivated accounts are not revealed to guessers.
     */
    private LoginResponse login(AccountRecord account, String password) {
        if (lockoutTracker.isLocked(account.getLockout())) {
            auditService.logLoginDenied(account.getKind(), account.getId(), account.getEmail(), "Account is locked");
            throw new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_LOCKED);
        }

        if (!passwordEncoder.matches(password, account.getPasswordHash())) {
            boolean justLocked = lockoutTracker.recordFailure(account.getLockout());
            auditService.logLoginFailure(account.getKind(), account.getId(), account.getEmail(), "Invalid password");
            if (justLocked) {
                log.warn("{} account {} locked after {} failed attempts",
                        account.getKind(), account.getId(), account.getLockout().getFailedAttempts());
                auditService.logAccountLocked(account.getKind(), account.getId(), account.getEmail(),
                        account.getLockout().getFailedAttempts());
            }
            throw new InvalidCredentialsException();
        }

        if (!account.isActive()) {
            auditService.logLoginDenied(account.getKind(), account.getId(), account.getEmail(), "Account is deactivated");
            throw new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_DEACTIVATED);
        }

        lockoutTracker.recordSuccess(account.getLockout());
        account.setLastLoginAt(clock.instant());

        String token = credentialCodec.issue(account);
        auditService.logLoginSuccess(account.getKind(), account.getId(), account.getEmail());
        log.info("{} {} logged in", account.getKind(), account.getId());

        return LoginResponse.of(token, credentialCodec.getExpiration().toSeconds(), PrincipalResponse.from(account));
    }

    private <T extends AccountRecord> T pickCandidate(List<T> matches, String schoolId,
                                                       Function<T, String> schoolOf, String email) {
        List<T> candidates = schoolId == null || schoolId.isBlank()
                ? matches
                : matches.stream().filter(m -> schoolId.equals(schoolOf.apply(m))).toList();

        if (candidates.isEmpty()) {
            throw unknownEmail(email);
        }
        if (candidates.size() > 1) {
            List<String> schools = candidates.stream()
                    .map(schoolOf)
                    .filter(Objects::nonNull)
                    .distinct()
                    .toList();
            throw new AmbiguousAccountException(schools);
        }
        return candidates.get(0);
    }

    private InvalidCredentialsException unknownEmail(String email) {
        auditService.logLoginFailure(null, null, email, "Account not found");
        return new InvalidCredentialsException();
    }

    // ==================== Password ====================

    /**
     * Change the signed-in principal's password after re-verifying the current one.
     * A wrong current password is a 400, not a 401, and does not count towards lockout.
     *
     * @throws BadRequestException current password wrong, or new password equals it (400)
     * @throws AuthenticationFailedException account disappeared since the request was authenticated (401)
     */
    @Transactional
    public void changePassword(ResolvedPrincipal principal, ChangePasswordRequest request) {
        AccountRecord account = loadForUpdate(principal)
                .orElseThrow(() -> new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_NOT_FOUND));

        if (!passwordEncoder.matches(request.currentPassword(), account.getPasswordHash())) {
            log.warn("Password change for {} {} rejected: current password mismatch", account.getKind(), account.getId());
            throw new BadRequestException("Current password is incorrect");
        }
        if (request.currentPassword().equals(request.newPassword())) {
            throw new BadRequestException("New password must differ from the current password");
        }

        account.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        auditService.logPasswordChanged(account.getKind(), account.getId(), account.getEmail());
        log.info("{} {} changed password", account.getKind(), account.getId());
    }

    private Optional<? extends AccountRecord> loadForUpdate(ResolvedPrincipal principal) {
        return switch (principal.kind()) {
            case STAFF -> staffAccountRepository.findByIdForUpdate(principal.id());
            case STUDENT -> studentRepository.findByIdForUpdate(principal.id());
            case GUARDIAN -> guardianRepository.findByIdForUpdate(principal.id());
        };
    }

    // ==================== Account creation ====================

    /**
     * Bootstrap a global administrator. Requires the configured registration secret.
     *
     * @throws ForbiddenException secret missing or wrong (403)
     * @throws ConflictException email already registered (409)
     */
    @Transactional
    public LoginResponse registerAdmin(RegisterAdminRequest request) {
        if (!secretMatches(request.secretCode())) {
            log.warn("Admin registration attempted with an invalid secret for {}", request.email());
            throw ForbiddenException.invalidRegistrationSecret();
        }

        StaffAccount admin = newStaff(request.name(), request.email(), request.password(), Role.ADMIN, null);
        admin = saveStaff(admin);

        auditService.logAccountCreated(AuditService.AccountSnapshot.of(admin), admin.getId(), admin.getEmail());
        String token = credentialCodec.issue(admin);
        return LoginResponse.of(token, credentialCodec.getExpiration().toSeconds(), PrincipalResponse.from(admin));
    }

    /**
     * Create a teacher, librarian or accountant. School admins always create inside
     * their own school; global admins must name one.
     */
    @Transactional
    public PrincipalResponse createStaff(CreateStaffRequest request, ResolvedPrincipal creator) {
        Role role = Role.fromTag(request.role())
                .filter(r -> r == Role.TEACHER || r == Role.LIBRARIAN || r == Role.ACCOUNTANT)
                .orElseThrow(() -> new BadRequestException("Role must be teacher, librarian or accountant"));

        String schoolId = creator.role() == Role.SCHOOL_ADMIN
                ? creator.tenantId()
                : Optional.ofNullable(request.schoolId()).filter(s -> !s.isBlank())
                        .orElseThrow(() -> new BadRequestException("schoolId is required"));

        if (creator.role() == Role.SCHOOL_ADMIN && request.schoolId() != null
                && !request.schoolId().isBlank() && !request.schoolId().equals(schoolId)) {
            throw new ForbiddenException("School admins can only create staff in their own school");
        }

        StaffAccount staff = saveStaff(newStaff(request.name(), request.email(), request.password(), role, schoolId));

        auditService.logAccountCreated(AuditService.AccountSnapshot.of(staff), creator.id(), creator.email());
        log.info("Staff {} ({}) created in school {} by {}", staff.getId(), role, schoolId, creator.id());
        return PrincipalResponse.from(staff);
    }

    private StaffAccount newStaff(String name, String email, String password, Role role, String schoolId) {
        String normalized = normalizeEmail(email);
        if (staffAccountRepository.existsByEmail(normalized)) {
            throw ConflictException.emailTaken(normalized);
        }
        StaffAccount account = new StaffAccount();
        account.setName(name.trim());
        account.setEmail(normalized);
        account.setPasswordHash(passwordEncoder.encode(password));
        account.setRole(role);
        account.setSchoolId(schoolId);
        account.setActive(true);
        return account;
    }

    private StaffAccount saveStaff(StaffAccount account) {
        // DB unique constraint covers the race between existsByEmail and insert
        try {
            return staffAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            throw ConflictException.emailTaken(account.getEmail());
        }
    }

    private boolean secretMatches(String provided) {
        if (registrationSecret == null || registrationSecret.isEmpty() || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                registrationSecret.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
