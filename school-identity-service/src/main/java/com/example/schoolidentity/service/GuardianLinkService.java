package com.example.schoolidentity.service;

import com.example.schoolidentity.dto.GuardianLinksResponse;
import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.Student;
import com.example.schoolidentity.exception.ForbiddenException;
import com.example.schoolidentity.exception.ResourceNotFoundException;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StudentRepository;
import com.example.schoolidentity.security.ResolvedPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the guardian to learner links.
 *
 * Links are read live by the mailbox router, so a change here affects the next
 * delivery without any cache to invalidate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuardianLinkService {

    private final GuardianRepository guardianRepository;
    private final StudentRepository studentRepository;
    private final AuditService auditService;

    /**
     * Idempotent. A guardian without a school takes the school of the first learner linked.
     */
    @Transactional
    public GuardianLinksResponse link(String guardianId, String studentId, ResolvedPrincipal actor) {
        Guardian guardian = guardianRepository.findByIdForUpdate(guardianId)
                .orElseThrow(() -> ResourceNotFoundException.guardian(guardianId));
        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> ResourceNotFoundException.student(studentId));

        requireSameSchool(actor, student.getSchoolId());

        if (guardian.linkStudent(studentId)) {
            if (guardian.getSchoolId() == null) {
                guardian.setSchoolId(student.getSchoolId());
            }
            auditService.logGuardianLink(guardianId, studentId, true, actor.id());
            log.info("Linked student {} to guardian {}", studentId, guardianId);
        }
        return GuardianLinksResponse.from(guardian);
    }

    @Transactional
    public GuardianLinksResponse unlink(String guardianId, String studentId, ResolvedPrincipal actor) {
        Guardian guardian = guardianRepository.findByIdForUpdate(guardianId)
                .orElseThrow(() -> ResourceNotFoundException.guardian(guardianId));

        if (actor.role() == Role.SCHOOL_ADMIN) {
            // the learner may already be gone, fall back to the guardian's school
            String school = studentRepository.findById(studentId)
                    .map(Student::getSchoolId)
                    .orElse(guardian.getSchoolId());
            requireSameSchool(actor, school);
        }

        if (guardian.unlinkStudent(studentId)) {
            auditService.logGuardianLink(guardianId, studentId, false, actor.id());
            log.info("Unlinked student {} from guardian {}", studentId, guardianId);
        }
        return GuardianLinksResponse.from(guardian);
    }

    private static void requireSameSchool(ResolvedPrincipal actor, String schoolId) {
        if (actor.role() == Role.SCHOOL_ADMIN && (schoolId == null || !schoolId.equals(actor.tenantId()))) {
            throw new ForbiddenException("School admins can only manage links inside their own school");
        }
    }
}
