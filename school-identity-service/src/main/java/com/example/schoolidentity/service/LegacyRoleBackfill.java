package com.example.schoolidentity.service;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StudentRepository;
import com.example.schoolidentity.security.RoleInference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * One-off migration that writes an explicit role onto learner and guardian rows
 * created before roles were stored.
 *
 * Enabled with identity.migration.backfill-roles=true. Staff rows always carry a
 * role (the column is NOT NULL), so only the learner and guardian stores are scanned.
 */
@Component
@ConditionalOnProperty(name = "identity.migration.backfill-roles", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LegacyRoleBackfill implements ApplicationRunner {

    private final StudentRepository studentRepository;
    private final GuardianRepository guardianRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int students = backfill(studentRepository.findAllUntagged(), (account, role) -> account.setRole(role));
        int guardians = backfill(guardianRepository.findAllUntagged(), (account, role) -> account.setRole(role));
        log.info("Role backfill done: students={}, guardians={}", students, guardians);
    }

    <T extends AccountRecord> int backfill(List<T> untagged, BiConsumer<T, Role> setter) {
        for (T account : untagged) {
            String tag = RoleInference.inferTag(account);
            Role role = Role.fromTag(tag)
                    .orElseThrow(() -> new IllegalStateException(
                            "No role for tag '" + tag + "' on " + account.getKind() + " " + account.getId()));
            setter.accept(account, role);
        }
        return untagged.size();
    }
}
