package com.example.schoolidentity.service;

import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.Student;
import com.example.schoolidentity.repository.GuardianRepository;
import com.example.schoolidentity.repository.StudentRepository;
import com.example.schoolidentity.support.TestAccounts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LegacyRoleBackfillTest {

    @Mock
    private StudentRepository studentRepository;
    @Mock
    private GuardianRepository guardianRepository;

    @InjectMocks
    private LegacyRoleBackfill backfill;

    @Test
    void learnersAndGuardiansGetTheirStoreRole() {
        Student student = TestAccounts.student("s-1", "school-1", null);
        student.setRole(null);
        Guardian guardian = TestAccounts.guardian("g-1", "school-1");
        guardian.setRole(null);
        when(studentRepository.findAllUntagged()).thenReturn(List.of(student));
        when(guardianRepository.findAllUntagged()).thenReturn(List.of(guardian));

        backfill.run(new DefaultApplicationArguments());

        assertEquals(Role.STUDENT, student.getRole());
        assertEquals(Role.PARENT, guardian.getRole());
    }

    @Test
    void learnerShapedRowsAreCountedAsUpdated() {
        Student first = TestAccounts.student("s-1", "school-1", null);
        first.setRole(null);
        Student second = TestAccounts.student("s-2", "school-1", null);
        second.setRole(null);

        int updated = backfill.backfill(List.of(first, second), Student::setRole);

        assertEquals(2, updated);
        assertEquals(Role.STUDENT, second.getRole());
    }

    @Test
    void emptyStoresLeaveNothingToDo() {
        when(studentRepository.findAllUntagged()).thenReturn(List.of());
        when(guardianRepository.findAllUntagged()).thenReturn(List.of());

        assertDoesNotThrow(() -> backfill.run(new DefaultApplicationArguments()));
    }
}
