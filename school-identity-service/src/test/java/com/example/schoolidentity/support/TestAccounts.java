package com.example.schoolidentity.support;

import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.entity.ParentType;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.StaffAccount;
import com.example.schoolidentity.entity.Student;

/**
 * Unsaved account fixtures. Ids are left null unless given, so the rows can be persisted.
 */
public final class TestAccounts {

    private TestAccounts() {
    }

    public static StaffAccount staff(String id, Role role, String schoolId) {
        StaffAccount account = new StaffAccount();
        account.setId(id);
        account.setEmail(role.tag() + "-" + (id == null ? "new" : id) + "@school.test");
        account.setName("Staff " + id);
        account.setPasswordHash("{noop}unused");
        account.setRole(role);
        account.setSchoolId(schoolId);
        account.setActive(true);
        return account;
    }

    public static Student student(String id, String schoolId, String classId) {
        Student student = new Student();
        student.setId(id);
        student.setEmail("student-" + (id == null ? "new" : id) + "@school.test");
        student.setName("Student " + id);
        student.setPasswordHash("{noop}unused");
        student.setRollNumber("R-" + id);
        student.setSchoolId(schoolId);
        student.setClassId(classId);
        student.setRole(Role.STUDENT);
        return student;
    }

    public static Guardian guardian(String id, String schoolId, String... studentIds) {
        Guardian guardian = new Guardian();
        guardian.setId(id);
        guardian.setEmail("parent-" + (id == null ? "new" : id) + "@school.test");
        guardian.setName("Parent " + id);
        guardian.setPasswordHash("{noop}unused");
        guardian.setParentType(ParentType.GUARDIAN);
        guardian.setSchoolId(schoolId);
        guardian.setRole(Role.PARENT);
        for (String studentId : studentIds) {
            guardian.linkStudent(studentId);
        }
        return guardian;
    }
}
