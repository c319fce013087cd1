package com.example.schoolidentity.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of roles carried in credentials and checked by the guards.
 *
 * The wire form is the lower-case tag ("school_admin"), not the enum name.
 * Spring Security authorities are built as "ROLE_" + tag.
 */
public enum Role {
    /**
     * Global administrator, not bound to a school.
     */
    ADMIN("admin", PrincipalKind.STAFF),

    SCHOOL_ADMIN("school_admin", PrincipalKind.STAFF),

    TEACHER("teacher", PrincipalKind.STAFF),

    LIBRARIAN("librarian", PrincipalKind.STAFF),

    ACCOUNTANT("accountant", PrincipalKind.STAFF),

    /**
     * Learner, always backed by the students store.
     */
    STUDENT("student", PrincipalKind.STUDENT),

    /**
     * Guardian, always backed by the guardians store.
     */
    PARENT("parent", PrincipalKind.GUARDIAN);

    private final String tag;
    private final PrincipalKind store;

    Role(String tag, PrincipalKind store) {
        this.tag = tag;
        this.store = store;
    }

    public String tag() {
        return tag;
    }

    /**
     * Store that holds accounts of this role.
     */
    public PrincipalKind store() {
        return store;
    }

    public String authority() {
        return "ROLE_" + tag;
    }

    public boolean isStaff() {
        return store == PrincipalKind.STAFF;
    }

    public static Optional<Role> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.tag.equals(tag))
                .findFirst();
    }

    @Override
    public String toString() {
        return tag;
    }
}
