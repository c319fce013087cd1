package com.example.schoolidentity.entity;

/**
 * The three disjoint account stores. An id is unique only within its own store.
 */
public enum PrincipalKind {
    STAFF,
    STUDENT,
    GUARDIAN
}
