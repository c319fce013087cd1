package com.example.schoolidentity.entity;

public enum ParentType {
    FATHER,
    MOTHER,
    GUARDIAN
}
