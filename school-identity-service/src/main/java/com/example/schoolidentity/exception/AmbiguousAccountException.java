package com.example.schoolidentity.exception;

import lombok.Getter;

import java.util.List;

/**
 * Learner or guardian email registered in several schools and no school given at login.
 */
@Getter
public class AmbiguousAccountException extends BadRequestException {

    private final List<String> candidateSchoolIds;

    public AmbiguousAccountException(List<String> candidateSchoolIds) {
        super("AMBIGUOUS_ACCOUNT", "Multiple accounts found with this email. Please provide your school.");
        this.candidateSchoolIds = List.copyOf(candidateSchoolIds);
    }
}
