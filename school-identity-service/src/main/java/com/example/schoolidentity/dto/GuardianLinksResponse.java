package com.example.schoolidentity.dto;

import com.example.schoolidentity.entity.Guardian;

import java.util.List;

public record GuardianLinksResponse(String guardianId, List<String> studentIds) {

    public static GuardianLinksResponse from(Guardian guardian) {
        return new GuardianLinksResponse(guardian.getId(), List.copyOf(guardian.getStudentIds()));
    }
}
