package com.example.schoolidentity.dto;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.Guardian;
import com.example.schoolidentity.security.ResolvedPrincipal;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Principal view for API responses. Never carries the password hash or lockout counters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrincipalResponse(
    @JsonProperty("id")
    String id,

    @JsonProperty("kind")
    String kind,

    @JsonProperty("role")
    String role,

    @JsonProperty("schoolId")
    String schoolId,

    @JsonProperty("email")
    String email,

    @JsonProperty("name")
    String name,

    @JsonProperty("studentIds")
    List<String> studentIds
) {
    public static PrincipalResponse from(ResolvedPrincipal principal) {
        return new PrincipalResponse(
            principal.id(),
            principal.kind().name(),
            principal.role().tag(),
            principal.tenantId(),
            principal.email(),
            principal.name(),
            principal.linkedStudentIds().isEmpty() ? null : principal.linkedStudentIds()
        );
    }

    public static PrincipalResponse from(AccountRecord account) {
        List<String> studentIds = account instanceof Guardian guardian ? guardian.getStudentIds() : null;
        return new PrincipalResponse(
            account.getId(),
            account.getKind().name(),
            account.getRole() != null ? account.getRole().tag() : null,
            account.getSchoolId(),
            account.getEmail(),
            account.getName(),
            studentIds
        );
    }
}
