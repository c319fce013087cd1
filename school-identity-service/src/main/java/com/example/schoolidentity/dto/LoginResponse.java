package com.example.schoolidentity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login response: bearer credential plus the principal it was issued for.
 */
public record LoginResponse(
    @JsonProperty("accessToken")
    String accessToken,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn,

    @JsonProperty("principal")
    PrincipalResponse principal
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static LoginResponse of(String accessToken, long expiresInSeconds, PrincipalResponse principal) {
        return new LoginResponse(accessToken, "Bearer", expiresInSeconds, principal);
    }
}
