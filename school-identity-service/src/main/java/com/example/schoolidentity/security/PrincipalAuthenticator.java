package com.example.schoolidentity.security;

import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Credential to authenticated principal: verify, resolve, then the active and locked checks.
 *
 * Both the HTTP request filter and the WebSocket handshake call this; they only differ
 * in where the raw credential is read from.
 */
@Component
@RequiredArgsConstructor
public class PrincipalAuthenticator {

    private final CredentialCodec credentialCodec;
    private final IdentityResolver identityResolver;

    /**
     * @throws AuthenticationFailedException with the internal reason
     */
    public Authenticated authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException(AuthFailureReason.MISSING_CREDENTIAL);
        }
        CredentialClaims claims = credentialCodec.verify(token);
        return new Authenticated(claims, authenticate(claims));
    }

    /**
     * Resolve and check already verified claims. Used again for open connections.
     */
    public ResolvedPrincipal authenticate(CredentialClaims claims) {
        ResolvedPrincipal principal = identityResolver.resolve(claims);

        if (!principal.active()) {
            throw new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_DEACTIVATED);
        }
        if (principal.locked()) {
            throw new AuthenticationFailedException(AuthFailureReason.PRINCIPAL_LOCKED);
        }
        return principal;
    }

    public record Authenticated(CredentialClaims claims, ResolvedPrincipal principal) {
    }
}
