package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.exception.AuthFailureReason;
import com.example.schoolidentity.exception.AuthenticationFailedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies bearer credentials.
 *
 * Algorithm: HS256, key from JWT_SECRET (at least 32 bytes).
 * Claims: sub (principal id), role, schoolId, email, iat, exp.
 * Credentials issued by older clients carry the principal id in "id" instead of "sub";
 * both are accepted on verify.
 */
@Service
@Slf4j
public class CredentialCodec {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_SCHOOL = "schoolId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_LEGACY_ID = "id";

    private final SecretKey secretKey;
    private final Duration expiration;
    private final Clock clock;

    @Autowired
    public CredentialCodec(
            @Value("${jwt.secret}") String jwtSecret,
            @Value("${jwt.expiration:P7D}") Duration expiration,
            Clock clock) {
        // HS256 requires at least 256 bits (32 bytes) key
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
        this.clock = clock;
    }

    /**
     * Issue a credential for the account snapshot. No side effects.
     * Untagged legacy rows get an inferred role tag.
     */
    public String issue(AccountRecord account) {
        String roleTag;
        if (account.getRole() != null) {
            roleTag = account.getRole().tag();
        } else {
            roleTag = RoleInference.inferTag(account);
            log.warn("Issuing credential for untagged {} account {}: inferred role '{}'",
                    account.getKind(), account.getId(), roleTag);
        }

        Instant now = clock.instant();
        Instant expiresAt = now.plus(expiration);

        return Jwts.builder()
                .subject(account.getId())
                .claim(CLAIM_ROLE, roleTag)
                .claim(CLAIM_SCHOOL, account.getSchoolId())
                .claim(CLAIM_EMAIL, account.getEmail())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verify signature and expiry and return the claims unchanged.
     *
     * @throws AuthenticationFailedException INVALID_CREDENTIAL on a bad signature,
     *         EXPIRED_CREDENTIAL when now is past exp, MALFORMED_CREDENTIAL otherwise
     */
    public CredentialClaims verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return toCredentialClaims(claims);
        } catch (ExpiredJwtException e) {
            throw new AuthenticationFailedException(AuthFailureReason.EXPIRED_CREDENTIAL, e);
        } catch (SignatureException e) {
            throw new AuthenticationFailedException(AuthFailureReason.INVALID_CREDENTIAL, e);
        } catch (JwtException | IllegalArgumentException e) {
            // Includes claims of the wrong type (RequiredTypeException)
            throw new AuthenticationFailedException(AuthFailureReason.MALFORMED_CREDENTIAL, e);
        }
    }

    private CredentialClaims toCredentialClaims(Claims claims) {
        String principalId = claims.getSubject();
        if (principalId == null) {
            principalId = claims.get(CLAIM_LEGACY_ID, String.class);
        }
        if (principalId == null || principalId.isBlank() || claims.getExpiration() == null) {
            throw new AuthenticationFailedException(AuthFailureReason.MALFORMED_CREDENTIAL);
        }

        return new CredentialClaims(
                principalId,
                claims.get(CLAIM_ROLE, String.class),
                claims.get(CLAIM_SCHOOL, String.class),
                claims.get(CLAIM_EMAIL, String.class),
                claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                claims.getExpiration().toInstant());
    }

    /**
     * Credential lifetime, reported to clients as expiresIn.
     */
    public Duration getExpiration() {
        return expiration;
    }
}
