package com.provenant.core.suspension;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Issues and validates suspension authority tokens. These are HMAC-signed JWTs under a
 * secret that is separate from the publication quorum's keys.
 */
@Service
public class SuspensionAuthorityService {

    public static final String SCOPE_APPLY = "suspension:apply";
    public static final String SCOPE_LIFT = "suspension:lift";

    private final SecretKey signingKey;
    private final int ttlSeconds;
    private final String issuer;
    private final Clock clock;

    public SuspensionAuthorityService(SuspensionProperties properties, Clock clock) {
        String secret = properties.getAuthoritySecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG,
                    "provenant.suspension.authority-secret must be at least 32 bytes");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = properties.getTokenTtlSeconds();
        this.issuer = properties.getIssuer();
        this.clock = clock;
    }

    public String generateToken(String authority, String scope) {
        Date now = Date.from(clock.instant());
        Date expiration = new Date(now.getTime() + ttlSeconds * 1000L);

        return Jwts.builder()
                .issuer(issuer)
                .subject(authority)
                .claim("scope", scope)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    /**
     * Validates {@code token} and checks it carries {@code requiredScope}.
     *
     * @return the authority (token subject)
     * @throws ProvenantException with {@link ErrorCode#UNAUTHORIZED} if invalid, expired or out of scope
     */
    public String validate(String token, String requiredScope) {
        if (token == null || token.isBlank()) {
            throw new ProvenantException(ErrorCode.UNAUTHORIZED, "Missing suspension authority token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new ProvenantException(ErrorCode.UNAUTHORIZED, "Invalid suspension authority token: " + e.getMessage(), e);
        }
        if (!requiredScope.equals(claims.get("scope", String.class))) {
            throw new ProvenantException(ErrorCode.UNAUTHORIZED, "Token is not scoped for " + requiredScope);
        }
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new ProvenantException(ErrorCode.UNAUTHORIZED, "Token names no authority");
        }
        return claims.getSubject();
    }
}
