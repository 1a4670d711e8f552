package com.provenant.core.keys;

import com.provenant.core.error.AuthorizationMismatchException;
import com.provenant.core.model.AuthorizationDecision;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Locator;
import io.jsonwebtoken.ProtectedHeader;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Verifies approval tokens: compact JWS signed with an authorizer's Ed25519 key.
 * <p>
 * The {@code kid} header names the authorizer and must match the {@code sub} claim.
 * Claims used: {@code action}, {@code decision}, {@code digest}, {@code request_id},
 * {@code key_id}, {@code role}, {@code scope}, {@code parent_key_id}, {@code exp}.
 */
@Component
public class ApprovalVerifier {

    private final AuthorizerRegistry registry;
    private final Clock clock;

    public ApprovalVerifier(AuthorizerRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Verifies {@code token} and returns its contents.
     *
     * @throws AuthorizationMismatchException if the signature, signer, expiry or shape is invalid
     */
    public Approval verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthorizationMismatchException("Empty approval token");
        }
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .keyLocator(keyLocator())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthorizationMismatchException("Approval token rejected: " + e.getMessage(), e);
        }
        Claims claims = jws.getPayload();
        if (!jws.getHeader().getKeyId().equals(claims.getSubject())) {
            throw new AuthorizationMismatchException("Approval token subject does not match its signer");
        }
        if (claims.getExpiration() == null) {
            throw new AuthorizationMismatchException("Approval token carries no expiry");
        }
        String action = claims.get("action", String.class);
        if (action == null) {
            throw new AuthorizationMismatchException("Approval token carries no action");
        }
        return new Approval(
                claims.getSubject(),
                action,
                parseDecision(claims.get("decision", String.class)),
                claims.get("digest", String.class),
                claims.get("request_id", String.class),
                claims.get("key_id", String.class),
                claims.get("role", String.class),
                claims.get("scope", String.class),
                claims.get("parent_key_id", String.class),
                Instant.ofEpochMilli(claims.getExpiration().getTime()));
    }

    private Locator<Key> keyLocator() {
        return (Header header) -> {
            String kid = header instanceof ProtectedHeader protectedHeader ? protectedHeader.getKeyId() : null;
            if (kid == null) {
                throw new AuthorizationMismatchException("Approval token has no kid header");
            }
            return registry.publicKey(kid).orElseThrow(
                    () -> new AuthorizationMismatchException("Unknown authorizer " + kid));
        };
    }

    private static AuthorizationDecision parseDecision(String value) {
        if (value == null) {
            throw new AuthorizationMismatchException("Approval token carries no decision");
        }
        try {
            return AuthorizationDecision.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new AuthorizationMismatchException("Unknown decision " + value, e);
        }
    }
}
