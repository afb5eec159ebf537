package com.stressease.backend.auth;

import com.stressease.backend.config.StressEaseProperties;
import com.stressease.backend.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC-signed JWT verification. The subject claim is the user id; the issuer
 * is checked only when one is configured.
 */
@Component
@Slf4j
public class JwtTokenVerifier implements TokenVerifier {

    static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final String issuer;

    public JwtTokenVerifier(StressEaseProperties properties) {
        this(properties.getAuth().getJwtSecret(), properties.getAuth().getIssuer());
    }

    JwtTokenVerifier(String secret, String issuer) {
        byte[] bytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("stressease.auth.jwt-secret must be at least "
                    + MIN_SECRET_BYTES + " bytes (set STRESSEASE_JWT_SECRET)");
        }
        this.key = Keys.hmacShaKeyFor(bytes);
        this.issuer = issuer == null || issuer.isBlank() ? null : issuer;
    }

    @Override
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing bearer token");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new UnauthorizedException("Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid token");
        }

        if (issuer != null && !issuer.equals(claims.getIssuer())) {
            throw new UnauthorizedException("Invalid token issuer");
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new UnauthorizedException("Token has no subject");
        }
        return subject;
    }
}
