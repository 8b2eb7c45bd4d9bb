package org.example.authapi.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.example.authapi.error.AuthErrorCode;
import org.example.authapi.error.AuthException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

@Service
public class JwtService {

    public static final String EMAIL_CLAIM = "email";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;

    public JwtService(@Value("${app.jwt.secret}") String secret,
                      @Value("${app.jwt.expire-minutes:30}") long expireMinutes,
                      Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.jwt.secret must be configured");
        }
        if (expireMinutes <= 0) {
            throw new IllegalStateException("app.jwt.expire-minutes must be positive");
        }
        // Rejects secrets shorter than 256 bits with a WeakKeyException.
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = Duration.ofMinutes(expireMinutes);
        this.clock = clock;
    }

    public String issue(String subject, String email) {
        return issue(subject, email, ttl);
    }

    public String issue(String subject, String email, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token ttl must be positive");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(subject)
                .claim(EMAIL_CLAIM, email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.EXPIRED_TOKEN, e);
        } catch (SignatureException e) {
            // Expiry is reported even when the signature does not match.
            if (isPastExpiry(token)) {
                throw new AuthException(AuthErrorCode.EXPIRED_TOKEN, e);
            }
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN);
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : null;
        return new TokenClaims(subject, claims.get(EMAIL_CLAIM, String.class), issuedAt, expiresAt);
    }

    private boolean isPastExpiry(String token) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            return false;
        }
        try {
            JsonNode payload = OBJECT_MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            JsonNode exp = payload == null ? null : payload.get("exp");
            return payload != null && exp != null && exp.canConvertToLong()
                    && Instant.ofEpochSecond(exp.asLong()).isBefore(clock.instant());
        } catch (IOException | IllegalArgumentException e) {
            return false;
        }
    }
}
