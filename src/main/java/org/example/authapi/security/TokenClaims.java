package org.example.authapi.security;

import java.time.Instant;

public record TokenClaims(String subject, String email, Instant issuedAt, Instant expiresAt) {
}
