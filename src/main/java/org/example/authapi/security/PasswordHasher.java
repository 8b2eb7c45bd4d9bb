package org.example.authapi.security;

import lombok.extern.slf4j.Slf4j;
import org.example.authapi.error.AuthErrorCode;
import org.example.authapi.error.AuthException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * BCrypt digests. Verification fails closed on malformed digests and oversized input.
 */
@Slf4j
@Component
public class PasswordHasher {

    /** BCrypt only consumes the first 72 bytes of its input. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;
    private final String decoyDigest;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.decoyDigest = passwordEncoder.encode("decoy-password-for-unknown-accounts");
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Password must not be blank");
        }
        if (exceedsLimit(plaintext)) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR,
                    "Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isEmpty() || exceedsLimit(plaintext)) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException e) {
            log.warn("Stored password digest could not be checked: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Spends one comparison against a fixed digest so that a lookup miss costs about as
     * much as a wrong password. Always returns {@code false}.
     */
    public boolean verifyAgainstDecoy(String plaintext) {
        verify(plaintext == null ? "" : plaintext, decoyDigest);
        return false;
    }

    private static boolean exceedsLimit(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
