package org.example.authapi.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.authapi.dto.request.LoginRequest;
import org.example.authapi.dto.request.RegisterRequest;
import org.example.authapi.dto.response.TokenResponse;
import org.example.authapi.dto.response.UserProfileResponse;
import org.example.authapi.dto.response.VerifyTokenResponse;
import org.example.authapi.error.AuthErrorCode;
import org.example.authapi.error.AuthException;
import org.example.authapi.model.User;
import org.example.authapi.repository.UserRepository;
import org.example.authapi.security.JwtService;
import org.example.authapi.security.PasswordHasher;
import org.example.authapi.security.TokenClaims;
import org.example.authapi.service.AuthService;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;

    @Override
    public TokenResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());

        if (store(() -> userRepository.existsByEmail(email))) {
            throw new AuthException(AuthErrorCode.EMAIL_ALREADY_REGISTERED);
        }

        String digest = passwordHasher.hash(request.getPassword());
        User user = new User(email, digest, normalizeName(request.getName()));

        User created;
        try {
            created = store(() -> userRepository.insert(user));
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration; the unique index decides.
            throw new AuthException(AuthErrorCode.EMAIL_ALREADY_REGISTERED, e);
        }

        log.info("Registered user {} ({})", created.getId(), created.getEmail());
        return TokenResponse.bearer(jwtService.issue(created.getId(), created.getEmail()));
    }

    @Override
    public TokenResponse login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        User user = store(() -> userRepository.findByEmail(email)).orElse(null);
        if (user == null) {
            passwordHasher.verifyAgainstDecoy(request.getPassword());
            log.warn("Rejected login for unknown email {}", email);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        if (!passwordHasher.verify(request.getPassword(), user.getPassword())) {
            log.warn("Rejected login for user {}: password mismatch", user.getId());
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        log.info("User {} logged in", user.getId());
        return TokenResponse.bearer(jwtService.issue(user.getId(), user.getEmail()));
    }

    @Override
    public UserProfileResponse identify(String token) {
        return getCurrentUser(jwtService.verify(token));
    }

    @Override
    public UserProfileResponse getCurrentUser(TokenClaims claims) {
        User user = findBySubject(claims);
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getCreatedAt()
        );
    }

    @Override
    public VerifyTokenResponse verifyToken(TokenClaims claims) {
        findBySubject(claims);
        return new VerifyTokenResponse(true, claims.subject(), claims.email());
    }

    private User findBySubject(TokenClaims claims) {
        return store(() -> userRepository.findById(claims.subject()))
                .orElseThrow(() -> new AuthException(AuthErrorCode.USER_NOT_FOUND));
    }

    private <T> T store(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.error("User store unavailable: {}", e.getMessage());
            throw new AuthException(AuthErrorCode.STORE_UNAVAILABLE, e);
        }
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new AuthException(AuthErrorCode.VALIDATION_ERROR, "Email must not be blank");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.trim();
    }
}
