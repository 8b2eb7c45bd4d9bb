package org.example.authapi.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuthServiceImplTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-bytes-long!!";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    UserRepository userRepository;

    private final Map<String, User> usersByEmail = new HashMap<>();
    private final Map<String, User> usersById = new HashMap<>();

    private JwtService jwtService;
    private AuthServiceImpl authService;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(SECRET, 30, Clock.fixed(NOW, ZoneOffset.UTC));
        authService = new AuthServiceImpl(userRepository, new PasswordHasher(new BCryptPasswordEncoder(4)), jwtService);

        when(userRepository.existsByEmail(anyString())).thenAnswer(inv -> usersByEmail.containsKey(inv.<String>getArgument(0)));
        when(userRepository.findByEmail(anyString())).thenAnswer(inv -> Optional.ofNullable(usersByEmail.get(inv.<String>getArgument(0))));
        when(userRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(usersById.get(inv.<String>getArgument(0))));
        when(userRepository.insert(any(User.class))).thenAnswer(inv -> {
            User user = inv.getArgument(0);
            user.setId("65f1" + (usersById.size() + 1));
            user.setCreatedAt(NOW);
            user.setUpdatedAt(NOW);
            usersByEmail.put(user.getEmail(), user);
            usersById.put(user.getId(), user);
            return user;
        });
    }

    @Test
    void registerThenLoginIssuesTokenForTheSameUser() {
        TokenResponse registered = authService.register(new RegisterRequest("a@x.com", "secret1", null));
        User stored = usersByEmail.get("a@x.com");

        assertThat(registered.getTokenType()).isEqualTo("bearer");
        assertThat(jwtService.verify(registered.getAccessToken()).subject()).isEqualTo(stored.getId());

        TokenResponse loggedIn = authService.login(new LoginRequest("a@x.com", "secret1"));
        TokenClaims claims = jwtService.verify(loggedIn.getAccessToken());
        assertThat(claims.subject()).isEqualTo(stored.getId());
        assertThat(claims.email()).isEqualTo("a@x.com");
    }

    @Test
    void registerStoresDigestAndEmailProvider() {
        authService.register(new RegisterRequest("  Mixed@X.com ", "secret1", "  Ada  "));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).insert(captor.capture());
        User saved = captor.getValue();
        assertThat(saved.getEmail()).isEqualTo("mixed@x.com");
        assertThat(saved.getName()).isEqualTo("Ada");
        assertThat(saved.getProvider()).isEqualTo(User.PROVIDER_EMAIL);
        assertThat(saved.getPassword()).isNotEqualTo("secret1").startsWith("$2a$");
    }

    @Test
    void registeringTheSameEmailTwiceFails() {
        authService.register(new RegisterRequest("a@x.com", "secret1", null));

        AuthException ex = assertThrows(AuthException.class,
                () -> authService.register(new RegisterRequest("A@X.com", "another1", null)));
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.EMAIL_ALREADY_REGISTERED);
    }

    @Test
    void uniqueIndexViolationMapsToEmailAlreadyRegistered() {
        // Both requests passed the existence check; the second insert hits the index.
        doReturn(false).when(userRepository).existsByEmail("a@x.com");
        doThrow(new DuplicateKeyException("E11000 duplicate key error")).when(userRepository).insert(any(User.class));

        AuthException ex = assertThrows(AuthException.class,
                () -> authService.register(new RegisterRequest("a@x.com", "secret1", null)));
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.EMAIL_ALREADY_REGISTERED);
    }

    @Test
    void wrongPasswordAndUnknownEmailFailIdentically() {
        authService.register(new RegisterRequest("a@x.com", "secret1", null));

        AuthException wrongPassword = assertThrows(AuthException.class,
                () -> authService.login(new LoginRequest("a@x.com", "wrong")));
        AuthException unknownEmail = assertThrows(AuthException.class,
                () -> authService.login(new LoginRequest("nobody@x.com", "secret1")));

        assertThat(wrongPassword.getCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(unknownEmail.getCode()).isEqualTo(wrongPassword.getCode());
        assertThat(unknownEmail.getMessage()).isEqualTo(wrongPassword.getMessage());
    }

    @Test
    void loginWithCorruptStoredDigestFailsClosed() {
        User legacy = new User("legacy@x.com", "not-a-bcrypt-digest", null);
        legacy.setId("legacy-1");
        usersByEmail.put(legacy.getEmail(), legacy);

        AuthException ex = assertThrows(AuthException.class,
                () -> authService.login(new LoginRequest("legacy@x.com", "secret1")));
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    void identifyReturnsPublicProjection() {
        TokenResponse token = authService.register(new RegisterRequest("a@x.com", "secret1", null));

        UserProfileResponse profile = authService.identify(token.getAccessToken());

        assertThat(profile.getId()).isEqualTo(usersByEmail.get("a@x.com").getId());
        assertThat(profile.getEmail()).isEqualTo("a@x.com");
        assertThat(profile.getName()).isNull();
        assertThat(profile.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void identifyPropagatesTokenFailures() {
        AuthException ex = assertThrows(AuthException.class, () -> authService.identify("garbage"));

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.MALFORMED_TOKEN);
        verify(userRepository, never()).findById(anyString());
    }

    @Test
    void identifyFailsWhenUserVanished() {
        String token = jwtService.issue("deleted-id", "gone@x.com");

        AuthException ex = assertThrows(AuthException.class, () -> authService.identify(token));
        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.USER_NOT_FOUND);
    }

    @Test
    void verifyTokenEchoesClaims() {
        TokenResponse token = authService.register(new RegisterRequest("a@x.com", "secret1", null));
        TokenClaims claims = jwtService.verify(token.getAccessToken());

        VerifyTokenResponse response = authService.verifyToken(claims);

        assertThat(response.isValid()).isTrue();
        assertThat(response.getUserId()).isEqualTo(claims.subject());
        assertThat(response.getEmail()).isEqualTo("a@x.com");
    }

    @Test
    void storeOutageSurfacesAsStoreUnavailable() {
        doThrow(new QueryTimeoutException("socket timeout")).when(userRepository).findByEmail(anyString());
        doThrow(new DataAccessResourceFailureException("no server")).when(userRepository).existsByEmail(anyString());

        AuthException login = assertThrows(AuthException.class,
                () -> authService.login(new LoginRequest("a@x.com", "secret1")));
        AuthException register = assertThrows(AuthException.class,
                () -> authService.register(new RegisterRequest("a@x.com", "secret1", null)));

        assertThat(login.getCode()).isEqualTo(AuthErrorCode.STORE_UNAVAILABLE);
        assertThat(register.getCode()).isEqualTo(AuthErrorCode.STORE_UNAVAILABLE);
        assertThat(login.getCode().isRetryable()).isTrue();
    }
}
