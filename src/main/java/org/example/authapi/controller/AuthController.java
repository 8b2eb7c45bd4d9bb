package org.example.authapi.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.authapi.dto.request.LoginRequest;
import org.example.authapi.dto.request.RegisterRequest;
import org.example.authapi.dto.response.TokenResponse;
import org.example.authapi.dto.response.UserProfileResponse;
import org.example.authapi.dto.response.VerifyTokenResponse;
import org.example.authapi.error.AuthErrorCode;
import org.example.authapi.error.AuthException;
import org.example.authapi.security.TokenClaims;
import org.example.authapi.service.AuthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<TokenResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me(@AuthenticationPrincipal TokenClaims claims) {
        return ResponseEntity.ok(authService.getCurrentUser(requireClaims(claims)));
    }

    @PostMapping("/verify")
    public ResponseEntity<VerifyTokenResponse> verify(@AuthenticationPrincipal TokenClaims claims) {
        return ResponseEntity.ok(authService.verifyToken(requireClaims(claims)));
    }

    @GetMapping("/health")
    public ResponseEntity<Void> health() {
        return ResponseEntity.noContent().build();
    }

    private static TokenClaims requireClaims(TokenClaims claims) {
        if (claims == null) {
            throw new AuthException(AuthErrorCode.NOT_AUTHENTICATED);
        }
        return claims;
    }
}
