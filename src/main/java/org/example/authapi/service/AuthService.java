package org.example.authapi.service;

import org.example.authapi.dto.request.LoginRequest;
import org.example.authapi.dto.request.RegisterRequest;
import org.example.authapi.dto.response.TokenResponse;
import org.example.authapi.dto.response.UserProfileResponse;
import org.example.authapi.dto.response.VerifyTokenResponse;
import org.example.authapi.security.TokenClaims;

public interface AuthService {
    TokenResponse register(RegisterRequest request);
    TokenResponse login(LoginRequest request);
    UserProfileResponse identify(String token);
    UserProfileResponse getCurrentUser(TokenClaims claims);
    VerifyTokenResponse verifyToken(TokenClaims claims);
}
