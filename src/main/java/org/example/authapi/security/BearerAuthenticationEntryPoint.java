package org.example.authapi.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.example.authapi.dto.response.ErrorResponse;
import org.example.authapi.error.AuthErrorCode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String BEARER_CHALLENGE = "Bearer";

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        AuthErrorCode code = AuthErrorCode.NOT_AUTHENTICATED;
        Object recorded = request.getAttribute(JwtAuthFilter.AUTH_ERROR_ATTRIBUTE);
        if (recorded instanceof AuthErrorCode tokenError) {
            code = tokenError;
        }

        response.setStatus(code.getStatus().value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(code, null));
    }
}
