package org.example.authapi.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum AuthErrorCode {

    EMAIL_ALREADY_REGISTERED(HttpStatus.BAD_REQUEST, "Email already registered"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Incorrect email or password"),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    EXPIRED_TOKEN(HttpStatus.UNAUTHORIZED, "Token has expired"),
    MALFORMED_TOKEN(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED, "Not authenticated"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid request"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable, retry later");

    private final HttpStatus status;
    private final String defaultMessage;

    public boolean isUnauthorized() {
        return status == HttpStatus.UNAUTHORIZED;
    }

    public boolean isRetryable() {
        return this == STORE_UNAVAILABLE;
    }
}
