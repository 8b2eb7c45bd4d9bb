package org.example.authapi.error;

import lombok.Getter;

@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code) {
        this(code, code.getDefaultMessage(), null);
    }

    public AuthException(AuthErrorCode code, String message) {
        this(code, message, null);
    }

    public AuthException(AuthErrorCode code, Throwable cause) {
        this(code, code.getDefaultMessage(), cause);
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("AuthException code must not be null");
        }
        this.code = code;
    }
}
