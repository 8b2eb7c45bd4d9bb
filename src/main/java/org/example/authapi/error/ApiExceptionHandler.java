package org.example.authapi.error;

import lombok.extern.slf4j.Slf4j;
import org.example.authapi.dto.response.ErrorResponse;
import org.example.authapi.security.BearerAuthenticationEntryPoint;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final int RETRY_AFTER_SECONDS = 5;

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuthException(AuthException ex) {
        AuthErrorCode code = ex.getCode();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(code.getStatus());
        if (code.isUnauthorized()) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BearerAuthenticationEntryPoint.BEARER_CHALLENGE);
        }
        if (code.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(RETRY_AFTER_SECONDS));
        }
        // Credential and token failures always carry the fixed message for their code.
        String detail = code == AuthErrorCode.VALIDATION_ERROR ? ex.getMessage() : code.getDefaultMessage();
        return builder.body(ErrorResponse.of(code, detail));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : null;
        return ResponseEntity.status(AuthErrorCode.VALIDATION_ERROR.getStatus())
                .body(ErrorResponse.of(AuthErrorCode.VALIDATION_ERROR, detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(AuthErrorCode.VALIDATION_ERROR.getStatus())
                .body(ErrorResponse.of(AuthErrorCode.VALIDATION_ERROR, "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        // Spring MVC's own request errors (405, 415, ...) keep their status.
        if (ex instanceof org.springframework.web.ErrorResponse mvcError) {
            HttpStatusCode statusCode = mvcError.getStatusCode();
            HttpStatus status = HttpStatus.resolve(statusCode.value());
            String code = status != null ? status.name() : "HTTP_" + statusCode.value();
            String detail = mvcError.getBody().getDetail() != null
                    ? mvcError.getBody().getDetail()
                    : (status != null ? status.getReasonPhrase() : code);
            log.debug("Rejected request: {}", ex.getMessage());
            return ResponseEntity.status(statusCode)
                    .headers(mvcError.getHeaders())
                    .body(new ErrorResponse(detail, code));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error", "INTERNAL_ERROR"));
    }
}
