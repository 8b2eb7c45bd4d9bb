package org.example.authapi.dto.response;

import org.example.authapi.error.AuthErrorCode;

public record ErrorResponse(String detail, String code) {

    public static ErrorResponse of(AuthErrorCode code, String detail) {
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : code.getDefaultMessage();
        return new ErrorResponse(safeDetail, code.name());
    }
}
