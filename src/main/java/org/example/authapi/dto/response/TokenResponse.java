package org.example.authapi.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    @JsonProperty("access_token")
    private final String accessToken;

    @JsonProperty("token_type")
    private final String tokenType;

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }
}
