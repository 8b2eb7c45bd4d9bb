package org.example.authapi.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class VerifyTokenResponse {

    private final boolean valid;

    @JsonProperty("user_id")
    private final String userId;

    private final String email;
}
