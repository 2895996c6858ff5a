package blobnet.origin;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the token endpoint response. Some registries name the token
 * {@code access_token}.
 */
record TokenResponse(
        @JsonProperty("token") String token,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") Long expiresIn) {

    String effectiveToken() {
        return token != null ? token : accessToken;
    }
}
