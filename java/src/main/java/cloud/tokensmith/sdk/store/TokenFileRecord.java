package cloud.tokensmith.sdk.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import cloud.tokensmith.sdk.auth.TokenSet;

import java.time.Instant;

/**
 * On-disk layout of a shared token file. Instants are written as ISO-8601 strings; unknown expiries are omitted.
 */
record TokenFileRecord(
    @JsonProperty("server_url") String serverUrl,
    @JsonProperty("realm_name") String realmName,
    @JsonProperty("issued_at") Instant issuedAt,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("access_expires_at") Instant accessExpiresAt,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("refresh_expires_at") Instant refreshExpiresAt
) {

    static TokenFileRecord of(String serverUrl, String realmName, TokenSet tokens) {
        return new TokenFileRecord(
            serverUrl,
            realmName,
            tokens.getIssuedAt(),
            tokens.getAccessToken(),
            tokens.getAccessExpiry().orElse(null),
            tokens.getRefreshToken(),
            tokens.getRefreshExpiry().orElse(null)
        );
    }

    TokenSet toTokenSet() {
        return new TokenSet(accessToken, accessExpiresAt, refreshToken, refreshExpiresAt, issuedAt);
    }
}
