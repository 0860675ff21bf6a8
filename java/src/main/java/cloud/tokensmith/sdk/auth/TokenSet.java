package cloud.tokensmith.sdk.auth;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable access/refresh token pair together with the instants at which each stops being valid.
 *
 * <p>
 * An expiry is {@code null} when the identity provider did not report a lifespan and the token carried no readable
 * {@code exp} claim. Refreshing never mutates an instance; the gateway produces a new one.
 * </p>
 */
public final class TokenSet {
    private final String accessToken;
    private final Instant accessExpiry;
    private final String refreshToken;
    private final Instant refreshExpiry;
    private final Instant issuedAt;

    public TokenSet(
        String accessToken,
        Instant accessExpiry,
        String refreshToken,
        Instant refreshExpiry,
        Instant issuedAt
    ) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
        this.accessExpiry = accessExpiry;
        this.refreshToken = refreshToken;
        this.refreshExpiry = refreshExpiry;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public String getAccessToken() {
        return accessToken;
    }

    public Optional<Instant> getAccessExpiry() {
        return Optional.ofNullable(accessExpiry);
    }

    /**
     * @return the refresh token, or {@code null} when the provider did not issue one.
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public Optional<Instant> getRefreshExpiry() {
        return Optional.ofNullable(refreshExpiry);
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenSet)) {
            return false;
        }
        TokenSet other = (TokenSet) o;
        return accessToken.equals(other.accessToken)
            && Objects.equals(accessExpiry, other.accessExpiry)
            && Objects.equals(refreshToken, other.refreshToken)
            && Objects.equals(refreshExpiry, other.refreshExpiry)
            && issuedAt.equals(other.issuedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, accessExpiry, refreshToken, refreshExpiry, issuedAt);
    }

    @Override
    public String toString() {
        // token values stay out of logs
        return "TokenSet{accessExpiry=" + accessExpiry
            + ", refreshToken=" + (hasRefreshToken() ? "present" : "absent")
            + ", refreshExpiry=" + refreshExpiry
            + ", issuedAt=" + issuedAt + '}';
    }
}
