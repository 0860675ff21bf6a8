package cloud.tokensmith.sdk.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether the tokens of a {@link TokenSet} may still be presented. A token is usable while
 * {@code now < expiry - skew}; an unknown expiry counts as usable.
 */
public final class ExpiryPolicy {

    private final Duration skew;
    private final Clock clock;

    public ExpiryPolicy(Duration skew, Clock clock) {
        this.skew = Objects.requireNonNull(skew, "skew");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (skew.isNegative()) {
            throw new IllegalArgumentException("skew cannot be negative");
        }
    }

    public boolean isAccessUsable(TokenSet tokens) {
        return isUsable(tokens.getAccessExpiry());
    }

    public boolean isRefreshUsable(TokenSet tokens) {
        return tokens.hasRefreshToken() && isUsable(tokens.getRefreshExpiry());
    }

    public Instant now() {
        return clock.instant();
    }

    public Duration skew() {
        return skew;
    }

    private boolean isUsable(Optional<Instant> expiry) {
        if (expiry.isEmpty()) {
            return true;
        }
        return clock.instant().isBefore(expiry.get().minus(skew));
    }
}
