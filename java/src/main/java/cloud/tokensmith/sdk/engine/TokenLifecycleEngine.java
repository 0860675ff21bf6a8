package cloud.tokensmith.sdk.engine;

import cloud.tokensmith.sdk.GatewayException;
import cloud.tokensmith.sdk.RefreshTokenExpiredException;
import cloud.tokensmith.sdk.TokensNotInitializedException;
import cloud.tokensmith.sdk.TokensmithException;
import cloud.tokensmith.sdk.auth.Credentials;
import cloud.tokensmith.sdk.auth.DecodedClaims;
import cloud.tokensmith.sdk.auth.ExpiryPolicy;
import cloud.tokensmith.sdk.auth.IdentityProviderGateway;
import cloud.tokensmith.sdk.auth.TokenSet;
import cloud.tokensmith.sdk.auth.UserInfo;
import cloud.tokensmith.sdk.store.TokenStore;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Drives the primary token set through {@link TokenState}: decides, for every accessor, whether the stored tokens can
 * be handed out as they are, whether a refresh or an authentication has to be issued through the
 * {@link IdentityProviderGateway}, and writes the outcome back through the {@link TokenStore}.
 * </p>
 *
 * <p>
 * Reads that find a usable access token take no lock. Everything else runs inside {@link TokenStore#update}, where
 * the set is re-read before deciding: a caller that waited for the lock while another one refreshed picks up the new
 * tokens instead of refreshing a second time. Gateway failures are reported as they are and never retried here.
 * </p>
 *
 * <p>
 * {@link #exchange(String)} and {@link #userInfo()} are side operations; they never write the store nor move the
 * state machine beyond the implicit refresh needed to obtain a usable access token.
 * </p>
 */
public final class TokenLifecycleEngine {

    private static final Logger LOGGER = Logger.getLogger(TokenLifecycleEngine.class.getName());

    private final IdentityProviderGateway gateway;
    private final TokenStore store;
    private final ExpiryPolicy policy;
    private final String seedAccessToken;
    private final String seedRefreshToken;
    private final Credentials defaultCredentials;

    private volatile TokenState state = TokenState.UNINITIALIZED;

    /**
     * @param seedAccessToken    access token supplied by configuration, used when the store is empty.
     * @param seedRefreshToken   refresh token supplied by configuration; exchanged right away so expiries become known.
     * @param defaultCredentials credentials used by {@link #initialize(Credentials)} when none are passed; nullable.
     */
    public TokenLifecycleEngine(
        IdentityProviderGateway gateway,
        TokenStore store,
        ExpiryPolicy policy,
        String seedAccessToken,
        String seedRefreshToken,
        Credentials defaultCredentials
    ) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.seedAccessToken = blankToNull(seedAccessToken);
        this.seedRefreshToken = blankToNull(seedRefreshToken);
        this.defaultCredentials = defaultCredentials;
    }

    public TokenState state() {
        return state;
    }

    /**
     * Brings the store to a usable token set: reuses a stored set, refreshes it, redeems the configured seed tokens or
     * authenticates with the given (or configured) credentials, in that order of preference.
     *
     * @param credentials credentials to authenticate with when nothing else works; {@code null} for the configured ones.
     * @throws TokensNotInitializedException when nothing is stored and neither seeds nor credentials are available.
     */
    public TokenSet initialize(Credentials credentials) throws TokensmithException {
        Credentials effective = credentials != null ? credentials : defaultCredentials;
        return store.update(tx -> {
            Optional<TokenSet> current = tx.current();
            if (current.isPresent()) {
                TokenSet stored = current.get();
                if (policy.isAccessUsable(stored)) {
                    if (stored.getAccessExpiry().isEmpty()) {
                        LOGGER.warning(() -> "[tokensmith] access token expiry is unknown; assuming it is still valid");
                    }
                    state = TokenState.VALID;
                    return stored;
                }
                if (policy.isRefreshUsable(stored) || effective == null) {
                    return refreshStored(tx, stored);
                }
                return authenticateWithin(tx, effective);
            }

            if (seedRefreshToken != null) {
                LOGGER.info(() -> "[tokensmith] redeeming configured refresh token");
                return refreshWithin(tx, seedRefreshToken, null);
            }
            if (seedAccessToken != null) {
                TokenSet seeded = new TokenSet(
                    seedAccessToken,
                    DecodedClaims.decode(seedAccessToken).expiresAt().orElse(null),
                    null,
                    null,
                    policy.now()
                );
                tx.write(seeded);
                state = TokenState.VALID;
                return seeded;
            }
            if (effective != null) {
                return authenticateWithin(tx, effective);
            }
            throw new TokensNotInitializedException(
                "seed tokens or credentials must be provided when no token set is stored");
        });
    }

    /**
     * Returns a usable access token, refreshing first when the stored one is about to expire.
     */
    public String accessToken() throws TokensmithException {
        return usableTokens().getAccessToken();
    }

    /**
     * Returns the refresh token of a usable token set.
     *
     * @throws RefreshTokenExpiredException when the set carries no refresh token or it has expired.
     */
    public String refreshToken() throws TokensmithException {
        TokenSet tokens = usableTokens();
        if (!policy.isRefreshUsable(tokens)) {
            throw expired(tokens);
        }
        return tokens.getRefreshToken();
    }

    /**
     * Refreshes unconditionally with the currently stored refresh token.
     */
    public TokenSet refresh() throws TokensmithException {
        return store.update(tx -> refreshStored(tx, requireStored(tx.current())));
    }

    /**
     * Authenticates from scratch, replacing whatever is stored. The recovery path out of {@link TokenState#EXPIRED}.
     */
    public TokenSet authenticate(Credentials credentials) throws TokensmithException {
        Objects.requireNonNull(credentials, "credentials");
        return store.update(tx -> authenticateWithin(tx, credentials));
    }

    /**
     * Obtains a token for {@code targetAudience} based on the current access token. The primary set is left as is.
     */
    public TokenSet exchange(String targetAudience) throws TokensmithException {
        if (targetAudience == null || targetAudience.isBlank()) {
            throw new IllegalArgumentException("targetAudience is required");
        }
        String accessToken = accessToken();
        TokenSet exchanged = gateway.exchange(accessToken, targetAudience);
        LOGGER.fine(() -> "[tokensmith] exchanged token for audience " + targetAudience);
        return exchanged;
    }

    public UserInfo userInfo() throws TokensmithException {
        return gateway.userInfo(accessToken());
    }

    /**
     * Lock-free snapshot of the stored set.
     */
    public Optional<TokenSet> current() throws TokensmithException {
        return store.read();
    }

    private TokenSet usableTokens() throws TokensmithException {
        Optional<TokenSet> snapshot = store.read();
        if (snapshot.isPresent() && policy.isAccessUsable(snapshot.get())) {
            if (state != TokenState.VALID) {
                state = TokenState.VALID;
            }
            return snapshot.get();
        }

        return store.update(tx -> {
            TokenSet current = requireStored(tx.current());
            if (policy.isAccessUsable(current)) {
                LOGGER.fine(() -> "[tokensmith] tokens were refreshed by another holder of the store");
                state = TokenState.VALID;
                return current;
            }
            return refreshStored(tx, current);
        });
    }

    private TokenSet refreshStored(TokenStore.Transaction tx, TokenSet current) throws TokensmithException {
        if (!policy.isRefreshUsable(current)) {
            state = TokenState.EXPIRED;
            throw expired(current);
        }
        return refreshWithin(tx, current.getRefreshToken(), current);
    }

    private TokenSet refreshWithin(TokenStore.Transaction tx, String refreshToken, TokenSet previous)
        throws TokensmithException {

        state = TokenState.REFRESH_PENDING;
        try {
            TokenSet fresh = carryRefreshToken(gateway.refresh(refreshToken), refreshToken, previous);
            tx.write(fresh);
            state = TokenState.VALID;
            LOGGER.info(() -> "[tokensmith] refreshed tokens; access token valid until "
                + fresh.getAccessExpiry().map(Object::toString).orElse("unknown"));
            return fresh;
        } catch (GatewayException ex) {
            state = TokenState.FAILED;
            LOGGER.log(Level.WARNING, "[tokensmith] token refresh failed: " + ex.getMessage());
            throw ex;
        } catch (TokensmithException | RuntimeException ex) {
            state = TokenState.FAILED;
            throw ex;
        }
    }

    private TokenSet authenticateWithin(TokenStore.Transaction tx, Credentials credentials) throws TokensmithException {
        try {
            TokenSet fresh = gateway.authenticate(credentials);
            tx.write(fresh);
            state = TokenState.VALID;
            LOGGER.info(() -> "[tokensmith] authenticated with " + credentials.getGrantType().value() + " grant");
            return fresh;
        } catch (TokensmithException | RuntimeException ex) {
            state = TokenState.FAILED;
            throw ex;
        }
    }

    // providers may omit refresh_token on refresh, in which case the old one stays valid
    private static TokenSet carryRefreshToken(TokenSet fresh, String usedRefreshToken, TokenSet previous) {
        if (fresh.hasRefreshToken()) {
            return fresh;
        }
        return new TokenSet(
            fresh.getAccessToken(),
            fresh.getAccessExpiry().orElse(null),
            usedRefreshToken,
            previous == null ? null : previous.getRefreshExpiry().orElse(null),
            fresh.getIssuedAt()
        );
    }

    private static TokenSet requireStored(Optional<TokenSet> current) throws TokensNotInitializedException {
        return current.orElseThrow(() -> new TokensNotInitializedException(
            "no token set is stored; call initializeTokens() first"));
    }

    private static RefreshTokenExpiredException expired(TokenSet tokens) {
        if (!tokens.hasRefreshToken()) {
            return new RefreshTokenExpiredException("no refresh token available; authenticate again");
        }
        return new RefreshTokenExpiredException("refresh token expired at "
            + tokens.getRefreshExpiry().map(Object::toString).orElse("unknown") + "; authenticate again");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
