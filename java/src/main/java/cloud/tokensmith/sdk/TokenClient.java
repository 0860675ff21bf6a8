package cloud.tokensmith.sdk;

import cloud.tokensmith.sdk.auth.Credentials;
import cloud.tokensmith.sdk.auth.ExpiryPolicy;
import cloud.tokensmith.sdk.auth.IdentityProviderGateway;
import cloud.tokensmith.sdk.auth.KeycloakGateway;
import cloud.tokensmith.sdk.auth.TokenSet;
import cloud.tokensmith.sdk.auth.UserInfo;
import cloud.tokensmith.sdk.engine.TokenLifecycleEngine;
import cloud.tokensmith.sdk.engine.TokenState;
import cloud.tokensmith.sdk.store.InMemoryTokenStore;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * Synchronous token client keeping its tokens in memory. Every accessor makes sure the access token is usable before
 * returning anything, refreshing it through the identity provider when it is about to expire, so callers never have
 * to track expiry themselves.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TokenClient client = new TokenClient(Config.builder()
 *     .serverUrl("https://sso.example.com")
 *     .realmName("analytics")
 *     .clientId("notebook")
 *     .refreshToken(seed)
 *     .build());
 * client.initializeTokens();
 * String bearer = client.getAccessToken();
 * }</pre>
 *
 * <p>
 * The client owns its token store and is not synchronised. Hosts calling it from several threads must serialise
 * access themselves, or use {@link SharedTokenClient}.
 * </p>
 */
public final class TokenClient implements AutoCloseable {

    private final Config config;
    private final TokenLifecycleEngine engine;

    /**
     * Constructs a client talking to the Keycloak realm described by {@code config}.
     *
     * @param config caller-supplied configuration; a copy with defaults applied is captured.
     */
    public TokenClient(Config config) {
        this(config, null);
    }

    /**
     * Constructs a client using a custom gateway, for providers that do not follow the Keycloak endpoint layout.
     */
    public TokenClient(Config config, IdentityProviderGateway gateway) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.engine = new TokenLifecycleEngine(
            gateway != null ? gateway : keycloakGateway(this.config),
            new InMemoryTokenStore(),
            new ExpiryPolicy(this.config.getTokenSkew(), this.config.getClock()),
            this.config.getAccessToken(),
            this.config.getRefreshToken(),
            this.config.defaultCredentials()
        );
    }

    /**
     * Obtains the first token set from the configured seed tokens or credentials.
     *
     * @throws TokensNotInitializedException when the configuration carries neither.
     * @throws GatewayException              when the identity provider rejects the request.
     */
    public TokenSet initializeTokens() throws TokensmithException {
        return engine.initialize(null);
    }

    /**
     * Obtains the first token set, authenticating as {@code username} if the configuration carries no seed tokens.
     */
    public TokenSet initializeTokens(String username, String password) throws TokensmithException {
        return engine.initialize(Credentials.password(username, password));
    }

    public String getAccessToken() throws TokensmithException {
        return engine.accessToken();
    }

    public String getRefreshToken() throws TokensmithException {
        return engine.refreshToken();
    }

    /**
     * Refreshes the tokens now, whether or not the access token is close to expiry.
     *
     * @throws RefreshTokenExpiredException when the refresh token can no longer be used.
     */
    public TokenSet refreshTokens() throws TokensmithException {
        return engine.refresh();
    }

    /**
     * Replaces the current tokens with ones issued for {@code username}.
     */
    public TokenSet passwordCredentials(String username, String password) throws TokensmithException {
        return engine.authenticate(Credentials.password(username, password));
    }

    public UserInfo getUserInfo() throws TokensmithException {
        return engine.userInfo();
    }

    /**
     * Returns a new token for {@code audience} (another client of the same realm). The client's own tokens are not
     * touched.
     */
    public TokenSet tokenExchange(String audience) throws TokensmithException {
        return engine.exchange(audience);
    }

    /**
     * @return when the current tokens were issued, empty before initialisation.
     */
    public Optional<Instant> getTokenTimestamp() throws TokensmithException {
        return engine.current().map(TokenSet::getIssuedAt);
    }

    /**
     * @return when the access token expires, empty when unknown.
     */
    public Optional<Instant> getAccessTokenExpiry() throws TokensmithException {
        return engine.current().flatMap(TokenSet::getAccessExpiry);
    }

    /**
     * @return when the refresh token expires, empty when unknown.
     */
    public Optional<Instant> getRefreshTokenExpiry() throws TokensmithException {
        return engine.current().flatMap(TokenSet::getRefreshExpiry);
    }

    public TokenState getState() {
        return engine.state();
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link java.net.http.HttpClient} does not require
     * explicit shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    static IdentityProviderGateway keycloakGateway(Config config) {
        return new KeycloakGateway(
            config.getHttpClient(),
            config.getServerUrl(),
            config.getRealmName(),
            config.getClientId(),
            config.getClientSecret(),
            config.getHttpTimeout(),
            config.getClock()
        );
    }
}
