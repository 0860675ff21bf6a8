package cloud.tokensmith.sdk;

import cloud.tokensmith.sdk.auth.Credentials;
import cloud.tokensmith.sdk.auth.ExpiryPolicy;
import cloud.tokensmith.sdk.auth.IdentityProviderGateway;
import cloud.tokensmith.sdk.auth.TokenSet;
import cloud.tokensmith.sdk.auth.UserInfo;
import cloud.tokensmith.sdk.engine.TokenLifecycleEngine;
import cloud.tokensmith.sdk.engine.TokenState;
import cloud.tokensmith.sdk.store.LockedFileTokenStore;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * <p>
 * Token client whose tokens live in a file shared with other processes (and other clients of this process). At most
 * one of them refreshes at a time; the others wait on the file lock and then reuse the tokens it wrote.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every operation returns a {@link CompletableFuture} that runs on the configured {@link Executor}, since it may
 *       wait for the file lock and for the identity provider call issued while holding it.</li>
 *   <li>Futures complete exceptionally with the SDK's typed exceptions: {@link GatewayException},
 *       {@link RefreshTokenExpiredException}, {@link LockTimeoutException}, {@link StoreCorruptException} and
 *       {@link TokensNotInitializedException}.</li>
 *   <li>Reads of a still-valid access token take no lock at all.</li>
 *   <li>When no executor is configured the client owns a small daemon pool, shut down by {@link #close()}.</li>
 * </ul>
 */
public final class SharedTokenClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SharedTokenClient.class.getName());

    private final Config config;
    private final LockedFileTokenStore store;
    private final TokenLifecycleEngine engine;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    public SharedTokenClient(Config config) throws TokensmithException {
        this(config, null);
    }

    /**
     * Constructs a client using a custom gateway, for providers that do not follow the Keycloak endpoint layout.
     *
     * @throws TokensmithException when the token file directory cannot be created.
     */
    public SharedTokenClient(Config config, IdentityProviderGateway gateway) throws TokensmithException {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.store = new LockedFileTokenStore(
            this.config.getTokenFile(),
            this.config.getServerUrl(),
            this.config.getRealmName(),
            this.config.getLockTimeout(),
            this.config.getLockRetryCount(),
            this.config.getLockRetryDelay(),
            this.config.getLockStaleAfter(),
            this.config.getClock()
        );
        this.engine = new TokenLifecycleEngine(
            gateway != null ? gateway : TokenClient.keycloakGateway(this.config),
            store,
            new ExpiryPolicy(this.config.getTokenSkew(), this.config.getClock()),
            this.config.getAccessToken(),
            this.config.getRefreshToken(),
            this.config.defaultCredentials()
        );
        if (this.config.getExecutor() != null) {
            this.executor = this.config.getExecutor();
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory());
            this.executor = ownedExecutor;
        }
        LOGGER.fine(() -> "[tokensmith] sharing tokens through " + store.tokenFile());
    }

    /**
     * Loads the shared tokens, refreshing them if needed, or obtains the first set from the configured seed tokens or
     * credentials when the file does not exist yet.
     */
    public CompletableFuture<TokenSet> initializeTokens() {
        return submit(() -> engine.initialize(null));
    }

    public CompletableFuture<TokenSet> initializeTokens(String username, String password) {
        Credentials credentials = Credentials.password(username, password);
        return submit(() -> engine.initialize(credentials));
    }

    public CompletableFuture<String> getAccessToken() {
        return submit(engine::accessToken);
    }

    public CompletableFuture<String> getRefreshToken() {
        return submit(engine::refreshToken);
    }

    public CompletableFuture<TokenSet> refreshTokens() {
        return submit(engine::refresh);
    }

    public CompletableFuture<TokenSet> passwordCredentials(String username, String password) {
        Credentials credentials = Credentials.password(username, password);
        return submit(() -> engine.authenticate(credentials));
    }

    public CompletableFuture<UserInfo> getUserInfo() {
        return submit(engine::userInfo);
    }

    public CompletableFuture<TokenSet> tokenExchange(String audience) {
        return submit(() -> engine.exchange(audience));
    }

    public CompletableFuture<Optional<Instant>> getTokenTimestamp() {
        return submit(() -> engine.current().map(TokenSet::getIssuedAt));
    }

    public CompletableFuture<Optional<Instant>> getAccessTokenExpiry() {
        return submit(() -> engine.current().flatMap(TokenSet::getAccessExpiry));
    }

    public CompletableFuture<Optional<Instant>> getRefreshTokenExpiry() {
        return submit(() -> engine.current().flatMap(TokenSet::getRefreshExpiry));
    }

    /**
     * State of the shared tokens as last observed by this client.
     */
    public TokenState getState() {
        return engine.state();
    }

    public Path getTokenFile() {
        return store.tokenFile();
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Shuts down the owned executor. Operations already running complete; later ones fail.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private <T> CompletableFuture<T> submit(Operation<T> operation) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(operation.run());
                } catch (Throwable ex) {
                    future.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            future.completeExceptionally(new TokensmithException("shared token client is closed", ex));
        }
        return future;
    }

    @FunctionalInterface
    private interface Operation<T> {
        T run() throws TokensmithException;
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tokensmith-shared-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
