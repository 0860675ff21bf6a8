package cloud.tokensmith.sdk;

import cloud.tokensmith.sdk.auth.Credentials;
import cloud.tokensmith.sdk.internal.TlsSupport;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Immutable configuration container used to bootstrap {@link TokenClient} and {@link SharedTokenClient} instances.
 * Only {@code serverUrl}, {@code realmName} and {@code clientId} are mandatory; the shared-file options are ignored by
 * {@link TokenClient}.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_SKEW = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOCK_RETRY_DELAY = Duration.ofMillis(50);
    public static final String DEFAULT_TOKEN_DIRECTORY = ".tokensmith";

    private final String serverUrl;
    private final String realmName;
    private final String clientId;
    private final String clientSecret;
    private final String accessToken;
    private final String refreshToken;
    private final String username;
    private final String password;
    private final boolean verifyTls;
    private final Path caBundlePath;
    private final Duration tokenSkew;
    private final Duration httpTimeout;
    private final HttpClient httpClient;
    private final Clock clock;
    private final Path tokenFile;
    private final Duration lockTimeout;
    private final int lockRetryCount;
    private final Duration lockRetryDelay;
    private final Duration lockStaleAfter;
    private final Executor executor;

    private Config(Builder builder) {
        this.serverUrl = builder.serverUrl;
        this.realmName = builder.realmName;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.accessToken = builder.accessToken;
        this.refreshToken = builder.refreshToken;
        this.username = builder.username;
        this.password = builder.password;
        this.verifyTls = builder.verifyTls;
        this.caBundlePath = builder.caBundlePath;
        this.tokenSkew = builder.tokenSkew;
        this.httpTimeout = builder.httpTimeout;
        this.httpClient = builder.httpClient;
        this.clock = builder.clock;
        this.tokenFile = builder.tokenFile;
        this.lockTimeout = builder.lockTimeout;
        this.lockRetryCount = builder.lockRetryCount;
        this.lockRetryDelay = builder.lockRetryDelay;
        this.lockStaleAfter = builder.lockStaleAfter;
        this.executor = builder.executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedServerUrl = sanitizeUrl(serverUrl);
        String resolvedRealm = required(realmName, "RealmName");
        String resolvedClientId = required(clientId, "ClientID");

        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("Username and Password must be provided together");
        }
        if (!verifyTls && caBundlePath != null) {
            throw new IllegalArgumentException("CaBundlePath cannot be combined with disabled TLS verification");
        }
        if (caBundlePath != null && !Files.isReadable(caBundlePath)) {
            throw new IllegalArgumentException("CaBundlePath is not readable: " + caBundlePath);
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        Duration resolvedSkew = Optional.ofNullable(tokenSkew).orElse(DEFAULT_TOKEN_SKEW);
        if (resolvedSkew.isNegative()) {
            throw new IllegalArgumentException("TokenSkew cannot be negative");
        }

        Duration resolvedLockTimeout = Optional.ofNullable(lockTimeout).orElse(DEFAULT_LOCK_TIMEOUT);
        if (resolvedLockTimeout.isNegative()) {
            throw new IllegalArgumentException("LockTimeout cannot be negative");
        }
        if (lockRetryCount < 0) {
            throw new IllegalArgumentException("LockRetryCount cannot be negative");
        }
        Duration resolvedRetryDelay = Optional.ofNullable(lockRetryDelay).orElse(DEFAULT_LOCK_RETRY_DELAY);
        if (resolvedRetryDelay.isNegative() || resolvedRetryDelay.isZero()) {
            resolvedRetryDelay = DEFAULT_LOCK_RETRY_DELAY;
        }
        if (lockStaleAfter != null && (lockStaleAfter.isNegative() || lockStaleAfter.isZero())) {
            throw new IllegalArgumentException("LockStaleAfter must be positive");
        }

        Path resolvedTokenFile = Optional.ofNullable(tokenFile)
            .orElse(Path.of(DEFAULT_TOKEN_DIRECTORY, resolvedRealm + ".tok"))
            .toAbsolutePath()
            .normalize();
        if (resolvedTokenFile.getFileName().toString().endsWith(".lock")) {
            throw new IllegalArgumentException("TokenFile cannot use the .lock extension reserved for its lock file");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            HttpClient.Builder clientBuilder = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout);
            if (!verifyTls) {
                clientBuilder.sslContext(TlsSupport.trustAll());
            } else if (caBundlePath != null) {
                clientBuilder.sslContext(TlsSupport.fromCaBundle(caBundlePath));
            }
            resolvedClient = clientBuilder.build();
        }

        return new Builder()
            .serverUrl(resolvedServerUrl)
            .realmName(resolvedRealm)
            .clientId(resolvedClientId)
            .clientSecret(blankToNull(clientSecret))
            .accessToken(blankToNull(accessToken))
            .refreshToken(blankToNull(refreshToken))
            .username(username)
            .password(password)
            .verifyTls(verifyTls)
            .caBundlePath(caBundlePath)
            .tokenSkew(resolvedSkew)
            .httpTimeout(resolvedTimeout)
            .httpClient(resolvedClient)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .tokenFile(resolvedTokenFile)
            .lockTimeout(resolvedLockTimeout)
            .lockRetryCount(lockRetryCount)
            .lockRetryDelay(resolvedRetryDelay)
            .lockStaleAfter(lockStaleAfter)
            .executor(executor)
            .buildInternal();
    }

    /**
     * Credentials used when a client has to authenticate without being handed any: the configured user, otherwise
     * the client-credentials grant of a confidential client.
     */
    Credentials defaultCredentials() {
        if (username != null) {
            return Credentials.password(username, password);
        }
        if (clientSecret != null) {
            return Credentials.clientCredentials();
        }
        return null;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("ServerURL is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("ServerURL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String required(String value, String name) {
        String trimmed = Optional.ofNullable(value).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return trimmed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getRealmName() {
        return realmName;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public Path getCaBundlePath() {
        return caBundlePath;
    }

    public Duration getTokenSkew() {
        return tokenSkew;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Clock getClock() {
        return clock;
    }

    public Path getTokenFile() {
        return tokenFile;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public int getLockRetryCount() {
        return lockRetryCount;
    }

    public Duration getLockRetryDelay() {
        return lockRetryDelay;
    }

    public Duration getLockStaleAfter() {
        return lockStaleAfter;
    }

    public Executor getExecutor() {
        return executor;
    }

    public static final class Builder {
        private String serverUrl;
        private String realmName;
        private String clientId;
        private String clientSecret;
        private String accessToken;
        private String refreshToken;
        private String username;
        private String password;
        private boolean verifyTls = true;
        private Path caBundlePath;
        private Duration tokenSkew;
        private Duration httpTimeout;
        private HttpClient httpClient;
        private Clock clock;
        private Path tokenFile;
        private Duration lockTimeout;
        private int lockRetryCount;
        private Duration lockRetryDelay;
        private Duration lockStaleAfter;
        private Executor executor;

        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl;
            return this;
        }

        public Builder realmName(String realmName) {
            this.realmName = realmName;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * {@code false} disables certificate verification entirely.
         */
        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        /**
         * PEM bundle of the certificate authorities trusted for the identity provider.
         */
        public Builder caBundlePath(Path caBundlePath) {
            this.caBundlePath = caBundlePath;
            return this;
        }

        public Builder tokenSkew(Duration tokenSkew) {
            this.tokenSkew = tokenSkew;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder tokenFile(Path tokenFile) {
            this.tokenFile = tokenFile;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder lockRetryCount(int lockRetryCount) {
            this.lockRetryCount = lockRetryCount;
            return this;
        }

        public Builder lockRetryDelay(Duration lockRetryDelay) {
            this.lockRetryDelay = lockRetryDelay;
            return this;
        }

        public Builder lockStaleAfter(Duration lockStaleAfter) {
            this.lockStaleAfter = lockStaleAfter;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
