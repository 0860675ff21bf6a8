package cloud.tokensmith.sdk;

import cloud.tokensmith.sdk.auth.Credentials;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .serverUrl("https://sso.example.com/")
            .realmName("analytics")
            .clientId("notebook")
            .build();

        assertEquals("https://sso.example.com", config.getServerUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertEquals(Config.DEFAULT_TOKEN_SKEW, config.getTokenSkew());
        assertEquals(Config.DEFAULT_LOCK_TIMEOUT, config.getLockTimeout());
        assertEquals(Config.DEFAULT_LOCK_RETRY_DELAY, config.getLockRetryDelay());
        assertEquals(0, config.getLockRetryCount());
        assertNull(config.getLockStaleAfter());
        assertNull(config.getClientSecret());
        assertTrue(config.isVerifyTls());
        assertNotNull(config.getHttpClient());
        assertEquals(Clock.systemUTC(), config.getClock());
        assertEquals(Path.of(".tokensmith", "analytics.tok").toAbsolutePath().normalize(), config.getTokenFile());
        assertNull(config.defaultCredentials());
    }

    @Test
    void requiresServerRealmAndClient() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().realmName("r").clientId("c").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().serverUrl("invalid").realmName("r").clientId("c").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().serverUrl("https://sso").clientId("c").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().serverUrl("https://sso").realmName("r").build());
    }

    @Test
    void rejectsInconsistentOptions() {
        Config.Builder base = Config.builder().serverUrl("https://sso").realmName("r").clientId("c");

        assertThrows(IllegalArgumentException.class, () -> base.username("alice").build());
        base.username(null);
        assertThrows(IllegalArgumentException.class, () -> base.tokenSkew(Duration.ofSeconds(-1)).build());
        base.tokenSkew(null);
        assertThrows(IllegalArgumentException.class, () -> base.lockRetryCount(-1).build());
        base.lockRetryCount(0);
        assertThrows(IllegalArgumentException.class, () -> base.lockStaleAfter(Duration.ZERO).build());
        base.lockStaleAfter(null);
        assertThrows(IllegalArgumentException.class, () -> base.verifyTls(false).caBundlePath(Path.of("/etc/ca.pem")).build());
        base.verifyTls(true).caBundlePath(null);
        assertThrows(IllegalArgumentException.class, () -> base.tokenFile(Path.of("/var/run/tokens/shared.lock")).build());
    }

    @Test
    void honoursCustomValues() {
        Config config = Config.builder()
            .serverUrl("https://sso.example.com")
            .realmName("analytics")
            .clientId("notebook")
            .clientSecret("  ")
            .refreshToken("seed")
            .tokenSkew(Duration.ZERO)
            .httpTimeout(Duration.ofSeconds(5))
            .tokenFile(Path.of("/var/run/tokens/shared.tok"))
            .lockTimeout(Duration.ofSeconds(2))
            .lockRetryCount(5)
            .lockRetryDelay(Duration.ofMillis(250))
            .lockStaleAfter(Duration.ofMinutes(2))
            .verifyTls(false)
            .build();

        assertNull(config.getClientSecret());
        assertEquals("seed", config.getRefreshToken());
        assertEquals(Duration.ZERO, config.getTokenSkew());
        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
        assertEquals(Path.of("/var/run/tokens/shared.tok"), config.getTokenFile());
        assertEquals(Duration.ofSeconds(2), config.getLockTimeout());
        assertEquals(5, config.getLockRetryCount());
        assertEquals(Duration.ofMillis(250), config.getLockRetryDelay());
        assertEquals(Duration.ofMinutes(2), config.getLockStaleAfter());
        assertFalse(config.isVerifyTls());
    }

    @Test
    void defaultCredentialsPreferConfiguredUser() {
        Config.Builder base = Config.builder().serverUrl("https://sso").realmName("r").clientId("c").clientSecret("s");

        assertEquals(Credentials.GrantType.CLIENT_CREDENTIALS, base.build().defaultCredentials().getGrantType());

        Credentials user = base.username("alice").password("pw").build().defaultCredentials();
        assertEquals(Credentials.GrantType.PASSWORD, user.getGrantType());
        assertEquals("alice", user.getUsername());
    }
}
