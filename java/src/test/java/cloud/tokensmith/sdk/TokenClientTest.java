package cloud.tokensmith.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.tokensmith.sdk.auth.TokenSet;
import cloud.tokensmith.sdk.engine.TokenState;
import cloud.tokensmith.sdk.testing.FakeGateway;
import cloud.tokensmith.sdk.testing.MutableClock;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TokenClientTest {

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1000));
    private final FakeGateway gateway = new FakeGateway(clock);

    @Test
    void initialisesFromSeedTokens() throws Exception {
        TokenClient client = new TokenClient(config()
            .accessToken("initial access token")
            .refreshToken("initial refresh token")
            .build(), gateway);

        client.initializeTokens();

        assertNotEquals("initial access token", client.getAccessToken());
        assertEquals("refreshed-access-1", client.getAccessToken());
        assertNotEquals("initial refresh token", client.getRefreshToken());
        assertEquals("refreshed-refresh-1", client.getRefreshToken());
        assertEquals(1, gateway.refreshCalls.get());
    }

    @Test
    void initialisesFromCredentials() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);

        client.initializeTokens("test", "password");

        assertEquals("auth-access-1", client.getAccessToken());
        assertEquals("auth-refresh-1", client.getRefreshToken());
        assertEquals("test", gateway.lastCredentials().getUsername());
    }

    @Test
    void refusesToInitialiseWithoutSeedsOrCredentials() {
        TokenClient client = new TokenClient(config().build(), gateway);

        TokensNotInitializedException ex = assertThrows(TokensNotInitializedException.class, client::initializeTokens);
        assertTrue(ex.getMessage().contains("seed tokens or credentials"));
        assertEquals(TokenState.UNINITIALIZED, client.getState());
    }

    @Test
    void exposesTokenTimestamps() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);
        assertTrue(client.getTokenTimestamp().isEmpty());

        client.initializeTokens("test", "password");

        assertEquals(Instant.ofEpochSecond(1000), client.getTokenTimestamp().orElseThrow());
        assertEquals(Instant.ofEpochSecond(1600), client.getAccessTokenExpiry().orElseThrow());
        assertEquals(Instant.ofEpochSecond(2800), client.getRefreshTokenExpiry().orElseThrow());
    }

    @Test
    void refreshesTransparentlyOnceAccessTokenExpires() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);
        client.initializeTokens("test", "password");

        clock.advance(Duration.ofSeconds(590));
        assertEquals("refreshed-access-2", client.getAccessToken());
        assertEquals(1, gateway.refreshCalls.get());

        clock.advance(Duration.ofHours(2));
        assertThrows(RefreshTokenExpiredException.class, client::getAccessToken);
        assertEquals(TokenState.EXPIRED, client.getState());

        client.passwordCredentials("test", "password");
        assertEquals("auth-access-3", client.getAccessToken());
        assertEquals(TokenState.VALID, client.getState());
    }

    @Test
    void returnsUserInfo() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);
        client.initializeTokens("test", "password");

        assertEquals("user-1", client.getUserInfo().subject());
        assertEquals(1, gateway.userInfoCalls.get());
    }

    @Test
    void tokenExchangeLeavesClientTokensAlone() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);
        client.initializeTokens("test", "password");
        String before = client.getAccessToken();

        TokenSet exchanged = client.tokenExchange("other-client");

        assertTrue(exchanged.getAccessToken().startsWith("exchanged-other-client"));
        assertEquals(before, client.getAccessToken());
    }

    @Test
    void explicitRefreshReplacesTokens() throws Exception {
        TokenClient client = new TokenClient(config().build(), gateway);
        client.initializeTokens("test", "password");

        TokenSet refreshed = client.refreshTokens();

        assertEquals("refreshed-access-2", refreshed.getAccessToken());
        assertEquals(refreshed.getAccessToken(), client.getAccessToken());
    }

    @Test
    void talksToKeycloakEndpoints() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        AtomicInteger tokenCalls = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/realms/test_realm/protocol/openid-connect/token", exchange -> {
            String form = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            int call = tokenCalls.incrementAndGet();
            assertTrue(form.contains("grant_type=password"));
            respond(exchange, mapper.writeValueAsBytes(Map.of(
                "access_token", "access-" + call,
                "refresh_token", "refresh-" + call,
                "expires_in", 600,
                "refresh_expires_in", 1800
            )));
        });
        server.createContext("/realms/test_realm/protocol/openid-connect/userinfo", exchange ->
            respond(exchange, mapper.writeValueAsBytes(Map.of(
                "sub", "user-1",
                "seen", exchange.getRequestHeaders().getFirst("Authorization")
            ))));
        server.start();
        try {
            TokenClient client = new TokenClient(Config.builder()
                .serverUrl("http://localhost:" + server.getAddress().getPort())
                .realmName("test_realm")
                .clientId("test_client")
                .clientSecret("client_secret")
                .username("test")
                .password("password")
                .clock(clock)
                .build());

            client.initializeTokens();

            assertEquals("access-1", client.getAccessToken());
            assertEquals("Bearer access-1", client.getUserInfo().claim("seen"));
            assertEquals(1, tokenCalls.get());
            client.close();
        } finally {
            server.stop(0);
        }
    }

    private Config.Builder config() {
        return Config.builder()
            .serverUrl("https://example.com")
            .realmName("test_realm")
            .clientId("test_client")
            .clock(clock);
    }

    private static void respond(HttpExchange exchange, byte[] payload) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
