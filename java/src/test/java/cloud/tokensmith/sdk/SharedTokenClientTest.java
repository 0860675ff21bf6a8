package cloud.tokensmith.sdk;

import com.fasterxml.jackson.databind.node.ObjectNode;
import cloud.tokensmith.sdk.engine.TokenState;
import cloud.tokensmith.sdk.internal.Json;
import cloud.tokensmith.sdk.store.FileLockHandle;
import cloud.tokensmith.sdk.store.LockedFileTokenStore;
import cloud.tokensmith.sdk.testing.FakeGateway;
import cloud.tokensmith.sdk.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SharedTokenClientTest {

    @TempDir
    Path directory;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1000));
    private final FakeGateway gateway = new FakeGateway(clock);
    private final List<SharedTokenClient> clients = new ArrayList<>();

    @AfterEach
    void closeClients() {
        clients.forEach(SharedTokenClient::close);
    }

    @Test
    void concurrentClientsRefreshOnlyOnce() throws Exception {
        client(Duration.ofSeconds(10)).initializeTokens().get(5, TimeUnit.SECONDS);
        assertEquals(1, gateway.refreshCalls.get());

        clock.advance(Duration.ofSeconds(601));
        gateway.refreshDelay(Duration.ofMillis(200));

        List<CompletableFuture<String>> pending = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            pending.add(client(Duration.ofSeconds(10)).getAccessToken());
        }
        Set<String> tokens = pending.stream().map(CompletableFuture::join).collect(Collectors.toSet());

        assertEquals(Set.of("refreshed-access-2"), tokens);
        assertEquals(2, gateway.refreshCalls.get());
        assertEquals(List.of("initial refresh token", "refreshed-refresh-1"), gateway.refreshTokensUsed);
    }

    @Test
    void waiterPicksUpTokensRefreshedByAnotherProcess() throws Exception {
        SharedTokenClient client = client(Duration.ofSeconds(10));
        client.initializeTokens().get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(601));

        CompletableFuture<String> pending;
        // another process holds the file lock and refreshes while this client waits for it
        try (FileChannel foreign = FileChannel.open(directory.resolve("test_realm.lock"),
                 StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = foreign.lock()) {
            pending = client.getAccessToken();
            Thread.sleep(200);
            assertFalse(pending.isDone());

            ObjectNode record = (ObjectNode) Json.mapper().readTree(client.getTokenFile().toFile());
            record.put("access_token", "foreign-access");
            record.put("access_expires_at", clock.instant().plusSeconds(600).toString());
            record.put("issued_at", clock.instant().toString());
            Files.write(client.getTokenFile(), Json.mapper().writeValueAsBytes(record));
        }

        assertEquals("foreign-access", pending.get(5, TimeUnit.SECONDS));
        assertEquals(1, gateway.refreshCalls.get());
        assertEquals(TokenState.VALID, client.getState());
    }

    @Test
    void secondClientReadsTokensWrittenByFirst() throws Exception {
        SharedTokenClient first = client(Duration.ofSeconds(1));
        String token = first.initializeTokens().get(5, TimeUnit.SECONDS).getAccessToken();

        SharedTokenClient second = client(Duration.ofSeconds(1));

        assertEquals(token, second.getAccessToken().get(5, TimeUnit.SECONDS));
        assertEquals(Instant.ofEpochSecond(1600), second.getAccessTokenExpiry().get(5, TimeUnit.SECONDS).orElseThrow());
        assertEquals(1, gateway.refreshCalls.get());
        assertEquals(first.getTokenFile(), second.getTokenFile());
    }

    @Test
    void tokenExchangeDoesNotRewriteFile() throws Exception {
        SharedTokenClient client = client(Duration.ofSeconds(1));
        client.initializeTokens().get(5, TimeUnit.SECONDS);
        byte[] before = Files.readAllBytes(client.getTokenFile());

        String exchanged = client.tokenExchange("other-client").get(5, TimeUnit.SECONDS).getAccessToken();

        assertTrue(exchanged.startsWith("exchanged-other-client"));
        assertArrayEquals(before, Files.readAllBytes(client.getTokenFile()));
    }

    @Test
    void expiredRefreshTokenLeavesFileUntouched() throws Exception {
        SharedTokenClient client = client(Duration.ofSeconds(1));
        client.initializeTokens().get(5, TimeUnit.SECONDS);
        byte[] before = Files.readAllBytes(client.getTokenFile());

        clock.advance(Duration.ofHours(1));
        Throwable failure = failureOf(client.getAccessToken());

        assertInstanceOf(RefreshTokenExpiredException.class, failure);
        assertEquals(TokenState.EXPIRED, client.getState());
        assertArrayEquals(before, Files.readAllBytes(client.getTokenFile()));
        assertEquals(1, gateway.refreshCalls.get());
    }

    @Test
    void failedRefreshReleasesLock() throws Exception {
        SharedTokenClient client = client(Duration.ofSeconds(1));
        client.initializeTokens().get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofSeconds(601));
        gateway.failRefreshWith(new GatewayException(400, "invalid_grant", "Token is not active"));
        Throwable failure = failureOf(client.getAccessToken());

        GatewayException gatewayFailure = assertInstanceOf(GatewayException.class, failure);
        assertEquals("invalid_grant", gatewayFailure.getError());
        assertEquals(TokenState.FAILED, client.getState());
        try (FileLockHandle handle = storeFor(client).acquire()) {
            assertTrue(handle.isHeld());
        }
    }

    @Test
    void lockTimeoutSurfacesWhenAnotherHolderKeepsTheLock() throws Exception {
        SharedTokenClient client = client(Duration.ofMillis(200));
        client.initializeTokens().get(5, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(601));

        try (FileLockHandle ignored = storeFor(client).acquire()) {
            Throwable failure = failureOf(client.getAccessToken());
            assertInstanceOf(LockTimeoutException.class, failure);
        }
        assertEquals(1, gateway.refreshCalls.get());
    }

    @Test
    void closedClientRejectsOperations() throws Exception {
        SharedTokenClient client = client(Duration.ofSeconds(1));
        client.close();

        Throwable failure = failureOf(client.getAccessToken());

        assertInstanceOf(TokensmithException.class, failure);
        assertTrue(failure.getMessage().contains("closed"));
    }

    private SharedTokenClient client(Duration lockTimeout) throws TokensmithException {
        SharedTokenClient client = new SharedTokenClient(Config.builder()
            .serverUrl("https://example.com")
            .realmName("test_realm")
            .clientId("test_client")
            .refreshToken("initial refresh token")
            .clock(clock)
            .tokenFile(directory.resolve("test_realm.tok"))
            .lockTimeout(lockTimeout)
            .lockRetryDelay(Duration.ofMillis(10))
            .build(), gateway);
        clients.add(client);
        return client;
    }

    private LockedFileTokenStore storeFor(SharedTokenClient client) throws TokensmithException {
        Config config = client.getConfig();
        return new LockedFileTokenStore(
            config.getTokenFile(),
            config.getServerUrl(),
            config.getRealmName(),
            Duration.ofSeconds(1),
            0,
            Duration.ofMillis(10),
            null,
            clock
        );
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return ex.getCause();
    }
}
