package cloud.tokensmith.sdk.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import cloud.tokensmith.sdk.GatewayException;
import cloud.tokensmith.sdk.internal.ApiErrorDecoder;
import cloud.tokensmith.sdk.internal.HttpUtil;
import cloud.tokensmith.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link IdentityProviderGateway} speaking to the OpenID Connect endpoints of a Keycloak realm:
 * {@code {serverUrl}/realms/{realm}/protocol/openid-connect/token} and {@code .../userinfo}.
 */
public final class KeycloakGateway implements IdentityProviderGateway {

    private static final Logger LOGGER = Logger.getLogger(KeycloakGateway.class.getName());

    static final String TOKEN_EXCHANGE_GRANT = "urn:ietf:params:oauth:grant-type:token-exchange";
    static final String ACCESS_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String userInfoUrl;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    public KeycloakGateway(
        HttpClient httpClient,
        String serverUrl,
        String realmName,
        String clientId,
        String clientSecret,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(realmName, "realmName");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = clientSecret == null || clientSecret.isBlank() ? null : clientSecret;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;

        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        String realmBase = base + "/realms/" + realmName + "/protocol/openid-connect";
        this.tokenUrl = realmBase + "/token";
        this.userInfoUrl = realmBase + "/userinfo";
    }

    @Override
    public TokenSet authenticate(Credentials credentials) throws GatewayException {
        Objects.requireNonNull(credentials, "credentials");
        Map<String, String> form = clientForm(credentials.getGrantType().value());
        if (credentials.getGrantType() == Credentials.GrantType.PASSWORD) {
            form.put("username", credentials.getUsername());
            form.put("password", credentials.getPassword());
        } else if (clientSecret == null) {
            throw new GatewayException(0, "unauthorized_client", "client_credentials grant requires a client secret");
        }
        LOGGER.fine(() -> "[tokensmith] requesting tokens with " + credentials.getGrantType().value() + " grant");
        return requestTokens("authenticate", form);
    }

    @Override
    public TokenSet refresh(String refreshToken) throws GatewayException {
        Objects.requireNonNull(refreshToken, "refreshToken");
        Map<String, String> form = clientForm("refresh_token");
        form.put("refresh_token", refreshToken);
        LOGGER.fine(() -> "[tokensmith] refreshing tokens");
        return requestTokens("refresh", form);
    }

    @Override
    public TokenSet exchange(String accessToken, String targetAudience) throws GatewayException {
        Objects.requireNonNull(accessToken, "accessToken");
        if (targetAudience == null || targetAudience.isBlank()) {
            throw new IllegalArgumentException("targetAudience is required");
        }
        Map<String, String> form = clientForm(TOKEN_EXCHANGE_GRANT);
        form.put("subject_token", accessToken);
        form.put("subject_token_type", ACCESS_TOKEN_TYPE);
        form.put("audience", targetAudience.trim());
        LOGGER.fine(() -> "[tokensmith] exchanging token for audience " + targetAudience);
        return requestTokens("exchange", form);
    }

    @Override
    public UserInfo userInfo(String accessToken) throws GatewayException {
        Objects.requireNonNull(accessToken, "accessToken");
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.getWithBearer(httpClient, userInfoUrl, accessToken, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GatewayException("user info request interrupted", ex);
        } catch (IOException ex) {
            throw new GatewayException("user info request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            Map<String, Object> claims = Json.mapper().readValue(bodyStream, new TypeReference<Map<String, Object>>() { });
            return new UserInfo(claims);
        } catch (IOException ex) {
            throw new GatewayException("decode user info response: " + ex.getMessage(), ex);
        }
    }

    String tokenUrl() {
        return tokenUrl;
    }

    private Map<String, String> clientForm(String grantType) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", grantType);
        form.put("client_id", clientId);
        if (clientSecret != null) {
            form.put("client_secret", clientSecret);
        }
        return form;
    }

    private TokenSet requestTokens(String operation, Map<String, String> form) throws GatewayException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postForm(httpClient, tokenUrl, form, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GatewayException(operation + " request interrupted", ex);
        } catch (IOException ex) {
            throw new GatewayException(operation + " request: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() >= 400) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            return parseTokenResponse(Json.mapper().readTree(bodyStream), clock.instant());
        } catch (IOException ex) {
            throw new GatewayException("decode " + operation + " response: " + ex.getMessage(), ex);
        }
    }

    static TokenSet parseTokenResponse(JsonNode node, Instant issuedAt) throws GatewayException {
        String accessToken = node == null ? null : node.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new GatewayException(0, null, "token response missing access_token");
        }

        String refreshToken = node.path("refresh_token").asText(null);
        if (refreshToken != null && refreshToken.isBlank()) {
            refreshToken = null;
        }

        Instant accessExpiry = lifespan(node, "expires_in", issuedAt);
        if (accessExpiry == null) {
            accessExpiry = DecodedClaims.decode(accessToken).expiresAt().orElse(null);
        }

        Instant refreshExpiry = null;
        if (refreshToken != null) {
            refreshExpiry = lifespan(node, "refresh_expires_in", issuedAt);
            // Keycloak reports 0 for offline tokens, which do not expire
            if (refreshExpiry == null && !node.path("refresh_expires_in").isNumber()) {
                refreshExpiry = DecodedClaims.decode(refreshToken).expiresAt().orElse(null);
            }
        }

        return new TokenSet(accessToken, accessExpiry, refreshToken, refreshExpiry, issuedAt);
    }

    private static Instant lifespan(JsonNode node, String field, Instant issuedAt) {
        JsonNode value = node.path(field);
        if (!value.canConvertToLong() && !value.isTextual()) {
            return null;
        }
        long seconds = value.asLong(-1L);
        if (seconds <= 0) {
            return null;
        }
        return issuedAt.plusSeconds(seconds);
    }
}
