package cloud.tokensmith.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.tokensmith.sdk.internal.Json;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Unverified JWT payload claims. Used only to fill in expiries the token endpoint did not report; signature
 * validation is the resource server's business.
 */
public record DecodedClaims(
    String subject,
    String issuer,
    List<String> audience,
    String authorizedParty,
    String sessionState,
    long issuedAtUnix,
    long expiresAtUnix
) {

    public static DecodedClaims decode(String token) {
        if (token == null) {
            return empty();
        }
        try {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                return empty();
            }

            byte[] payload = decodeBase64(parts[1]);
            JsonNode node = Json.mapper().readTree(payload);
            if (node == null || !node.isObject()) {
                return empty();
            }

            return new DecodedClaims(
                text(node, "sub"),
                text(node, "iss"),
                readAudience(node),
                text(node, "azp"),
                text(node, "session_state"),
                node.path("iat").isNumber() ? node.path("iat").asLong(0L) : 0L,
                node.path("exp").isNumber() ? node.path("exp").asLong(0L) : 0L
            );
        } catch (IOException | IllegalArgumentException ex) {
            return empty();
        }
    }

    public Optional<Instant> expiresAt() {
        return expiresAtUnix > 0 ? Optional.of(Instant.ofEpochSecond(expiresAtUnix)) : Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    // "aud" is either a single string or an array
    private static List<String> readAudience(JsonNode node) {
        JsonNode aud = node.path("aud");
        if (aud.isTextual()) {
            return List.of(aud.asText());
        }
        if (!aud.isArray()) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        aud.forEach(item -> {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        });
        return Collections.unmodifiableList(values);
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(value);
        }
    }

    private static DecodedClaims empty() {
        return new DecodedClaims(null, null, Collections.emptyList(), null, null, 0L, 0L);
    }
}
