package cloud.tokensmith.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.tokensmith.sdk.GatewayException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding OAuth2 error payloads ({@code error} / {@code error_description}) returned by the
 * identity provider.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static GatewayException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new GatewayException(statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new GatewayException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            String error = node.hasNonNull("error") ? node.get("error").asText() : null;
            String description = node.hasNonNull("error_description") ? node.get("error_description").asText() : null;
            if (description == null && error != null) {
                description = "identity provider rejected request with status " + statusCode + " (" + error + ")";
            }
            return new GatewayException(statusCode, error, description);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new GatewayException(statusCode, null, fallback);
        }
    }
}
