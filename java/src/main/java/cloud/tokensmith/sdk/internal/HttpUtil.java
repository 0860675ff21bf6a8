package cloud.tokensmith.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing form-encoded and bearer-authenticated requests.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<java.io.InputStream> postForm(HttpClient client, String url, Map<String, String> form, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    public static HttpResponse<java.io.InputStream> getWithBearer(HttpClient client, String url, String bearerToken, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Accept", "application/json")
            .timeout(timeout);

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    static String encodeForm(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        form.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            joiner.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        });
        return joiner.toString();
    }
}
