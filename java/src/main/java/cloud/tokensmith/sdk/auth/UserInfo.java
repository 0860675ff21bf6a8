package cloud.tokensmith.sdk.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Claims returned by the identity provider's user-info endpoint.
 */
public record UserInfo(Map<String, Object> claims) {

    public UserInfo {
        claims = claims == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public String subject() {
        return text("sub");
    }

    public String preferredUsername() {
        return text("preferred_username");
    }

    public String email() {
        return text("email");
    }

    public String name() {
        return text("name");
    }

    public Object claim(String name) {
        return claims.get(name);
    }

    private String text(String field) {
        Object value = claims.get(field);
        return value == null ? null : value.toString();
    }
}
