package cloud.tokensmith.sdk.auth;

import java.util.Objects;

/**
 * Grant used for a full authentication: the resource-owner password grant, or the client-credentials grant of a
 * confidential client.
 */
public final class Credentials {

    public enum GrantType {
        PASSWORD("password"),
        CLIENT_CREDENTIALS("client_credentials");

        private final String value;

        GrantType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    private final GrantType grantType;
    private final String username;
    private final String password;

    private Credentials(GrantType grantType, String username, String password) {
        this.grantType = grantType;
        this.username = username;
        this.password = password;
    }

    public static Credentials password(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        Objects.requireNonNull(password, "password");
        return new Credentials(GrantType.PASSWORD, username, password);
    }

    public static Credentials clientCredentials() {
        return new Credentials(GrantType.CLIENT_CREDENTIALS, null, null);
    }

    public GrantType getGrantType() {
        return grantType;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return grantType == GrantType.PASSWORD ? "Credentials{password, username=" + username + '}' : "Credentials{client_credentials}";
    }
}
