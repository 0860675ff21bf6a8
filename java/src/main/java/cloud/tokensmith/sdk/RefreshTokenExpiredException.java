package cloud.tokensmith.sdk;

/**
 * The stored refresh token is missing or no longer usable. Terminal for the current token set: callers have to
 * re-authenticate through {@code initializeTokens(username, password)} or {@code passwordCredentials}.
 */
public final class RefreshTokenExpiredException extends TokensmithException {

    private static final long serialVersionUID = 1L;

    public RefreshTokenExpiredException(String message) {
        super(message);
    }
}
