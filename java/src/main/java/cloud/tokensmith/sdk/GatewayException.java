package cloud.tokensmith.sdk;

/**
 * Failure reported while talking to the identity provider (authenticate, refresh, exchange or user-info).
 * When the provider answered with a non-2xx status the SDK hydrates the HTTP status and the OAuth {@code error}
 * code so callers can tell a rejected refresh token apart from a transport problem.
 */
public final class GatewayException extends TokensmithException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String error;

    public GatewayException(int statusCode, String error, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, error) : message);
        this.statusCode = statusCode;
        this.error = error;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.error = null;
    }

    /**
     * @return HTTP status code returned by the provider, {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth error code such as {@code invalid_grant} (nullable when the response body did not include one).
     */
    public String getError() {
        return error;
    }

    private static String defaultMessage(int status, String error) {
        if (error == null || error.isBlank()) {
            return "identity provider request failed with status " + status;
        }
        return "identity provider request failed with status " + status + " (" + error + ")";
    }
}
