package cloud.tokensmith.sdk;

/**
 * Base exception thrown by the Tokensmith Java SDK.
 */
public class TokensmithException extends Exception {

    private static final long serialVersionUID = 1L;

    public TokensmithException(String message) {
        super(message);
    }

    public TokensmithException(String message, Throwable cause) {
        super(message, cause);
    }
}
