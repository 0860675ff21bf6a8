package cloud.tokensmith.sdk;

/**
 * No token set is stored yet and the client has neither seed tokens nor credentials to obtain one.
 */
public final class TokensNotInitializedException extends TokensmithException {

    private static final long serialVersionUID = 1L;

    public TokensNotInitializedException(String message) {
        super(message);
    }
}
