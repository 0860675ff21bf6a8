package cloud.tokensmith.sdk;

import java.nio.file.Path;

/**
 * The shared token file exists but does not hold a usable record. The file is left in place for inspection.
 */
public final class StoreCorruptException extends TokensmithException {

    private static final long serialVersionUID = 1L;

    private final transient Path tokenFile;

    public StoreCorruptException(Path tokenFile, String message, Throwable cause) {
        super("corrupt token file " + tokenFile + ": " + message, cause);
        this.tokenFile = tokenFile;
    }

    public Path getTokenFile() {
        return tokenFile;
    }
}
