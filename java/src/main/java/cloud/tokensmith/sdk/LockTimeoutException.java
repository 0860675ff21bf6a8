package cloud.tokensmith.sdk;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The exclusive lock guarding a shared token file could not be acquired in time. Nothing was written; the operation
 * may be retried.
 */
public final class LockTimeoutException extends TokensmithException {

    private static final long serialVersionUID = 1L;

    private final transient Path lockFile;
    private final Duration waited;

    public LockTimeoutException(Path lockFile, Duration waited, String holder) {
        super("timed out after " + waited.toMillis() + "ms waiting for lock " + lockFile
            + (holder == null ? "" : " held by " + holder));
        this.lockFile = lockFile;
        this.waited = waited;
    }

    public Path getLockFile() {
        return lockFile;
    }

    public Duration getWaited() {
        return waited;
    }
}
