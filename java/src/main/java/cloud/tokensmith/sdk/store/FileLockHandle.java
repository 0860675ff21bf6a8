package cloud.tokensmith.sdk.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exclusive ownership of a shared token file for one read-modify-write cycle. Holds both the in-process lock for the
 * path and the OS advisory lock on the lock file; {@link #close()} clears the holder record and releases both.
 */
public final class FileLockHandle implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(FileLockHandle.class.getName());

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;
    private final ReentrantLock inProcessLock;
    private boolean released;

    FileLockHandle(Path lockFile, FileChannel channel, FileLock lock, ReentrantLock inProcessLock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
        this.inProcessLock = inProcessLock;
    }

    public Path lockFile() {
        return lockFile;
    }

    public boolean isHeld() {
        return !released && lock.isValid();
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            // the record must not outlive its holder
            channel.truncate(0);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, ex, () -> "[tokensmith] failed to clear holder record of " + lockFile);
        }
        try {
            lock.release();
        } catch (IOException ex) {
            // closing the channel below drops the lock anyway
            LOGGER.log(Level.WARNING, ex, () -> "[tokensmith] failed to release lock " + lockFile);
        } finally {
            try {
                channel.close();
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[tokensmith] failed to close lock file " + lockFile);
            } finally {
                inProcessLock.unlock();
            }
        }
    }
}
