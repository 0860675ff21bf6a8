package cloud.tokensmith.sdk.store;

import cloud.tokensmith.sdk.LockTimeoutException;
import cloud.tokensmith.sdk.StoreCorruptException;
import cloud.tokensmith.sdk.TokensmithException;
import cloud.tokensmith.sdk.auth.TokenSet;
import cloud.tokensmith.sdk.internal.Json;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * {@link TokenStore} backed by a JSON file that any number of cooperating processes read and refresh.
 *
 * <p>
 * Every {@link #update(Update)} runs the same protocol: take the exclusive lock on {@code <token file>.lock}, re-read
 * the token file, let the callback decide whether a write is still needed, and release the lock in a {@code finally}
 * block. Writes go to a temporary file in the same directory which is then renamed over the token file, so lock-free
 * readers never see a partial record.
 * </p>
 *
 * <p>
 * OS file locks are owned by the process, so threads of one JVM are serialised by an in-process lock per path before
 * the file lock is attempted. When {@code lockStaleAfter} is set, a lock whose recorded holder is older than that is
 * treated as abandoned: the lock file is unlinked and the waiter locks a fresh one. Holders clear their record before
 * releasing, so a lock that was just won but carries no record yet is never taken for stale. The record is read and
 * the file unlinked in two steps, though: a holder that locks and writes its record in between can still lose its
 * lock file, which is why breaking is off unless {@code lockStaleAfter} is set well above any refresh duration.
 * </p>
 */
public final class LockedFileTokenStore implements TokenStore {

    private static final Logger LOGGER = Logger.getLogger(LockedFileTokenStore.class.getName());

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOCK_RETRY_DELAY = Duration.ofMillis(50);

    private static final ConcurrentMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();
    private static final String HOST_NAME = resolveHostName();

    private final Path tokenFile;
    private final Path lockFile;
    private final String serverUrl;
    private final String realmName;
    private final Duration lockTimeout;
    private final int lockRetryCount;
    private final Duration lockRetryDelay;
    private final Duration lockStaleAfter;
    private final Clock clock;

    /**
     * @param lockRetryCount maximum number of lock attempts per acquisition, {@code 0} to keep trying until
     *                       {@code lockTimeout} elapses.
     * @param lockStaleAfter age after which a held lock is considered abandoned; {@code null} never breaks locks.
     */
    public LockedFileTokenStore(
        Path tokenFile,
        String serverUrl,
        String realmName,
        Duration lockTimeout,
        int lockRetryCount,
        Duration lockRetryDelay,
        Duration lockStaleAfter,
        Clock clock
    ) throws TokensmithException {
        Objects.requireNonNull(tokenFile, "tokenFile");
        this.tokenFile = tokenFile.toAbsolutePath().normalize();
        this.lockFile = siblingWithSuffix(this.tokenFile, ".lock");
        if (this.lockFile.equals(this.tokenFile)) {
            throw new IllegalArgumentException("token file " + this.tokenFile + " would double as its own lock file");
        }
        this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl");
        this.realmName = Objects.requireNonNull(realmName, "realmName");
        this.lockTimeout = lockTimeout == null || lockTimeout.isNegative() ? DEFAULT_LOCK_TIMEOUT : lockTimeout;
        if (lockRetryCount < 0) {
            throw new IllegalArgumentException("lockRetryCount cannot be negative");
        }
        this.lockRetryCount = lockRetryCount;
        this.lockRetryDelay = lockRetryDelay == null || lockRetryDelay.isZero() || lockRetryDelay.isNegative()
            ? DEFAULT_LOCK_RETRY_DELAY : lockRetryDelay;
        this.lockStaleAfter = lockStaleAfter == null || lockStaleAfter.isZero() || lockStaleAfter.isNegative()
            ? null : lockStaleAfter;
        this.clock = clock == null ? Clock.systemUTC() : clock;

        try {
            Files.createDirectories(this.tokenFile.getParent());
        } catch (IOException ex) {
            throw new TokensmithException("create token directory " + this.tokenFile.getParent() + ": " + ex.getMessage(), ex);
        }
    }

    public Path tokenFile() {
        return tokenFile;
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public Optional<TokenSet> read() throws TokensmithException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(tokenFile);
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new TokensmithException("read token file " + tokenFile + ": " + ex.getMessage(), ex);
        }

        TokenFileRecord record;
        try {
            record = Json.mapper().readValue(bytes, TokenFileRecord.class);
        } catch (IOException ex) {
            throw new StoreCorruptException(tokenFile, ex.getMessage(), ex);
        }
        if (record == null || record.accessToken() == null || record.accessToken().isBlank() || record.issuedAt() == null) {
            throw new StoreCorruptException(tokenFile, "record lacks access_token or issued_at", null);
        }
        if (!serverUrl.equals(record.serverUrl()) || !realmName.equals(record.realmName())) {
            throw new StoreCorruptException(tokenFile,
                "record belongs to realm " + record.realmName() + " at " + record.serverUrl(), null);
        }
        return Optional.of(record.toTokenSet());
    }

    @Override
    public <T> T update(Update<T> update) throws TokensmithException {
        try (FileLockHandle handle = acquire()) {
            Optional<TokenSet> current = read();
            return update.apply(new Transaction() {
                @Override
                public Optional<TokenSet> current() {
                    return current;
                }

                @Override
                public void write(TokenSet tokens) throws TokensmithException {
                    if (!handle.isHeld()) {
                        throw new IllegalStateException("token file written without holding " + lockFile);
                    }
                    writeRecord(tokens);
                }
            });
        }
    }

    /**
     * Acquires exclusive ownership of the token file, waiting at most the configured lock timeout.
     *
     * @throws LockTimeoutException when the lock is still held by someone else once the wait is over.
     */
    public FileLockHandle acquire() throws TokensmithException {
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        ReentrantLock inProcess = IN_PROCESS_LOCKS.computeIfAbsent(lockFile, path -> new ReentrantLock());

        try {
            if (!inProcess.tryLock(lockTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(lockFile, lockTimeout, "another thread of this process");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TokensmithException("interrupted while waiting for lock " + lockFile, ex);
        }

        boolean acquired = false;
        try {
            int attempts = 0;
            while (true) {
                attempts++;
                FileLockHandle handle = tryLockFile(inProcess);
                if (handle != null) {
                    acquired = true;
                    return handle;
                }
                if (lockStaleAfter != null && breakIfStale()) {
                    continue;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || (lockRetryCount > 0 && attempts >= lockRetryCount)) {
                    LockHolder holder = readHolder();
                    throw new LockTimeoutException(lockFile, lockTimeout, holder == null ? null : holder.describe());
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, lockRetryDelay.toNanos()));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TokensmithException("interrupted while waiting for lock " + lockFile, ex);
        } finally {
            if (!acquired) {
                inProcess.unlock();
            }
        }
    }

    private FileLockHandle tryLockFile(ReentrantLock inProcess) throws TokensmithException {
        FileChannel channel = null;
        try {
            Object keyBefore = fileKey(lockFile);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException ex) {
                lock = null;
            }
            if (lock == null) {
                channel.close();
                return null;
            }

            // the file may have been broken as stale and replaced between open and lock
            Object keyAfter = fileKey(lockFile);
            if (!Files.exists(lockFile) || (keyBefore != null && keyAfter != null && !keyBefore.equals(keyAfter))) {
                lock.release();
                channel.close();
                return null;
            }

            writeHolder(channel);
            return new FileLockHandle(lockFile, channel, lock, inProcess);
        } catch (IOException ex) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException closeEx) {
                    ex.addSuppressed(closeEx);
                }
            }
            throw new TokensmithException("lock " + lockFile + ": " + ex.getMessage(), ex);
        }
    }

    private boolean breakIfStale() throws TokensmithException {
        LockHolder holder = readHolder();
        if (holder == null || holder.acquiredAt() == null) {
            return false;
        }
        Duration age = Duration.between(holder.acquiredAt(), clock.instant());
        if (age.compareTo(lockStaleAfter) <= 0) {
            return false;
        }
        LOGGER.warning(() -> "[tokensmith] breaking stale lock " + lockFile + " held by " + holder.describe());
        try {
            return Files.deleteIfExists(lockFile);
        } catch (IOException ex) {
            throw new TokensmithException("break stale lock " + lockFile + ": " + ex.getMessage(), ex);
        }
    }

    private void writeHolder(FileChannel channel) throws IOException {
        LockHolder holder = new LockHolder(ProcessHandle.current().pid(), HOST_NAME, clock.instant());
        byte[] bytes = Json.mapper().writeValueAsBytes(holder);
        channel.truncate(0);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long position = 0;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
        channel.force(false);
    }

    private LockHolder readHolder() {
        try {
            byte[] bytes = Files.readAllBytes(lockFile);
            if (bytes.length == 0) {
                return null;
            }
            return Json.mapper().readValue(bytes, LockHolder.class);
        } catch (IOException ex) {
            // holder metadata is advisory; an unreadable or half-written file just means "unknown holder"
            return null;
        }
    }

    private void writeRecord(TokenSet tokens) throws TokensmithException {
        Path directory = tokenFile.getParent();
        Path temp = null;
        try {
            byte[] payload = Json.mapper().writeValueAsBytes(TokenFileRecord.of(serverUrl, realmName, tokens));
            temp = Files.createTempFile(directory, tokenFile.getFileName().toString() + ".", ".tmp");
            Files.write(temp, payload, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
            moveAtomically(temp, tokenFile);
        } catch (IOException ex) {
            TokensmithException failure = new TokensmithException("write token file " + tokenFile + ": " + ex.getMessage(), ex);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupEx) {
                    failure.addSuppressed(cleanupEx);
                }
            }
            throw failure;
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Object fileKey(Path path) throws IOException {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
        } catch (NoSuchFileException ex) {
            return null;
        }
    }

    private static Path siblingWithSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return file.resolveSibling(base + suffix);
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            return "unknown-host";
        }
    }
}
