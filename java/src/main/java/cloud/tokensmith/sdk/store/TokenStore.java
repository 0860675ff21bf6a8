package cloud.tokensmith.sdk.store;

import cloud.tokensmith.sdk.TokensmithException;
import cloud.tokensmith.sdk.auth.TokenSet;

import java.util.Optional;

/**
 * Storage capability the lifecycle engine is parameterised over.
 *
 * <p>
 * {@link #read()} is the lock-free fast path and may return a slightly stale set. Anything that may lead to a write
 * goes through {@link #update(Update)}, which hands the callback a freshly re-read set while exclusive access is held
 * and releases that access before returning, whatever the outcome.
 * </p>
 */
public interface TokenStore {

    Optional<TokenSet> read() throws TokensmithException;

    <T> T update(Update<T> update) throws TokensmithException;

    /**
     * View of the store while exclusive access is held.
     */
    interface Transaction {

        Optional<TokenSet> current();

        void write(TokenSet tokens) throws TokensmithException;
    }

    @FunctionalInterface
    interface Update<T> {

        T apply(Transaction transaction) throws TokensmithException;
    }
}
