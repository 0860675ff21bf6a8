package cloud.tokensmith.sdk.store;

import cloud.tokensmith.sdk.TokensmithException;
import cloud.tokensmith.sdk.auth.TokenSet;

import java.util.Objects;
import java.util.Optional;

/**
 * Single-owner cell holding the current {@link TokenSet}. Not synchronised: hosts sharing one instance between threads
 * must serialise access themselves.
 */
public final class InMemoryTokenStore implements TokenStore {

    private TokenSet current;

    public InMemoryTokenStore() {
    }

    public InMemoryTokenStore(TokenSet initial) {
        this.current = initial;
    }

    @Override
    public Optional<TokenSet> read() {
        return Optional.ofNullable(current);
    }

    @Override
    public <T> T update(Update<T> update) throws TokensmithException {
        return update.apply(new Transaction() {
            @Override
            public Optional<TokenSet> current() {
                return Optional.ofNullable(current);
            }

            @Override
            public void write(TokenSet tokens) {
                current = Objects.requireNonNull(tokens, "tokens");
            }
        });
    }
}
