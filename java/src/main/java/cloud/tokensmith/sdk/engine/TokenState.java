package cloud.tokensmith.sdk.engine;

/**
 * Lifecycle states of the primary token set as seen by one engine.
 */
public enum TokenState {
    /** Nothing has been loaded or issued yet. */
    UNINITIALIZED,
    /** The stored access token is usable. */
    VALID,
    /** A refresh call is in flight while exclusive access to the store is held. */
    REFRESH_PENDING,
    /** The refresh token is missing or expired; only a new authentication recovers. */
    EXPIRED,
    /** The last refresh or authentication call failed; the stored set was left untouched. */
    FAILED
}
