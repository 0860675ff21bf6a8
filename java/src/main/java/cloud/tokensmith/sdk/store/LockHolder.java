package cloud.tokensmith.sdk.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Diagnostic metadata the current owner writes into the lock file.
 */
record LockHolder(
    @JsonProperty("pid") long pid,
    @JsonProperty("host") String host,
    @JsonProperty("acquired_at") Instant acquiredAt
) {

    String describe() {
        return "pid " + pid + "@" + host + " since " + acquiredAt;
    }
}
