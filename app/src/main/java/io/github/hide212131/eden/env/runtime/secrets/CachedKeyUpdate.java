package io.github.hide212131.eden.env.runtime.secrets;

import java.util.Objects;

/**
 * @param outcome what happened to the cache
 * @param fingerprint fingerprint of the key derived from the given passphrase
 */
public record CachedKeyUpdate(CachedKeyOutcome outcome, String fingerprint) {

    public CachedKeyUpdate {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public boolean accepted() {
        return outcome != CachedKeyOutcome.INVALID;
    }
}
