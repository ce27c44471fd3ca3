package io.github.hide212131.eden.env.runtime.secrets;

/** Result of {@link LocalEncryptedStore#setCachedKey(String)}. */
public enum CachedKeyOutcome {
    /** No secrets file yet; the cache was written. */
    NEW,
    /** The passphrase derives the key that is already cached; the file was not re-checked. */
    NO_CHANGE,
    /** No key was cached; the new key decrypts the file and was cached. */
    VALID_SET,
    /** A different key was cached; the new key decrypts the file and replaced it. */
    VALID_CHANGE,
    /** The new key cannot decrypt the file; the cache was left untouched. */
    INVALID
}
