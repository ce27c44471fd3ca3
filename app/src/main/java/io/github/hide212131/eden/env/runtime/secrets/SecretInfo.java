package io.github.hide212131.eden.env.runtime.secrets;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A secret as returned to callers: the value only when revealed, otherwise a stable one-way hash.
 *
 * @param name secret name
 * @param value plaintext, {@code null} unless revealed
 * @param hash first 16 hex characters of the SHA-256 of the value
 */
public record SecretInfo(String name, String value, String hash) {

    public SecretInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(hash, "hash");
    }

    public static SecretInfo of(String name, String value, boolean reveal) {
        String hash = SecretCipher.shortHash(value.getBytes(StandardCharsets.UTF_8));
        return new SecretInfo(name, reveal ? value : null, hash);
    }

    @Override
    public String toString() {
        return "SecretInfo[name=" + name + ", hash=" + hash + "]";
    }
}
