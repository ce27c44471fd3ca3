package io.github.hide212131.eden.env.runtime.provider;

import java.util.Optional;

/** Uniform lookup contract shared by every value source. */
public interface ValueProvider {

    /**
     * @param key provider-specific key (overlay key, secret name, ...)
     * @return the value, or empty when this provider has nothing for the key
     */
    Optional<String> lookup(String key);
}
