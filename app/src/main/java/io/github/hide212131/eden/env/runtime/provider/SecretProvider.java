package io.github.hide212131.eden.env.runtime.provider;

import java.util.Optional;

/**
 * Secret manager behind {@code secret:<name>} sources. Local and remote implementations are
 * interchangeable.
 */
public interface SecretProvider extends ValueProvider {

    /** Short provider name used in diagnostics, e.g. {@code local} or {@code google}. */
    String name();

    SecretLookup find(String secretName);

    @Override
    default Optional<String> lookup(String key) {
        SecretLookup lookup = find(key);
        if (lookup instanceof SecretLookup.Found found) {
            return Optional.of(found.value());
        }
        return Optional.empty();
    }
}
