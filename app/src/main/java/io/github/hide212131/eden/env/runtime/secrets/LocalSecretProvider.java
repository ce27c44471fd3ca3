package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretProvider;
import java.util.Objects;

/** {@link SecretProvider} backed by the local encrypted store. */
public final class LocalSecretProvider implements SecretProvider {

    public static final String NAME = "local";

    private final LocalEncryptedStore store;

    public LocalSecretProvider(LocalEncryptedStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SecretLookup find(String secretName) {
        StoreResult<SecretInfo> result = store.get(secretName, true);
        if (result instanceof StoreResult.Failure<SecretInfo> failure) {
            return SecretLookup.unavailable(failure.failure().toUnavailability(), failure.message());
        }
        return SecretLookup.found(result.orElseThrow().value());
    }
}
