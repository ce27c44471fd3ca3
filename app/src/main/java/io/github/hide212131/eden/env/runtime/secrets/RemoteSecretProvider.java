package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretProvider;
import java.util.Objects;

/** {@link SecretProvider} backed by the remote secret manager. */
public final class RemoteSecretProvider implements SecretProvider {

    public static final String NAME = "google";

    private final RemoteSecretManagerClient client;

    public RemoteSecretProvider(RemoteSecretManagerClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SecretLookup find(String secretName) {
        return client.accessLatest(secretName);
    }
}
