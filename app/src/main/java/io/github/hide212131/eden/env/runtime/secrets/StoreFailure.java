package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;

/** Why a local store operation could not complete. Each failure has its own one-line fix. */
public enum StoreFailure {
    NOT_FOUND("eden-env secrets list", SecretUnavailability.NOT_FOUND),
    NO_SECRETS_FILE("eden-env secrets set <name> <value>", SecretUnavailability.NO_SECRETS_FILE),
    KEY_UNAVAILABLE("eden-env secrets set-cached-key --passphrase <passphrase>", SecretUnavailability.KEY_UNAVAILABLE),
    KEY_INVALID("eden-env secrets set-cached-key --passphrase <correct-passphrase>", SecretUnavailability.KEY_INVALID),
    CORRUPTED("eden-env secrets clear --force (all stored secrets are lost)", SecretUnavailability.CORRUPTED),
    IO_ERROR("check file permissions of the secrets file and the key cache directory",
            SecretUnavailability.STORE_IO_ERROR);

    private final String remediation;
    private final SecretUnavailability unavailability;

    StoreFailure(String remediation, SecretUnavailability unavailability) {
        this.remediation = remediation;
        this.unavailability = unavailability;
    }

    public String remediation() {
        return remediation;
    }

    public SecretUnavailability toUnavailability() {
        return unavailability;
    }
}
