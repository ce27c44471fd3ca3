package io.github.hide212131.eden.env.runtime.provider;

import java.util.Locale;

/** Why a secret provider could not return a value. Each reason has a different one-line fix. */
public enum SecretUnavailability {
    NOT_FOUND("is not stored in the %s secret manager", "eden-env secrets set %s <value>"),
    NO_SECRETS_FILE("cannot be read because no local secrets file exists",
            "eden-env secrets set-cached-key --passphrase <passphrase> && eden-env secrets set %s <value>"),
    KEY_UNAVAILABLE("cannot be decrypted because no cached key is available",
            "eden-env secrets set-cached-key --passphrase <passphrase>"),
    KEY_INVALID("cannot be decrypted because the cached key does not match the secrets file (wrong passphrase)",
            "eden-env secrets set-cached-key --passphrase <correct-passphrase>"),
    CORRUPTED("cannot be read because the secrets file decrypts to an unreadable document",
            "restore the secrets file from backup or run eden-env secrets clear --force"),
    STORE_IO_ERROR("cannot be read because the local secrets file or cached key could not be accessed",
            "check the permissions of LOCAL_SECRETS_REPO and LOCAL_SECRETS_CACHE"),
    NO_PROJECT_ID("cannot be fetched because no PROJECT_ID is configured for the %s secret manager",
            "export PROJECT_ID=<project> or select an environment that defines project_id"),
    ACCESS_DENIED("cannot be fetched because the %s secret manager denied access",
            "check the access token / service account permissions for secret %s"),
    REMOTE_ERROR("cannot be fetched because the %s secret manager did not respond successfully",
            "retry later or check network access to the secret manager");

    private final String description;
    private final String remediation;

    SecretUnavailability(String description, String remediation) {
        this.description = description;
        this.remediation = remediation;
    }

    public String describe(String provider) {
        return description.contains("%s") ? String.format(Locale.ROOT, description, provider) : description;
    }

    public String remediation(String secretName) {
        return remediation.contains("%s") ? String.format(Locale.ROOT, remediation, secretName) : remediation;
    }
}
