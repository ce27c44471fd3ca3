package io.github.hide212131.eden.env.runtime;

import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import java.util.List;
import java.util.Objects;

/** A {@code secret:} variable has no provider value and no default. */
public class SecretUnavailableException extends UnavailableValueException {

    private final String secretName;
    private final String provider;
    private final SecretUnavailability reason;

    public SecretUnavailableException(String variableName, String secretName, String provider,
            SecretUnavailability reason, String detail) {
        super(variableName, message(variableName, secretName, provider, reason, detail));
        this.secretName = Objects.requireNonNull(secretName, "secretName");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String secretName() {
        return secretName;
    }

    public String provider() {
        return provider;
    }

    public SecretUnavailability reason() {
        return reason;
    }

    @Override
    public List<String> guidance() {
        return List.of(
                "Override it for this run: export " + variableName() + "=<value>",
                "Or declare a default for " + variableName() + " in the manifest",
                "Or make the secret available: " + reason.remediation(secretName));
    }

    private static String message(String variableName, String secretName, String provider,
            SecretUnavailability reason, String detail) {
        String base = "Secret '" + secretName + "' for variable '" + variableName + "' " + reason.describe(provider);
        return detail == null || detail.isBlank() ? base : base + " (" + detail + ")";
    }
}
