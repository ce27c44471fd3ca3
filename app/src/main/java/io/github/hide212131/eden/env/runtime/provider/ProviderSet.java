package io.github.hide212131.eden.env.runtime.provider;

import java.util.Objects;

/** The providers one resolution pass dispatches to. */
public record ProviderSet(
        StaticConfigProvider staticConfig,
        SecretProvider secrets,
        ApplicationIdentityProvider applicationIdentity,
        DerivedFunctionRegistry derivedFunctions) {

    public ProviderSet {
        Objects.requireNonNull(staticConfig, "staticConfig");
        Objects.requireNonNull(secrets, "secrets");
        Objects.requireNonNull(applicationIdentity, "applicationIdentity");
        Objects.requireNonNull(derivedFunctions, "derivedFunctions");
    }
}
