package io.github.hide212131.eden.env.runtime;

import java.util.List;

/**
 * No provider produced a value and no default exists. The operator can usually fix this
 * without touching the manifest, so subclasses always carry concrete remediation steps.
 */
public abstract class UnavailableValueException extends EnvironmentResolutionException {

    protected UnavailableValueException(String variableName, String message) {
        super(variableName, message);
    }

    @Override
    public abstract List<String> guidance();
}
