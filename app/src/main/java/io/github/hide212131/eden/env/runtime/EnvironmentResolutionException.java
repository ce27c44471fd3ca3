package io.github.hide212131.eden.env.runtime;

import java.util.List;

/**
 * Base type for every failure that aborts a resolution pass.
 * <p>
 * Subclasses carry remediation steps through {@link #guidance()} so the CLI can print
 * something actionable instead of a bare error code.
 */
public class EnvironmentResolutionException extends RuntimeException {

    private final String variableName;

    public EnvironmentResolutionException(String variableName, String message) {
        super(message);
        this.variableName = variableName;
    }

    public EnvironmentResolutionException(String variableName, String message, Throwable cause) {
        super(message, cause);
        this.variableName = variableName;
    }

    /** Name of the variable being staged when the failure happened, or {@code null}. */
    public String variableName() {
        return variableName;
    }

    public List<String> guidance() {
        return List.of("Check the manifest and configuration files and try again");
    }
}
