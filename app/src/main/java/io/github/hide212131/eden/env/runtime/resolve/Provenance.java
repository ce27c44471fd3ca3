package io.github.hide212131.eden.env.runtime.resolve;

/** Which source supplied a staged value. */
public enum Provenance {
    PROCESS_ENVIRONMENT("process-environment"),
    TEST_MODE_OVERRIDE("test-mode-override"),
    ENVIRONMENT_CONFIG("environment-config"),
    SECRET_STORE("secret-store"),
    DERIVED("derived"),
    APP_IDENTITY("app-identity"),
    DEFAULT("default"),
    CONDITION_NOT_MET("condition-not-met"),
    UNRESOLVED("unresolved");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
