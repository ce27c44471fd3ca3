package io.github.hide212131.eden.env.runtime.resolve;

import java.util.Objects;
import java.util.Optional;

/**
 * Final state of one variable after staging.
 *
 * @param name manifest spelling of the variable name
 * @param value resolved value, {@code null} when absent
 * @param provenance where the value came from
 * @param included whether the variable is projected into the process environment
 * @param secret whether the value came from a secret source (masked in reports)
 */
public record StagedVariable(String name, String value, Provenance provenance, boolean included, boolean secret) {

    public StagedVariable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provenance, "provenance");
    }

    public Optional<String> valueOptional() {
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        return value != null;
    }

    StagedVariable withIncluded(boolean include) {
        return new StagedVariable(name, value, provenance, include, secret);
    }

    @Override
    public String toString() {
        String shown = value == null ? "<absent>" : secret ? "****" : value;
        return "StagedVariable[name=" + name + ", value=" + shown + ", provenance=" + provenance.label()
                + ", included=" + included + "]";
    }
}
