package io.github.hide212131.eden.env.runtime;

import java.util.Objects;

/** One required variable left without a value, with the reason it stayed empty. */
public record UnresolvedVariable(String name, String reason) {

    public UnresolvedVariable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reason, "reason");
    }
}
