package io.github.hide212131.eden.env.runtime.provider;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Named pure function computing a value from other variables.
 *
 * @param name registry name used as {@code derived:<name>}
 * @param inputs variables staged before the function runs
 * @param body computation; an empty result means "no value"
 */
public record DerivedFunction(String name, List<String> inputs, Function<StagedValues, Optional<String>> body) {

    public DerivedFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public Optional<String> apply(StagedValues values) {
        Optional<String> result = body.apply(values);
        return result == null ? Optional.empty() : result;
    }
}
