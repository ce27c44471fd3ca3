package io.github.hide212131.eden.env.runtime.provider;

import io.github.hide212131.eden.env.runtime.UnresolvedReferenceException;
import io.github.hide212131.eden.env.runtime.manifest.VariableDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of the inputs a derived function declared. Reading anything else fails, so a
 * function can never observe a variable the resolver has not staged yet.
 */
public final class StagedValues {

    private final String variableName;
    private final String functionName;
    private final Map<String, String> values;

    /**
     * @param values staged inputs keyed by normalized name; an absent input maps to {@code null}
     */
    public StagedValues(String variableName, String functionName, Map<String, String> values) {
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<String> get(String name) {
        String key = VariableDefinition.normalize(name);
        if (!values.containsKey(key)) {
            throw new UnresolvedReferenceException(variableName, name,
                    "was not declared as an input of derived function '" + functionName + "'");
        }
        return Optional.ofNullable(values.get(key));
    }

    public boolean isTrue(String name) {
        return get(name).map(value -> "true".equalsIgnoreCase(value.trim())).orElse(false);
    }
}
