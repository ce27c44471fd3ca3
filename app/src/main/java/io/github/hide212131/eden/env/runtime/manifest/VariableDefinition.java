package io.github.hide212131.eden.env.runtime.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One manifest entry. Names are unique ignoring case; {@link #key()} is the normalized form used
 * for lookups while {@link #name()} keeps the spelling projected into the environment.
 */
public record VariableDefinition(
        String name,
        VariableSource source,
        Map<String, Object> condition,
        String defaultValue,
        boolean required,
        List<String> groups) {

    public VariableDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        condition = condition == null || condition.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(condition));
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    public String key() {
        return normalize(name);
    }

    public boolean hasCondition() {
        return !condition.isEmpty();
    }

    public Optional<String> defaultOptional() {
        return Optional.ofNullable(defaultValue);
    }
}
