package io.github.hide212131.eden.env.runtime.manifest;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import io.github.hide212131.eden.env.runtime.UndefinedVariableException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Ordered, immutable set of variable definitions plus named groups of them. */
public final class Manifest {

    private final List<VariableDefinition> definitions;
    private final Map<String, VariableDefinition> byKey;
    private final Map<String, List<String>> groups;

    public Manifest(List<VariableDefinition> definitions, Map<String, List<String>> declaredGroups) {
        Objects.requireNonNull(definitions, "definitions");
        Map<String, VariableDefinition> index = new LinkedHashMap<>();
        for (VariableDefinition definition : definitions) {
            VariableDefinition previous = index.putIfAbsent(definition.key(), definition);
            if (previous != null) {
                throw new ManifestFormatException("変数名が重複しています (大文字小文字は区別しません): "
                        + previous.name() + " / " + definition.name());
            }
        }
        this.definitions = List.copyOf(definitions);
        this.byKey = Collections.unmodifiableMap(index);
        this.groups = Collections.unmodifiableMap(buildGroups(declaredGroups));
    }

    public static Manifest of(VariableDefinition... definitions) {
        return new Manifest(List.of(definitions), Map.of());
    }

    public List<VariableDefinition> definitions() {
        return definitions;
    }

    public Optional<VariableDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(VariableDefinition.normalize(name)));
    }

    public VariableDefinition require(String name, String referencedBy) {
        return find(name).orElseThrow(() -> new UndefinedVariableException(name, referencedBy));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public List<String> group(String groupName) {
        return groups.getOrDefault(groupName.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Expands variable and group names into definitions, keeping manifest order. Group names take
     * precedence over variable names.
     */
    public List<VariableDefinition> select(Collection<String> names) {
        Set<String> keys = new LinkedHashSet<>();
        for (String name : names) {
            List<String> members = groups.get(name.toLowerCase(Locale.ROOT));
            if (members != null) {
                members.forEach(member -> keys.add(VariableDefinition.normalize(member)));
            } else {
                keys.add(require(name, null).key());
            }
        }
        List<VariableDefinition> selected = new ArrayList<>();
        for (VariableDefinition definition : definitions) {
            if (keys.contains(definition.key())) {
                selected.add(definition);
            }
        }
        return selected;
    }

    private Map<String, List<String>> buildGroups(Map<String, List<String>> declaredGroups) {
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        if (declaredGroups != null) {
            declaredGroups.forEach((group, members) -> {
                Set<String> target = merged.computeIfAbsent(group.toLowerCase(Locale.ROOT),
                        ignored -> new LinkedHashSet<>());
                for (String member : members) {
                    target.add(require(member, "group:" + group).name());
                }
            });
        }
        for (VariableDefinition definition : definitions) {
            for (String group : definition.groups()) {
                merged.computeIfAbsent(group.toLowerCase(Locale.ROOT), ignored -> new LinkedHashSet<>())
                        .add(definition.name());
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        merged.forEach((group, members) -> result.put(group, List.copyOf(members)));
        return result;
    }
}
