package io.github.hide212131.eden.env.runtime.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** 派生関数の名前付きレジストリ。リフレクションは使わず、起動時に明示的に登録する。 */
public final class DerivedFunctionRegistry {

    private final Map<String, DerivedFunction> functions = new LinkedHashMap<>();

    /** Registry pre-populated with the built-in functions. */
    public static DerivedFunctionRegistry withBuiltins() {
        DerivedFunctionRegistry registry = new DerivedFunctionRegistry();
        registry.register(BuiltinDerivedFunctions.apiUrl());
        return registry;
    }

    public DerivedFunctionRegistry register(DerivedFunction function) {
        Objects.requireNonNull(function, "function");
        if (functions.putIfAbsent(function.name(), function) != null) {
            throw new IllegalArgumentException("派生関数が重複登録されています: " + function.name());
        }
        return this;
    }

    public Optional<DerivedFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
