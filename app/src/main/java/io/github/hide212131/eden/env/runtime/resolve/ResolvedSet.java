package io.github.hide212131.eden.env.runtime.resolve;

import io.github.hide212131.eden.env.runtime.manifest.VariableDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Immutable outcome of one resolution pass, in manifest order. */
public final class ResolvedSet {

    private final List<StagedVariable> variables;
    private final Map<String, StagedVariable> byKey;
    private final String environmentName;
    private final String testMode;

    ResolvedSet(List<StagedVariable> variables, String environmentName, String testMode) {
        this.variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
        Map<String, StagedVariable> index = new LinkedHashMap<>();
        this.variables.forEach(variable -> index.put(VariableDefinition.normalize(variable.name()), variable));
        this.byKey = Collections.unmodifiableMap(index);
        this.environmentName = environmentName;
        this.testMode = testMode;
    }

    /** Every staged variable, including condition inputs that are not projected. */
    public List<StagedVariable> variables() {
        return variables;
    }

    /** Variables projected into the process environment: included and carrying a value. */
    public List<StagedVariable> included() {
        return variables.stream().filter(StagedVariable::included).filter(StagedVariable::hasValue).toList();
    }

    public Optional<StagedVariable> variable(String name) {
        return Optional.ofNullable(byKey.get(VariableDefinition.normalize(name)));
    }

    public Optional<String> value(String name) {
        return variable(name).flatMap(StagedVariable::valueOptional);
    }

    /** Exact-name map of the included variables. */
    public Map<String, String> asEnvironment() {
        Map<String, String> environment = new LinkedHashMap<>();
        included().forEach(variable -> environment.put(variable.name(), variable.value()));
        return Collections.unmodifiableMap(environment);
    }

    public Optional<String> environmentName() {
        return Optional.ofNullable(environmentName);
    }

    public Optional<String> testMode() {
        return Optional.ofNullable(testMode);
    }
}
