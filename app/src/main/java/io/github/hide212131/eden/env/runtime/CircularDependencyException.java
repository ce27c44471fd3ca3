package io.github.hide212131.eden.env.runtime;

import java.util.List;

/** Conditions, placeholders or derived inputs form a cycle. */
public class CircularDependencyException extends EnvironmentResolutionException {

    private final List<String> cycle;

    public CircularDependencyException(String variableName, List<String> cycle) {
        super(variableName, "Circular dependency detected while staging '" + variableName + "': "
                + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Names along the cycle, starting and ending with the re-entered variable. */
    public List<String> cycle() {
        return cycle;
    }

    @Override
    public List<String> guidance() {
        return List.of("Break the cycle by removing one of the condition or {ref:...} links: "
                + String.join(" -> ", cycle));
    }
}
