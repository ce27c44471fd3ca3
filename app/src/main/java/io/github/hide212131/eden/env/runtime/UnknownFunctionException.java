package io.github.hide212131.eden.env.runtime;

import java.util.Collection;
import java.util.List;

/** {@code derived:<function>} names a function that was never registered. */
public class UnknownFunctionException extends DefinitionException {

    private final String functionName;
    private final List<String> available;

    public UnknownFunctionException(String variableName, String functionName, Collection<String> available) {
        super(variableName, "Derived function '" + functionName + "' used by '" + variableName
                + "' is not registered. Available: " + available);
        this.functionName = functionName;
        this.available = List.copyOf(available);
    }

    public String functionName() {
        return functionName;
    }

    public List<String> available() {
        return available;
    }
}
