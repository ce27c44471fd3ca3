package io.github.hide212131.eden.env.runtime;

/** A condition entry cannot be evaluated, e.g. its expected value is a list or a map. */
public class ConditionEvaluationException extends DefinitionException {

    public ConditionEvaluationException(String variableName, String message) {
        super(variableName, message);
    }
}
