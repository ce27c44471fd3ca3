package io.github.hide212131.eden.env.runtime;

/** A condition, placeholder, derived input or selection names a variable the manifest does not define. */
public class UndefinedVariableException extends DefinitionException {

    private final String referencedBy;

    public UndefinedVariableException(String variableName, String referencedBy) {
        super(variableName, message(variableName, referencedBy));
        this.referencedBy = referencedBy;
    }

    public String referencedBy() {
        return referencedBy;
    }

    private static String message(String variableName, String referencedBy) {
        if (referencedBy == null) {
            return "Variable '" + variableName + "' is not defined in the manifest";
        }
        return "Variable '" + variableName + "' referenced by '" + referencedBy + "' is not defined in the manifest";
    }
}
