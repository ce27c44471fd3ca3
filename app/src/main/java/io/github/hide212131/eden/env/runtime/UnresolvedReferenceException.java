package io.github.hide212131.eden.env.runtime;

/**
 * A {@code {ref:name}} placeholder, or a derived function, needs the value of a variable that is
 * absent or was not staged beforehand.
 */
public class UnresolvedReferenceException extends DefinitionException {

    private final String reference;

    public UnresolvedReferenceException(String variableName, String reference, String reason) {
        super(variableName, "Variable '" + variableName + "' references '" + reference + "' which " + reason);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
