package io.github.hide212131.eden.env.runtime;

/** manifest / overlay YAML の形式が不正な場合の例外。 */
public class ManifestFormatException extends DefinitionException {

    public ManifestFormatException(String message) {
        super(null, message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
