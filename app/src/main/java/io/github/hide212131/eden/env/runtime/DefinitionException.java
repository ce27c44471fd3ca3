package io.github.hide212131.eden.env.runtime;

import java.util.List;

/**
 * マニフェスト記述ミスを表す例外。再試行しても解消しないため即座に中断する。
 */
public class DefinitionException extends EnvironmentResolutionException {

    public DefinitionException(String variableName, String message) {
        super(variableName, message);
    }

    public DefinitionException(String variableName, String message, Throwable cause) {
        super(variableName, message, cause);
    }

    @Override
    public List<String> guidance() {
        return List.of("Fix the variable definition in the manifest; this is an authoring error");
    }
}
