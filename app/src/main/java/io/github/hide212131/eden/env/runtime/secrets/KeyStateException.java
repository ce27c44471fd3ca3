package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import java.util.List;
import java.util.Objects;

/** ストアのキャッシュ鍵とファイルの状態が操作と整合しない場合の例外。データは破棄しない。 */
public class KeyStateException extends EnvironmentResolutionException {

    private final StoreFailure failure;

    public KeyStateException(StoreFailure failure, String message) {
        super(null, "[" + failure + "] " + message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public StoreFailure failure() {
        return failure;
    }

    @Override
    public List<String> guidance() {
        return List.of(failure.remediation());
    }
}
