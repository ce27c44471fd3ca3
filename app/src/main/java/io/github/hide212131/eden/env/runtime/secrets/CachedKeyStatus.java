package io.github.hide212131.eden.env.runtime.secrets;

import java.nio.file.Path;
import java.util.Objects;

/** キャッシュ鍵の有無とフィンガープリント。鍵そのものは保持しない。 */
public record CachedKeyStatus(boolean present, String fingerprint, Path cacheFile) {

    public CachedKeyStatus {
        Objects.requireNonNull(cacheFile, "cacheFile");
    }

    static CachedKeyStatus absent(Path cacheFile) {
        return new CachedKeyStatus(false, null, cacheFile);
    }
}
