package io.github.hide212131.eden.env.runtime.secrets;

import java.util.Objects;

/** 設定で与えられた固定トークン。 */
public final class StaticAccessTokenSource implements AccessTokenSource {

    private final String token;

    public StaticAccessTokenSource(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String accessToken() {
        return token;
    }
}
