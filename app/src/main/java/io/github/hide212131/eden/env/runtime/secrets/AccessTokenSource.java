package io.github.hide212131.eden.env.runtime.secrets;

import java.io.IOException;

/** Supplies the bearer token for remote secret manager calls. */
public interface AccessTokenSource {

    String accessToken() throws IOException;
}
