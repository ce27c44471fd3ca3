package io.github.hide212131.eden.env.runtime.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/** Fetches an access token from the cloud metadata server of the current host. */
public final class MetadataServerTokenSource implements AccessTokenSource {

    public static final String DEFAULT_ENDPOINT =
            "http://metadata.google.internal/computeMetadata/v1/instance/service-accounts/default/token";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Duration timeout;

    public MetadataServerTokenSource(URI endpoint, Duration timeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String accessToken() throws IOException {
        HttpURLConnection connection = (HttpURLConnection) endpoint.toURL().openConnection();
        try {
            connection.setRequestMethod("GET");
            connection.setConnectTimeout((int) timeout.toMillis());
            connection.setReadTimeout((int) timeout.toMillis());
            connection.setRequestProperty("Metadata-Flavor", "Google");
            int status = connection.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                throw new IOException("metadata server returned status " + status);
            }
            try (InputStream stream = connection.getInputStream()) {
                JsonNode token = MAPPER.readTree(stream).get("access_token");
                if (token == null || !token.isTextual()) {
                    throw new IOException("metadata server response has no access_token");
                }
                return token.asText();
            }
        } finally {
            connection.disconnect();
        }
    }
}
