package io.github.hide212131.eden.env.runtime.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Secret Manager REST クライアント。シークレット一覧と最新バージョンの取得のみを行う。
 * <p>
 * Transient failures (I/O errors, 429, 5xx) are retried exactly once.
 */
public final class RemoteSecretManagerClient {

    public static final String DEFAULT_BASE_URL = "https://secretmanager.googleapis.com/v1";

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteSecretManagerClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ATTEMPTS = 2;
    private static final int PAGE_SIZE = 250;

    private final String baseUrl;
    private final String projectId;
    private final AccessTokenSource tokenSource;
    private final Duration timeout;

    public RemoteSecretManagerClient(String baseUrl, String projectId, AccessTokenSource tokenSource,
            Duration timeout) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.projectId = projectId == null || projectId.isBlank() ? null : projectId.trim();
        this.tokenSource = Objects.requireNonNull(tokenSource, "tokenSource");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public SecretLookup accessLatest(String secretName) {
        Objects.requireNonNull(secretName, "secretName");
        if (projectId == null) {
            return SecretLookup.unavailable(SecretUnavailability.NO_PROJECT_ID, null);
        }
        String path = "/projects/" + encode(projectId) + "/secrets/" + encode(secretName) + "/versions/latest:access";
        Response response;
        try {
            response = getWithRetry(path, secretName);
        } catch (IOException ex) {
            return SecretLookup.unavailable(SecretUnavailability.REMOTE_ERROR, ex.getMessage());
        }
        int status = response.status();
        if (status != HttpURLConnection.HTTP_OK) {
            String detail = status == HttpURLConnection.HTTP_NOT_FOUND ? "project " + projectId : "status=" + status;
            return SecretLookup.unavailable(failureFor(status), detail);
        }
        try {
            return SecretLookup.found(decodePayload(response.body()));
        } catch (IOException ex) {
            LOGGER.warn("Secret manager returned an unreadable payload for '{}': {}", secretName, ex.getMessage());
            return SecretLookup.unavailable(SecretUnavailability.REMOTE_ERROR, ex.getMessage());
        }
    }

    /** Short names of every secret in the project, following {@code nextPageToken} until exhausted. */
    public SecretListing listSecrets() {
        if (projectId == null) {
            return SecretListing.failed(SecretUnavailability.NO_PROJECT_ID, null);
        }
        List<String> names = new ArrayList<>();
        String pageToken = null;
        do {
            String path = "/projects/" + encode(projectId) + "/secrets?pageSize=" + PAGE_SIZE
                    + (pageToken == null ? "" : "&pageToken=" + encode(pageToken));
            Response response;
            try {
                response = getWithRetry(path, "(list)");
            } catch (IOException ex) {
                return SecretListing.failed(SecretUnavailability.REMOTE_ERROR, ex.getMessage());
            }
            if (response.status() != HttpURLConnection.HTTP_OK) {
                return SecretListing.failed(failureFor(response.status()), "status=" + response.status());
            }
            JsonNode root;
            try {
                root = MAPPER.readTree(response.body());
            } catch (IOException ex) {
                return SecretListing.failed(SecretUnavailability.REMOTE_ERROR,
                        "unreadable list response: " + ex.getMessage());
            }
            for (JsonNode secret : root.path("secrets")) {
                String fullName = secret.path("name").asText("");
                if (!fullName.isEmpty()) {
                    names.add(fullName.substring(fullName.lastIndexOf('/') + 1));
                }
            }
            String next = root.path("nextPageToken").asText("");
            pageToken = next.isEmpty() ? null : next;
        } while (pageToken != null);
        LOGGER.debug("Listed {} secrets in project {}", names.size(), projectId);
        return SecretListing.listed(names);
    }

    /** Retries once on I/O errors, 429 and 5xx; rethrows the I/O error of the last attempt. */
    private Response getWithRetry(String path, String label) throws IOException {
        for (int attempt = 1; ; attempt++) {
            try {
                Response response = get(path);
                if (!isTransient(response.status()) || attempt == MAX_ATTEMPTS) {
                    return response;
                }
                LOGGER.warn("Secret manager returned {} for '{}', retrying once", response.status(), label);
            } catch (IOException ex) {
                if (attempt == MAX_ATTEMPTS) {
                    throw ex;
                }
                LOGGER.warn("Secret manager call for '{}' failed ({}), retrying once", label, ex.getMessage());
            }
        }
    }

    private static SecretUnavailability failureFor(int status) {
        if (status == HttpURLConnection.HTTP_NOT_FOUND) {
            return SecretUnavailability.NOT_FOUND;
        }
        if (status == HttpURLConnection.HTTP_UNAUTHORIZED || status == HttpURLConnection.HTTP_FORBIDDEN) {
            return SecretUnavailability.ACCESS_DENIED;
        }
        return SecretUnavailability.REMOTE_ERROR;
    }

    private Response get(String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) URI.create(baseUrl + path).toURL().openConnection();
        try {
            connection.setRequestMethod("GET");
            connection.setConnectTimeout((int) timeout.toMillis());
            connection.setReadTimeout((int) timeout.toMillis());
            connection.setRequestProperty("Accept", "application/json");
            connection.setRequestProperty("Authorization", "Bearer " + tokenSource.accessToken());
            int status = connection.getResponseCode();
            return new Response(status, readBody(connection, status));
        } finally {
            connection.disconnect();
        }
    }

    private String decodePayload(String body) throws IOException {
        JsonNode data = MAPPER.readTree(body).path("payload").path("data");
        if (!data.isTextual()) {
            throw new IOException("secret manager response has no payload.data");
        }
        try {
            return new String(Base64.getDecoder().decode(data.asText()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new IOException("payload.data is not valid Base64: " + ex.getMessage(), ex);
        }
    }

    private String readBody(HttpURLConnection connection, int statusCode) throws IOException {
        boolean success = statusCode >= 200 && statusCode < 300;
        try (InputStream stream = success ? connection.getInputStream() : connection.getErrorStream()) {
            if (stream == null) {
                return "";
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static boolean isTransient(int status) {
        return status == 429 || status >= 500;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record Response(int status, String body) {
    }
}
