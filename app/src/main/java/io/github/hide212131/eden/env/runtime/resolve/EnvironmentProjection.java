package io.github.hide212131.eden.env.runtime.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Writes the included variables of a {@link ResolvedSet} under their exact names, either into a
 * target environment map (such as {@link ProcessBuilder#environment()}) or as text a calling shell
 * can consume.
 */
public final class EnvironmentProjection {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern PLAIN_VALUE = Pattern.compile("[A-Za-z0-9_./:@%+,-]*");

    private final ResolvedSet resolved;

    public EnvironmentProjection(ResolvedSet resolved) {
        this.resolved = Objects.requireNonNull(resolved, "resolved");
    }

    public void applyTo(Map<String, String> target) {
        Objects.requireNonNull(target, "target");
        target.putAll(resolved.asEnvironment());
    }

    /** {@code export NAME='value'} lines for {@code eval "$(eden-env resolve --format export)"}. */
    public String renderExport() {
        StringBuilder out = new StringBuilder();
        resolved.asEnvironment().forEach((name, value) ->
                out.append("export ").append(name).append('=').append(shellQuote(value)).append('\n'));
        return out.toString();
    }

    /** dotenv lines; values that need it are double-quoted. */
    public String renderDotenv() {
        StringBuilder out = new StringBuilder();
        resolved.asEnvironment().forEach((name, value) ->
                out.append(name).append('=').append(dotenvQuote(value)).append('\n'));
        return out.toString();
    }

    public String renderJson() {
        try {
            return MAPPER.writeValueAsString(resolved.asEnvironment());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("JSON への変換に失敗しました: " + ex.getMessage(), ex);
        }
    }

    static String shellQuote(String value) {
        if (!value.isEmpty() && PLAIN_VALUE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    static String dotenvQuote(String value) {
        if (PLAIN_VALUE.matcher(value).matches()) {
            return value;
        }
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
