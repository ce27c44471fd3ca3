package io.github.hide212131.eden.env.runtime.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plaintext of the encrypted secrets file: {@code {"secrets":[{"name":..,"value":..}]}}.
 * A flat {@code {"name":"value"}} object written by older tooling is read as well.
 */
record SecretsDocument(List<SecretRecord> secrets) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    SecretsDocument {
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
    }

    static SecretsDocument empty() {
        return new SecretsDocument(List.of());
    }

    static SecretsDocument fromJson(byte[] json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("secrets document is not a JSON object");
        }
        List<SecretRecord> records = new ArrayList<>();
        JsonNode list = root.get("secrets");
        if (list != null) {
            if (!list.isArray()) {
                throw new IOException("'secrets' is not an array");
            }
            for (JsonNode entry : list) {
                JsonNode name = entry.get("name");
                JsonNode value = entry.get("value");
                if (name == null || !name.isTextual() || value == null || value.isNull()) {
                    throw new IOException("secret entry without name or value");
                }
                records.add(new SecretRecord(name.asText(), value.asText()));
            }
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                records.add(new SecretRecord(field.getKey(), field.getValue().asText()));
            }
        }
        return new SecretsDocument(records);
    }

    byte[] toJson() throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(Map.of("secrets", secrets));
    }

    Optional<SecretRecord> find(String name) {
        return secrets.stream().filter(record -> record.name().equals(name)).findFirst();
    }

    /** Replaces an existing entry in place, or appends a new one. */
    SecretsDocument with(String name, String value) {
        List<SecretRecord> updated = new ArrayList<>(secrets);
        SecretRecord replacement = new SecretRecord(name, value);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(name)) {
                updated.set(i, replacement);
                return new SecretsDocument(updated);
            }
        }
        updated.add(replacement);
        return new SecretsDocument(updated);
    }

    SecretsDocument without(String name) {
        return new SecretsDocument(secrets.stream().filter(record -> !record.name().equals(name)).toList());
    }

    List<String> names() {
        return secrets.stream().map(SecretRecord::name).toList();
    }
}
