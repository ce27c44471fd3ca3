package io.github.hide212131.eden.env.runtime.resolve;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/** 解決結果を VARIABLE / VALUE / SOURCE の表に整形する。秘匿値はマスクする。 */
public final class ConfigurationReport {

    static final int VALUE_LIMIT = 24;
    private static final String MASK_TOKEN = "****";
    private static final Set<String> SENSITIVE_FRAGMENTS = Set.of("api_key", "token", "secret", "password");

    private final boolean revealSecrets;

    public ConfigurationReport(boolean revealSecrets) {
        this.revealSecrets = revealSecrets;
    }

    public static ConfigurationReport masked() {
        return new ConfigurationReport(false);
    }

    public String render(ResolvedSet resolved) {
        Objects.requireNonNull(resolved, "resolved");
        StringBuilder out = new StringBuilder();
        out.append("Configuration sources:").append(System.lineSeparator());
        out.append("  test mode:   ").append(resolved.testMode().orElse("(none)")).append(System.lineSeparator());
        out.append("  environment: ").append(resolved.environmentName().orElse("(none)"))
                .append(System.lineSeparator());
        out.append(System.lineSeparator());

        List<StagedVariable> rows = resolved.variables().stream()
                .sorted(Comparator.comparing(StagedVariable::name))
                .toList();
        int nameWidth = "VARIABLE".length();
        int valueWidth = "VALUE".length();
        for (StagedVariable row : rows) {
            nameWidth = Math.max(nameWidth, row.name().length());
            valueWidth = Math.max(valueWidth, displayValue(row).length());
        }
        String format = "%-" + nameWidth + "s  %-" + valueWidth + "s  %s";
        out.append(String.format(Locale.ROOT, format, "VARIABLE", "VALUE", "SOURCE").stripTrailing())
                .append(System.lineSeparator());
        out.append("-".repeat(nameWidth)).append("  ").append("-".repeat(valueWidth)).append("  ")
                .append("-".repeat("SOURCE".length())).append(System.lineSeparator());
        for (StagedVariable row : rows) {
            String source = row.provenance().label() + (row.included() ? "" : " (not exported)");
            out.append(String.format(Locale.ROOT, format, row.name(), displayValue(row), source))
                    .append(System.lineSeparator());
        }
        return out.toString();
    }

    String displayValue(StagedVariable variable) {
        if (!variable.hasValue()) {
            return "(absent)";
        }
        if (!revealSecrets && (variable.secret() || isSensitiveName(variable.name()))) {
            return MASK_TOKEN;
        }
        String value = variable.value();
        if (value.length() <= VALUE_LIMIT) {
            return value;
        }
        return value.substring(0, VALUE_LIMIT - 3) + "...";
    }

    private boolean isSensitiveName(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return SENSITIVE_FRAGMENTS.stream().anyMatch(lowered::contains);
    }
}
