package io.github.hide212131.eden.env.runtime.resolve;

import io.github.hide212131.eden.env.runtime.ConditionEvaluationException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 条件値の比較。両辺を同じ正規形に揃えてから文字列比較する。
 * <p>
 * Booleans and the strings {@code true}/{@code false} (any case) become lower-case
 * {@code true}/{@code false}. A numeric expected value matches any actual value with the same
 * decimal value ({@code 1.0} matches {@code 1}); other strings compare exactly.
 */
final class ConditionMatcher {

    private ConditionMatcher() {
    }

    static void validateExpected(String variableName, String conditionKey, Object expected) {
        if (expected == null) {
            throw new ConditionEvaluationException(variableName,
                    "Condition '" + conditionKey + "' of '" + variableName + "' has no expected value");
        }
        if (expected instanceof Map<?, ?> || expected instanceof List<?>) {
            throw new ConditionEvaluationException(variableName, "Condition '" + conditionKey + "' of '"
                    + variableName + "' must compare against a scalar, got: " + expected);
        }
    }

    static boolean matches(Object expected, String actual) {
        if (actual == null) {
            return false;
        }
        if (expected instanceof Number number) {
            Optional<BigDecimal> left = decimal(number.toString());
            Optional<BigDecimal> right = decimal(actual);
            if (left.isPresent() && right.isPresent()) {
                return left.get().compareTo(right.get()) == 0;
            }
        }
        return canonical(expected).equals(canonical(actual));
    }

    private static Optional<BigDecimal> decimal(String text) {
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    static String canonical(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        String text = String.valueOf(value);
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        return text;
    }
}
