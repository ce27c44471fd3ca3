package io.github.hide212131.eden.env.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** 必須変数が解決できなかった場合の例外。最初の1件ではなく全件をまとめて報告する。 */
public class MissingRequiredValueException extends UnavailableValueException {

    private final List<UnresolvedVariable> unresolved;

    public MissingRequiredValueException(List<UnresolvedVariable> unresolved) {
        super(unresolved.isEmpty() ? null : unresolved.get(0).name(), message(unresolved));
        this.unresolved = List.copyOf(unresolved);
    }

    public List<UnresolvedVariable> unresolved() {
        return unresolved;
    }

    public List<String> names() {
        return unresolved.stream().map(UnresolvedVariable::name).toList();
    }

    @Override
    public List<String> guidance() {
        List<String> steps = new ArrayList<>();
        steps.add("Export the missing variables, add them to the selected environment / test mode overlay,"
                + " or declare defaults in the manifest");
        steps.add("Mark a variable as optional: true if the application can run without it");
        return steps;
    }

    private static String message(List<UnresolvedVariable> unresolved) {
        return unresolved.size() + " required variable(s) could not be resolved: "
                + unresolved.stream()
                        .map(item -> item.name() + " (" + item.reason() + ")")
                        .collect(Collectors.joining(", "));
    }
}
