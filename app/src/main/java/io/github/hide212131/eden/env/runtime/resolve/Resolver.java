package io.github.hide212131.eden.env.runtime.resolve;

import io.github.hide212131.eden.env.runtime.CircularDependencyException;
import io.github.hide212131.eden.env.runtime.DefinitionException;
import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import io.github.hide212131.eden.env.runtime.MissingRequiredValueException;
import io.github.hide212131.eden.env.runtime.ResolutionAlreadyPerformedException;
import io.github.hide212131.eden.env.runtime.SecretUnavailableException;
import io.github.hide212131.eden.env.runtime.UnknownFunctionException;
import io.github.hide212131.eden.env.runtime.UnresolvedReferenceException;
import io.github.hide212131.eden.env.runtime.UnresolvedVariable;
import io.github.hide212131.eden.env.runtime.manifest.Manifest;
import io.github.hide212131.eden.env.runtime.manifest.VariableDefinition;
import io.github.hide212131.eden.env.runtime.manifest.VariableSource;
import io.github.hide212131.eden.env.runtime.provider.DerivedFunction;
import io.github.hide212131.eden.env.runtime.provider.ProviderSet;
import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import io.github.hide212131.eden.env.runtime.provider.StagedValues;
import io.github.hide212131.eden.env.runtime.provider.StaticConfigProvider;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages every manifest variable depth-first and produces one {@link ResolvedSet}.
 * <p>
 * An instance is a resolution session: it snapshots the process environment when constructed and
 * may resolve exactly once. Precedence is process environment, then test-mode overlay, then
 * environment overlay, then the declared default.
 */
@SuppressWarnings("PMD.GodClass")
public final class Resolver {

    static final Pattern REFERENCE = Pattern.compile("\\{ref:([A-Za-z0-9_.-]+)\\}");

    private static final Logger LOGGER = LoggerFactory.getLogger(Resolver.class);

    private final Manifest manifest;
    private final ProviderSet providers;
    private final Map<String, String> processEnvironment;

    private final Map<String, StagedVariable> staged = new LinkedHashMap<>();
    private final Map<String, String> missingReasons = new LinkedHashMap<>();
    private final Set<String> inProgress = new LinkedHashSet<>();
    private boolean performed;

    public Resolver(Manifest manifest, ProviderSet providers) {
        this(manifest, providers, System.getenv());
    }

    public Resolver(Manifest manifest, ProviderSet providers, Map<String, String> processEnvironment) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.providers = Objects.requireNonNull(providers, "providers");
        this.processEnvironment = Map.copyOf(Objects.requireNonNull(processEnvironment, "processEnvironment"));
    }

    public ResolvedSet resolve() {
        return resolve(List.of());
    }

    /**
     * @param selection variable or group names; empty resolves the whole manifest
     * @throws ResolutionAlreadyPerformedException when this resolver has already run
     */
    public ResolvedSet resolve(Collection<String> selection) {
        Objects.requireNonNull(selection, "selection");
        if (performed) {
            throw new ResolutionAlreadyPerformedException();
        }
        performed = true;

        validateDefinitions();
        List<VariableDefinition> targets = selection.isEmpty() ? manifest.definitions() : manifest.select(selection);
        for (VariableDefinition target : targets) {
            stage(target, true);
        }
        checkCompleteness();

        List<StagedVariable> ordered = new ArrayList<>();
        for (VariableDefinition definition : manifest.definitions()) {
            StagedVariable variable = staged.get(definition.key());
            if (variable != null) {
                ordered.add(variable);
            }
        }
        ResolvedSet result = new ResolvedSet(ordered,
                providers.staticConfig().environment().name(),
                providers.staticConfig().testMode().name());
        LOGGER.info("Resolved {} variables ({} projected)", ordered.size(), result.included().size());
        return result;
    }

    private void validateDefinitions() {
        for (VariableDefinition definition : manifest.definitions()) {
            definition.condition().forEach((key, expected) -> {
                manifest.require(key, definition.name());
                ConditionMatcher.validateExpected(definition.name(), key, expected);
            });
            if (definition.defaultValue() != null) {
                for (String reference : references(definition.defaultValue())) {
                    manifest.require(reference, definition.name());
                }
            }
            if (definition.source() instanceof VariableSource.Derived derived) {
                DerivedFunction function = providers.derivedFunctions().find(derived.function())
                        .orElseThrow(() -> new UnknownFunctionException(definition.name(), derived.function(),
                                providers.derivedFunctions().names()));
                for (String input : function.inputs()) {
                    manifest.require(input, definition.name());
                }
            }
        }
    }

    private StagedVariable stage(VariableDefinition definition, boolean include) {
        String key = definition.key();
        StagedVariable existing = staged.get(key);
        if (existing != null) {
            if (include && !existing.included() && existing.provenance() != Provenance.CONDITION_NOT_MET) {
                StagedVariable promoted = existing.withIncluded(true);
                staged.put(key, promoted);
                return promoted;
            }
            return existing;
        }

        String override = processEnvironment.get(definition.name());
        if (override != null) {
            LOGGER.debug("{}: taken from the process environment", definition.name());
            return store(key, new StagedVariable(definition.name(), override, Provenance.PROCESS_ENVIRONMENT,
                    true, false));
        }

        if (!inProgress.add(definition.name())) {
            throw new CircularDependencyException(definition.name(), cyclePath(definition.name()));
        }
        try {
            Optional<String> unmet = evaluateCondition(definition);
            if (unmet.isPresent()) {
                LOGGER.debug("{}: condition not met ({})", definition.name(), unmet.get());
                if (definition.required()) {
                    missingReasons.put(key, "condition not met: " + unmet.get());
                }
                return store(key, new StagedVariable(definition.name(), null, Provenance.CONDITION_NOT_MET, false,
                        false));
            }
            return store(key, dispatch(definition, include));
        } finally {
            inProgress.remove(definition.name());
        }
    }

    private StagedVariable store(String key, StagedVariable variable) {
        staged.put(key, variable);
        return variable;
    }

    /** @return description of the first failed condition entry, or empty when all entries hold */
    private Optional<String> evaluateCondition(VariableDefinition definition) {
        for (Map.Entry<String, Object> entry : definition.condition().entrySet()) {
            StagedVariable dependency = stage(manifest.require(entry.getKey(), definition.name()), false);
            if (!ConditionMatcher.matches(entry.getValue(), dependency.value())) {
                String actual = dependency.hasValue()
                        ? (dependency.secret() ? "<secret>" : dependency.value())
                        : "<absent>";
                return Optional.of(dependency.name() + " expected " + ConditionMatcher.canonical(entry.getValue())
                        + " but was " + actual);
            }
        }
        return Optional.empty();
    }

    private StagedVariable dispatch(VariableDefinition definition, boolean include) {
        VariableSource source = definition.source();
        String name = definition.name();
        boolean secret = source instanceof VariableSource.Secret;
        String value = null;
        Provenance provenance = Provenance.UNRESOLVED;
        String reason;

        if (source instanceof VariableSource.StaticConfig staticConfig) {
            Optional<StaticConfigProvider.StaticValue> found = providers.staticConfig().find(staticConfig.key());
            if (found.isPresent()) {
                value = found.get().value();
                provenance = found.get().layer() == StaticConfigProvider.Layer.TEST_MODE
                        ? Provenance.TEST_MODE_OVERRIDE
                        : Provenance.ENVIRONMENT_CONFIG;
            }
            reason = "no value for static key '" + staticConfig.key() + "' in the selected overlays";
        } else if (source instanceof VariableSource.Secret secretSource) {
            SecretLookup lookup = providers.secrets().find(secretSource.name());
            if (lookup instanceof SecretLookup.Found found) {
                value = found.value();
                provenance = Provenance.SECRET_STORE;
                reason = null;
            } else {
                SecretLookup.Unavailable unavailable = (SecretLookup.Unavailable) lookup;
                if (definition.defaultValue() == null) {
                    return unavailableSecret(definition, secretSource, unavailable, include);
                }
                LOGGER.debug("{}: secret unavailable ({}), falling back to the default", name,
                        unavailable.reason());
                reason = "secret " + unavailable.reason();
            }
        } else if (source instanceof VariableSource.AppIdentity) {
            Optional<String> id = providers.applicationIdentity().applicationId();
            if (id.isPresent()) {
                value = id.get();
                provenance = Provenance.APP_IDENTITY;
            }
            reason = "no application id is configured";
        } else {
            VariableSource.Derived derived = (VariableSource.Derived) source;
            Optional<String> computed = derive(definition, derived);
            if (computed.isPresent()) {
                value = computed.get();
                provenance = Provenance.DERIVED;
            }
            reason = "derived function '" + derived.function() + "' produced no value";
        }

        if (value != null) {
            value = expand(name, value);
        } else if (definition.defaultValue() != null) {
            value = expand(name, definition.defaultValue());
            provenance = Provenance.DEFAULT;
            secret = false;
        } else if (definition.required()) {
            missingReasons.put(definition.key(), reason + " and no default is declared");
        }
        LOGGER.debug("{}: {}", name, value == null ? "absent" : provenance.label());
        return new StagedVariable(name, value, provenance, include, secret);
    }

    private StagedVariable unavailableSecret(VariableDefinition definition, VariableSource.Secret source,
            SecretLookup.Unavailable unavailable, boolean include) {
        if (!definition.required() && unavailable.reason() == SecretUnavailability.NOT_FOUND) {
            LOGGER.debug("{}: optional secret '{}' is not stored", definition.name(), source.name());
            return new StagedVariable(definition.name(), null, Provenance.UNRESOLVED, include, true);
        }
        throw new SecretUnavailableException(definition.name(), source.name(), providers.secrets().name(),
                unavailable.reason(), unavailable.detail());
    }

    private Optional<String> derive(VariableDefinition definition, VariableSource.Derived derived) {
        DerivedFunction function = providers.derivedFunctions().find(derived.function())
                .orElseThrow(() -> new UnknownFunctionException(definition.name(), derived.function(),
                        providers.derivedFunctions().names()));
        Map<String, String> inputs = new LinkedHashMap<>();
        for (String input : function.inputs()) {
            StagedVariable dependency = stage(manifest.require(input, definition.name()), false);
            inputs.put(VariableDefinition.normalize(input), dependency.value());
        }
        try {
            return function.apply(new StagedValues(definition.name(), function.name(), inputs));
        } catch (EnvironmentResolutionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DefinitionException(definition.name(),
                    "Derived function '" + function.name() + "' failed for '" + definition.name() + "': "
                            + ex.getMessage(), ex);
        }
    }

    private String expand(String variableName, String value) {
        Matcher matcher = REFERENCE.matcher(value);
        if (!matcher.find()) {
            return value;
        }
        StringBuilder expanded = new StringBuilder();
        do {
            String reference = matcher.group(1);
            StagedVariable dependency = stage(manifest.require(reference, variableName), false);
            if (!dependency.hasValue()) {
                throw new UnresolvedReferenceException(variableName, reference,
                        "has no value (" + dependency.provenance().label() + ")");
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(dependency.value()));
        } while (matcher.find());
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    private void checkCompleteness() {
        List<UnresolvedVariable> unresolved = new ArrayList<>();
        for (VariableDefinition definition : manifest.definitions()) {
            StagedVariable variable = staged.get(definition.key());
            if (variable == null || variable.hasValue() || !definition.required()) {
                continue;
            }
            String reason = missingReasons.getOrDefault(definition.key(), "no value");
            unresolved.add(new UnresolvedVariable(definition.name(), reason));
        }
        if (!unresolved.isEmpty()) {
            throw new MissingRequiredValueException(unresolved);
        }
    }

    private List<String> cyclePath(String reentered) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String name : inProgress) {
            if (name.equals(reentered)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(name);
            }
        }
        path.add(reentered);
        return path;
    }

    static List<String> references(String value) {
        List<String> references = new ArrayList<>();
        Matcher matcher = REFERENCE.matcher(value);
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return references;
    }
}
