package work.lcod.multiverse.branch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.multiverse.error.InconsistentBranchDefinitionException;
import work.lcod.multiverse.error.UnknownParameterReferenceException;
import work.lcod.multiverse.lang.FreeVariables;

/**
 * Global parameter table. Grows by atomic merges: a merge either applies every declaration of a fragment or
 * leaves the registry untouched. First-seen order is preserved and drives both condition evaluation and the
 * default universe.
 */
public final class ParameterRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ParameterRegistry.class);

    private volatile List<Parameter> parameters = List.of();
    private volatile long version;

    public List<Parameter> parameters() {
        return parameters;
    }

    public Optional<Parameter> find(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    /**
     * Incremented on every merge that changed the table.
     */
    public long version() {
        return version;
    }

    /**
     * Validates the declarations against the current table and commits them together.
     *
     * @return {@code true} when parameters or options were added
     */
    public synchronized boolean merge(List<BranchDeclaration> declarations, int stepIndex) {
        var staged = prepare(declarations, stepIndex);
        if (staged.equals(parameters)) {
            return false;
        }
        parameters = staged;
        version++;
        LOG.debug("Parameter registry at version {}: {} parameter(s)", version, staged.size());
        return true;
    }

    /**
     * Computes the merged table without committing it; throws on the first conflict.
     */
    private List<Parameter> prepare(List<BranchDeclaration> declarations, int stepIndex) {
        var staged = new LinkedHashMap<String, Parameter>();
        for (var parameter : parameters) {
            staged.put(parameter.name(), parameter);
        }
        for (var declaration : declarations) {
            var name = declaration.parameter();
            var existing = staged.get(name);
            if (existing == null) {
                existing = new Parameter(name, List.of(), stepIndex);
                staged.put(name, existing);
            }
            for (var declared : declaration.options()) {
                var option = new Option(name, declared.label(), declared.labelValue(), declared.expression(), declared.condition());
                var known = existing.option(option.label());
                if (known.isPresent()) {
                    if (!known.get().definition().equals(option.definition())) {
                        throw new InconsistentBranchDefinitionException(
                            name,
                            option.label(),
                            known.get().definition(),
                            option.definition()
                        );
                    }
                    continue;
                }
                checkConditionReferences(staged, option);
                existing = existing.withOption(option);
                staged.put(name, existing);
            }
        }
        return List.copyOf(staged.values());
    }

    private static void checkConditionReferences(Map<String, Parameter> staged, Option option) {
        if (!option.isConditional()) {
            return;
        }
        var order = new ArrayList<>(staged.keySet());
        int ownIndex = order.indexOf(option.parameter());
        for (var reference : FreeVariables.of(option.condition())) {
            int index = order.indexOf(reference);
            if (index < 0) {
                throw new UnknownParameterReferenceException(
                    option.parameter(), option.label(), reference, "no such parameter has been declared yet"
                );
            }
            if (index == ownIndex) {
                throw new UnknownParameterReferenceException(
                    option.parameter(), option.label(), reference, "a condition cannot reference its own parameter"
                );
            }
            if (index > ownIndex) {
                throw new UnknownParameterReferenceException(
                    option.parameter(),
                    option.label(),
                    reference,
                    "parameter '" + reference + "' is declared after '" + option.parameter() + "'"
                );
            }
        }
    }
}
