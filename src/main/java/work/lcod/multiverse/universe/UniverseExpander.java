package work.lcod.multiverse.universe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.multiverse.branch.Option;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.error.NoValidUniverseException;
import work.lcod.multiverse.error.UniverseLimitExceededException;

/**
 * Computes the valid universes of a parameter table. Parameters are attached in declaration order and partial
 * assignments whose options are all rejected are dropped, so pruned subtrees are never instantiated.
 */
public final class UniverseExpander {
    private static final Logger LOG = LoggerFactory.getLogger(UniverseExpander.class);

    private final Guard guard;
    private final int maxUniverses;

    public UniverseExpander(Guard guard, int maxUniverses) {
        this.guard = Objects.requireNonNull(guard, "guard");
        if (maxUniverses < 1) {
            throw new IllegalArgumentException("maxUniverses must be positive");
        }
        this.maxUniverses = maxUniverses;
    }

    /**
     * Returns the valid universes with ids {@code 1..n} in generation order.
     *
     * @throws NoValidUniverseException when every combination is pruned
     * @throws UniverseLimitExceededException when the frontier grows past the configured ceiling
     */
    public List<Universe> expand(List<Parameter> parameters) {
        List<Map<String, Option>> frontier = new ArrayList<>();
        frontier.add(new LinkedHashMap<>());
        for (var parameter : parameters) {
            var next = new ArrayList<Map<String, Option>>();
            for (var partial : frontier) {
                for (var option : parameter.options()) {
                    if (!guard.admits(option, partial)) {
                        continue;
                    }
                    var extended = new LinkedHashMap<>(partial);
                    extended.put(parameter.name(), option);
                    next.add(extended);
                    if (next.size() > maxUniverses) {
                        throw new UniverseLimitExceededException(maxUniverses, parameter.name(), next.size());
                    }
                }
            }
            if (next.isEmpty()) {
                throw new NoValidUniverseException(
                    "No option of parameter '" + parameter.name() + "' is eligible in any universe; every combination is excluded"
                );
            }
            LOG.trace("Attached '{}': {} partial universe(s)", parameter.name(), next.size());
            frontier = next;
        }
        var universes = new ArrayList<Universe>(frontier.size());
        for (int i = 0; i < frontier.size(); i++) {
            universes.add(new Universe(i + 1, labels(frontier.get(i))));
        }
        return List.copyOf(universes);
    }

    /**
     * First valid universe in option order, found depth-first without expanding the others. Always equal to
     * universe 1 of {@link #expand(List)}.
     */
    public Optional<Universe> defaultUniverse(List<Parameter> parameters) {
        var chosen = new LinkedHashMap<String, Option>();
        if (!descend(parameters, 0, chosen)) {
            return Optional.empty();
        }
        return Optional.of(new Universe(1, labels(chosen)));
    }

    private boolean descend(List<Parameter> parameters, int depth, LinkedHashMap<String, Option> chosen) {
        if (depth == parameters.size()) {
            return true;
        }
        var parameter = parameters.get(depth);
        for (var option : parameter.options()) {
            if (!guard.admits(option, chosen)) {
                continue;
            }
            chosen.put(parameter.name(), option);
            if (descend(parameters, depth + 1, chosen)) {
                return true;
            }
            chosen.remove(parameter.name());
        }
        return false;
    }

    private static Map<String, String> labels(Map<String, Option> chosen) {
        var assignment = new LinkedHashMap<String, String>();
        chosen.forEach((name, option) -> assignment.put(name, option.label()));
        return assignment;
    }
}
