package work.lcod.multiverse.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.error.UniverseExecutionException;

/**
 * Outcome of running every step of one universe. {@code bindings} holds the variables bound by the steps that
 * completed; {@code failure} is set when a step failed.
 */
public record ExecutionResult(
    int universeId,
    Map<String, String> assignment,
    Map<String, Object> bindings,
    int completedSteps,
    UniverseExecutionException failure
) {
    public enum Status { SUCCESS, FAILED }

    public ExecutionResult {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(assignment, "assignment")));
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(bindings, "bindings")));
    }

    public Status status() {
        return failure == null ? Status.SUCCESS : Status.FAILED;
    }

    public boolean succeeded() {
        return failure == null;
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public Object value(String name) {
        return bindings.get(name);
    }

    /**
     * Same result reported under another universe id, used when a cached run is served after renumbering.
     */
    public ExecutionResult withUniverseId(int id) {
        if (id == universeId) {
            return this;
        }
        return new ExecutionResult(id, assignment, bindings, completedSteps, failure == null ? null : failure.withUniverseId(id));
    }
}
