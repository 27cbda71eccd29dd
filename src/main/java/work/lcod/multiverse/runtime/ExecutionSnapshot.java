package work.lcod.multiverse.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.code.CodeStep;

/**
 * Immutable view of the code and parameters an execution pass works from. Universes running in parallel share
 * one snapshot and nothing else.
 */
public record ExecutionSnapshot(
    String codeHash,
    List<CodeStep> steps,
    List<Parameter> parameters,
    Environment inputs,
    FunctionRegistry functions
) {
    public ExecutionSnapshot {
        Objects.requireNonNull(codeHash, "codeHash");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(functions, "functions");
        steps = List.copyOf(steps);
        parameters = List.copyOf(parameters);
    }

    public Map<String, Parameter> parametersByName() {
        var byName = new LinkedHashMap<String, Parameter>();
        for (var parameter : parameters) {
            byName.put(parameter.name(), parameter);
        }
        return byName;
    }
}
