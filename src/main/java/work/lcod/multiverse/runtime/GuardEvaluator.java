package work.lcod.multiverse.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.branch.Option;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.universe.Guard;

/**
 * Evaluates {@code %when%} conditions. Each already assigned parameter is bound to the literal of its chosen
 * label, so {@code k == 1} matches an option labelled {@code 1} and {@code k == "a"} one labelled {@code a}.
 */
public final class GuardEvaluator implements Guard {
    private final FunctionRegistry functions;

    public GuardEvaluator(FunctionRegistry functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    @Override
    public boolean admits(Option option, Map<String, Option> chosen) {
        if (!option.isConditional()) {
            return true;
        }
        var values = new LinkedHashMap<String, Object>();
        var labels = new LinkedHashMap<String, String>();
        chosen.forEach((name, earlier) -> {
            values.put(name, earlier.labelValue());
            labels.put(name, earlier.label());
        });
        var scope = Environment.frozen(values);
        var ctx = new ExecutionContext(functions, 0, labels);
        var result = new Evaluator(ctx, scope.child()).evaluate(option.condition());
        if (result instanceof Boolean admitted) {
            return admitted;
        }
        throw new EvaluationException(
            "Condition of option '" + option.label() + "' of parameter '" + option.parameter()
                + "' must evaluate to a boolean but got " + Values.typeName(result) + " (" + option.conditionSource() + ")"
        );
    }
}
