package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.error.EvaluationException;

/**
 * Execution context passed to host functions. Identifies the universe being evaluated and lets host functions
 * call back into function values (lambdas or other host functions).
 */
public final class ExecutionContext {
    static final int MAX_CALL_DEPTH = 200;

    private final FunctionRegistry functions;
    private final int universeId;
    private final Map<String, String> assignment;
    private int depth;

    public ExecutionContext(FunctionRegistry functions, int universeId, Map<String, String> assignment) {
        this.functions = Objects.requireNonNull(functions, "functions");
        this.universeId = universeId;
        this.assignment = assignment == null ? Map.of() : Map.copyOf(assignment);
    }

    public FunctionRegistry functions() {
        return functions;
    }

    /**
     * Id of the universe being executed, or {@code 0} while conditions are evaluated during expansion.
     */
    public int universeId() {
        return universeId;
    }

    public Map<String, String> assignment() {
        return assignment;
    }

    /**
     * Calls a function value with already-evaluated arguments.
     */
    public Object call(Object function, List<?> args) {
        var callable = Values.asFunction(function, "call");
        var normalized = new ArrayList<Object>(args.size());
        for (var arg : args) {
            normalized.add(Values.normalize(arg));
        }
        if (callable instanceof FunctionValue.Closure closure) {
            return invokeClosure(closure, normalized);
        }
        if (callable instanceof FunctionValue.HostReference reference) {
            return invokeHost(reference.entry(), normalized);
        }
        throw new EvaluationException("Unsupported function value " + callable.describe());
    }

    /**
     * Calls a registered host function by name.
     */
    public Object call(String name, List<?> args) {
        var entry = functions.get(name);
        if (entry == null) {
            throw new EvaluationException("Unknown function '" + name + "'");
        }
        return call(new FunctionValue.HostReference(entry), args);
    }

    Object invokeHost(FunctionRegistry.Entry entry, List<Object> args) {
        if (!entry.accepts(args.size())) {
            throw new EvaluationException(
                entry.name() + "() takes " + entry.arityDescription() + " argument(s) but got " + args.size()
            );
        }
        enter();
        try {
            return Values.normalize(entry.function().invoke(this, Collections.unmodifiableList(args)));
        } catch (EvaluationException ex) {
            throw ex;
        } catch (Exception ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            throw new EvaluationException(entry.name() + "(): " + message, ex);
        } finally {
            depth--;
        }
    }

    Object invokeClosure(FunctionValue.Closure closure, List<Object> args) {
        if (closure.parameters().size() != args.size()) {
            throw new EvaluationException(
                "Function " + closure.describe() + " takes " + closure.parameters().size()
                    + " argument(s) but got " + args.size()
            );
        }
        var scope = closure.environment().child();
        for (int i = 0; i < args.size(); i++) {
            scope.define(closure.parameters().get(i), args.get(i));
        }
        enter();
        try {
            return new Evaluator(this, scope).evaluate(closure.body());
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > MAX_CALL_DEPTH) {
            depth--;
            throw new EvaluationException("Call depth exceeded " + MAX_CALL_DEPTH + " (runaway recursion?)");
        }
    }
}
