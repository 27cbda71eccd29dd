package work.lcod.multiverse.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.multiverse.error.EvaluationException;

/**
 * Chain of variable scopes. The shared input scope is read-only; each universe works in its own child scope.
 */
public final class Environment {
    private final Environment parent;
    private final Map<String, Object> variables;
    private final boolean readOnly;

    private Environment(Environment parent, Map<String, Object> variables, boolean readOnly) {
        this.parent = parent;
        this.variables = variables;
        this.readOnly = readOnly;
    }

    /**
     * Read-only root scope. Values are frozen so no universe can change what another one sees.
     *
     * @throws IllegalArgumentException when a value is outside the interpreter's value model (arrays, arbitrary
     *     objects), since those could not be copied
     */
    public static Environment frozen(Map<String, ?> values) {
        var copy = new LinkedHashMap<String, Object>();
        if (values != null) {
            values.forEach((name, value) -> {
                if (!Values.isSupported(value)) {
                    throw new IllegalArgumentException(
                        "Input '" + name + "' has unsupported type " + value.getClass().getName()
                            + "; use numbers, strings, booleans, lists, maps or tables"
                    );
                }
                copy.put(name, Values.normalize(value));
            });
        }
        return new Environment(null, Collections.unmodifiableMap(copy), true);
    }

    public static Environment empty() {
        return frozen(Map.of());
    }

    public Environment child() {
        return new Environment(this, new LinkedHashMap<>(), false);
    }

    public boolean isBound(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    public Object lookup(String name) {
        for (var scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                return scope.variables.get(name);
            }
        }
        throw new EvaluationException("'" + name + "' is not bound");
    }

    public void define(String name, Object value) {
        if (readOnly) {
            throw new EvaluationException("Cannot assign '" + name + "' in the shared input scope");
        }
        variables.put(name, value);
    }

    /**
     * Bindings made directly in this scope, in definition order.
     */
    public Map<String, Object> locals() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    void commitTo(Environment target) {
        variables.forEach(target::define);
    }
}
