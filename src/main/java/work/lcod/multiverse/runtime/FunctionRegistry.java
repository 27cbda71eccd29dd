package work.lcod.multiverse.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores host functions by name.
 */
public final class FunctionRegistry {
    public static final int VARIADIC = Integer.MAX_VALUE;

    private final Map<String, Entry> functions = new ConcurrentHashMap<>();

    public FunctionRegistry register(String name, HostFunction fn) {
        return register(name, 0, VARIADIC, fn);
    }

    public FunctionRegistry register(String name, int arity, HostFunction fn) {
        return register(name, arity, arity, fn);
    }

    public FunctionRegistry register(String name, int minArity, int maxArity, HostFunction fn) {
        if (minArity < 0 || maxArity < minArity) {
            throw new IllegalArgumentException("Invalid arity " + minArity + ".." + maxArity + " for " + name);
        }
        functions.put(name, new Entry(name, fn, minArity, maxArity));
        return this;
    }

    public Entry get(String name) {
        return functions.get(name);
    }

    public record Entry(String name, HostFunction function, int minArity, int maxArity) {
        boolean accepts(int count) {
            return count >= minArity && count <= maxArity;
        }

        String arityDescription() {
            if (minArity == maxArity) {
                return String.valueOf(minArity);
            }
            return maxArity == VARIADIC ? "at least " + minArity : minArity + " to " + maxArity;
        }
    }
}
