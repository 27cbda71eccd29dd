package work.lcod.multiverse.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.runtime.HostFunction;

/**
 * Immutable configuration of a {@link Multiverse}.
 *
 * @param parallelism worker threads used by full execution
 * @param maxUniverses ceiling on the number of (partial) universes an expansion may produce
 * @param executeDefaultOnAdd whether {@link Multiverse#addCode(String)} runs the default universe
 * @param inputs read-only variables visible to every universe
 * @param functions host functions registered on top of the built-in ones
 */
public record MultiverseConfiguration(
    int parallelism,
    int maxUniverses,
    boolean executeDefaultOnAdd,
    Map<String, Object> inputs,
    Map<String, HostFunction> functions
) {
    public static final int DEFAULT_MAX_UNIVERSES = 100_000;

    public MultiverseConfiguration {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive but was " + parallelism);
        }
        if (maxUniverses < 1) {
            throw new IllegalArgumentException("maxUniverses must be positive but was " + maxUniverses);
        }
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(inputs, "inputs")));
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(functions, "functions")));
    }

    public static MultiverseConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder()
            .parallelism(parallelism)
            .maxUniverses(maxUniverses)
            .executeDefaultOnAdd(executeDefaultOnAdd);
        builder.inputs.putAll(inputs);
        builder.functions.putAll(functions);
        return builder;
    }

    public static final class Builder {
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int maxUniverses = DEFAULT_MAX_UNIVERSES;
        private boolean executeDefaultOnAdd = true;
        private final Map<String, Object> inputs = new LinkedHashMap<>();
        private final Map<String, HostFunction> functions = new LinkedHashMap<>();

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxUniverses(int maxUniverses) {
            this.maxUniverses = maxUniverses;
            return this;
        }

        public Builder executeDefaultOnAdd(boolean executeDefaultOnAdd) {
            this.executeDefaultOnAdd = executeDefaultOnAdd;
            return this;
        }

        /**
         * Adds a read-only input. Values must be {@code null}, numbers, strings, booleans, lists, maps, tables or
         * function values (nested ones included); anything else, such as arrays or plain objects, is rejected when
         * the {@link Multiverse} is created.
         */
        public Builder input(String name, Object value) {
            inputs.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder inputs(Map<String, ?> values) {
            inputs.putAll(values);
            return this;
        }

        public Builder function(String name, HostFunction function) {
            functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(function, "function"));
            return this;
        }

        public MultiverseConfiguration build() {
            return new MultiverseConfiguration(parallelism, maxUniverses, executeDefaultOnAdd, inputs, functions);
        }
    }
}
