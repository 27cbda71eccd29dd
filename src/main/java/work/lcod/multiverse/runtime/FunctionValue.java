package work.lcod.multiverse.runtime;

import java.util.List;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.Renderer;

/**
 * Callable values: lambdas written in analysis code and references to host functions.
 */
public interface FunctionValue {
    String describe();

    record Closure(List<String> parameters, Node body, Environment environment) implements FunctionValue {
        public Closure {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String describe() {
            return "(" + String.join(", ", parameters) + ") -> " + Renderer.render(body);
        }

        @Override
        public String toString() {
            return "<function " + describe() + ">";
        }
    }

    record HostReference(FunctionRegistry.Entry entry) implements FunctionValue {
        @Override
        public String describe() {
            return entry.name();
        }

        @Override
        public String toString() {
            return "<function " + entry.name() + ">";
        }
    }
}
