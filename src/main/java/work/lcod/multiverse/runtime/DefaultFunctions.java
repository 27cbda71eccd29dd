package work.lcod.multiverse.runtime;

import work.lcod.multiverse.core.CorePrimitives;
import work.lcod.multiverse.core.StatsPrimitives;
import work.lcod.multiverse.core.TablePrimitives;

/**
 * Shared registry bootstrap so the API, the CLI and tests see the same built-in functions.
 */
public final class DefaultFunctions {
    private DefaultFunctions() {}

    public static FunctionRegistry create() {
        var registry = new FunctionRegistry();
        CorePrimitives.register(registry);
        TablePrimitives.register(registry);
        StatsPrimitives.register(registry);
        return registry;
    }
}
