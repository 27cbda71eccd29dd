package work.lcod.multiverse.universe;

import java.util.Map;
import work.lcod.multiverse.branch.Option;

/**
 * Decides whether an option is eligible given the options already chosen for earlier parameters, keyed by
 * parameter name.
 */
@FunctionalInterface
public interface Guard {
    boolean admits(Option option, Map<String, Option> chosen);

    static Guard unconditional() {
        return (option, chosen) -> true;
    }
}
