package work.lcod.multiverse.universe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One valid combination of option labels, keyed by parameter name in declaration order.
 */
public record Universe(int id, Map<String, String> assignment) {
    public Universe {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    public String label(String parameter) {
        return assignment.get(parameter);
    }
}
