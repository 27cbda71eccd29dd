package work.lcod.multiverse.runtime;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution results keyed by the hash of the code they ran and the labels they ran with.
 */
public final class ResultCache {
    private final Map<Key, ExecutionResult> results = new ConcurrentHashMap<>();

    public Optional<ExecutionResult> get(String codeHash, Map<String, String> assignment) {
        return Optional.ofNullable(results.get(new Key(codeHash, assignment)));
    }

    public void put(String codeHash, ExecutionResult result) {
        results.put(new Key(codeHash, result.assignment()), result);
    }

    public int size() {
        return results.size();
    }

    public void clear() {
        results.clear();
    }

    private record Key(String codeHash, Map<String, String> assignment) {
        Key {
            assignment = Map.copyOf(assignment);
        }
    }
}
