package work.lcod.multiverse.code;

import java.util.List;
import java.util.Objects;
import work.lcod.multiverse.lang.Node;

/**
 * One appended fragment: its position in the store, the raw text and the parsed statements.
 */
public record CodeStep(int index, String source, List<Node> statements) {
    public CodeStep {
        Objects.requireNonNull(source, "source");
        statements = List.copyOf(statements);
    }
}
