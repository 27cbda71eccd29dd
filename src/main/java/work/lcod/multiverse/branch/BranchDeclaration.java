package work.lcod.multiverse.branch;

import java.util.List;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.Position;

/**
 * A single {@code branch(...)} occurrence found in a code fragment.
 */
public record BranchDeclaration(String parameter, List<Node.BranchOption> options, Position position) {
    public BranchDeclaration {
        options = List.copyOf(options);
    }
}
