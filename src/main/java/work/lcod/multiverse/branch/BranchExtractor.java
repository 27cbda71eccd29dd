package work.lcod.multiverse.branch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.multiverse.error.DuplicateOptionLabelException;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.NodeWalker;

/**
 * Finds branch declarations in parsed statements, in source order, without evaluating any option.
 */
public final class BranchExtractor extends NodeWalker {
    private final List<BranchDeclaration> declarations = new ArrayList<>();

    private BranchExtractor() {}

    public static List<BranchDeclaration> extract(List<Node> statements) {
        var extractor = new BranchExtractor();
        statements.forEach(extractor::walk);
        return List.copyOf(extractor.declarations);
    }

    @Override
    public Void visitBranch(Node.Branch node) {
        var seen = new HashSet<String>();
        for (var option : node.options()) {
            if (!seen.add(option.label())) {
                throw new DuplicateOptionLabelException(node.parameter(), option.label());
            }
        }
        declarations.add(new BranchDeclaration(node.parameter(), node.options(), node.position()));
        return super.visitBranch(node);
    }
}
