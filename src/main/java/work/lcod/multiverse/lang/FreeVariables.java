package work.lcod.multiverse.lang;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the names an expression reads from its environment. Lambda parameters are bound locally and names used
 * directly as call targets are function references, so neither is reported.
 */
public final class FreeVariables extends NodeWalker {
    private final Set<String> names = new LinkedHashSet<>();
    private final Deque<List<String>> bound = new ArrayDeque<>();

    private FreeVariables() {}

    public static Set<String> of(Node node) {
        var collector = new FreeVariables();
        collector.walk(node);
        return collector.names;
    }

    @Override
    public Void visitIdentifier(Node.Identifier node) {
        if (bound.stream().noneMatch(scope -> scope.contains(node.name()))) {
            names.add(node.name());
        }
        return null;
    }

    @Override
    public Void visitCall(Node.Call node) {
        if (!(node.callee() instanceof Node.Identifier)) {
            walk(node.callee());
        }
        node.arguments().forEach(this::walk);
        return null;
    }

    @Override
    public Void visitLambda(Node.Lambda node) {
        bound.push(node.parameters());
        try {
            walk(node.body());
        } finally {
            bound.pop();
        }
        return null;
    }
}
