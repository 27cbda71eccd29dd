package work.lcod.multiverse.lang;

/**
 * Visits every node of a tree in source order. Subclasses override the callbacks they care about and call
 * {@code super} to keep descending.
 */
public abstract class NodeWalker implements Node.Visitor<Void> {
    public void walk(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }

    @Override
    public Void visitLiteral(Node.Literal node) {
        return null;
    }

    @Override
    public Void visitIdentifier(Node.Identifier node) {
        return null;
    }

    @Override
    public Void visitListLiteral(Node.ListLiteral node) {
        node.items().forEach(this::walk);
        return null;
    }

    @Override
    public Void visitUnary(Node.Unary node) {
        walk(node.operand());
        return null;
    }

    @Override
    public Void visitBinary(Node.Binary node) {
        walk(node.left());
        walk(node.right());
        return null;
    }

    @Override
    public Void visitMember(Node.Member node) {
        walk(node.target());
        return null;
    }

    @Override
    public Void visitIndex(Node.Index node) {
        walk(node.target());
        walk(node.index());
        return null;
    }

    @Override
    public Void visitCall(Node.Call node) {
        walk(node.callee());
        node.arguments().forEach(this::walk);
        return null;
    }

    @Override
    public Void visitLambda(Node.Lambda node) {
        walk(node.body());
        return null;
    }

    @Override
    public Void visitConditional(Node.Conditional node) {
        walk(node.condition());
        walk(node.then());
        walk(node.otherwise());
        return null;
    }

    @Override
    public Void visitBranch(Node.Branch node) {
        for (var option : node.options()) {
            walk(option.condition());
            walk(option.expression());
        }
        return null;
    }

    @Override
    public Void visitAssignment(Node.Assignment node) {
        walk(node.value());
        return null;
    }
}
