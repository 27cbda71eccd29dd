package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.lang.Node;

/**
 * Substitutes every {@code branch(...)} node with the expression of the option the assignment selects.
 */
public final class StepRewriter implements Node.Visitor<Node> {
    private final Map<String, Parameter> parameters;
    private final Map<String, String> assignment;

    public StepRewriter(Map<String, Parameter> parameters, Map<String, String> assignment) {
        this.parameters = Map.copyOf(parameters);
        this.assignment = Map.copyOf(assignment);
    }

    public List<Node> rewrite(List<Node> statements) {
        var rewritten = new ArrayList<Node>(statements.size());
        for (var statement : statements) {
            rewritten.add(statement.accept(this));
        }
        return List.copyOf(rewritten);
    }

    @Override
    public Node visitBranch(Node.Branch node) {
        var label = assignment.get(node.parameter());
        if (label == null) {
            throw new IllegalStateException("Parameter '" + node.parameter() + "' has no label in this universe");
        }
        var parameter = parameters.get(node.parameter());
        if (parameter == null) {
            throw new IllegalStateException("Parameter '" + node.parameter() + "' is not registered");
        }
        var option = parameter.option(label).orElseThrow(
            () -> new IllegalStateException("Parameter '" + node.parameter() + "' has no option '" + label + "'")
        );
        // option expressions are branch-free; the parser rejects nesting
        return option.expression();
    }

    @Override
    public Node visitLiteral(Node.Literal node) {
        return node;
    }

    @Override
    public Node visitIdentifier(Node.Identifier node) {
        return node;
    }

    @Override
    public Node visitListLiteral(Node.ListLiteral node) {
        return new Node.ListLiteral(rewriteAll(node.items()), node.position());
    }

    @Override
    public Node visitUnary(Node.Unary node) {
        return new Node.Unary(node.operator(), node.operand().accept(this), node.position());
    }

    @Override
    public Node visitBinary(Node.Binary node) {
        return new Node.Binary(node.operator(), node.left().accept(this), node.right().accept(this), node.position());
    }

    @Override
    public Node visitMember(Node.Member node) {
        return new Node.Member(node.target().accept(this), node.name(), node.position());
    }

    @Override
    public Node visitIndex(Node.Index node) {
        return new Node.Index(node.target().accept(this), node.index().accept(this), node.position());
    }

    @Override
    public Node visitCall(Node.Call node) {
        return new Node.Call(node.callee().accept(this), rewriteAll(node.arguments()), node.position());
    }

    @Override
    public Node visitLambda(Node.Lambda node) {
        return new Node.Lambda(node.parameters(), node.body().accept(this), node.position());
    }

    @Override
    public Node visitConditional(Node.Conditional node) {
        return new Node.Conditional(
            node.condition().accept(this),
            node.then().accept(this),
            node.otherwise().accept(this),
            node.position()
        );
    }

    @Override
    public Node visitAssignment(Node.Assignment node) {
        return new Node.Assignment(node.name(), node.value().accept(this), node.position());
    }

    private List<Node> rewriteAll(List<Node> nodes) {
        var rewritten = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            rewritten.add(node.accept(this));
        }
        return rewritten;
    }
}
