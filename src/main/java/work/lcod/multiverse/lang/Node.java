package work.lcod.multiverse.lang;

import java.util.List;
import java.util.Objects;

/**
 * Syntax tree of analysis code. Trees are immutable; rewriting produces new nodes.
 */
public interface Node {
    Position position();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal node);

        R visitIdentifier(Identifier node);

        R visitListLiteral(ListLiteral node);

        R visitUnary(Unary node);

        R visitBinary(Binary node);

        R visitMember(Member node);

        R visitIndex(Index node);

        R visitCall(Call node);

        R visitLambda(Lambda node);

        R visitConditional(Conditional node);

        R visitBranch(Branch node);

        R visitAssignment(Assignment node);
    }

    record Literal(Object value, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Identifier(String name, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record ListLiteral(List<Node> items, Position position) implements Node {
        public ListLiteral {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLiteral(this);
        }
    }

    record Unary(TokenType operator, Node operand, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Binary(TokenType operator, Node left, Node right, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Member(Node target, String name, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }

    record Index(Node target, Node index, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    record Call(Node callee, List<Node> arguments, Position position) implements Node {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Lambda(List<String> parameters, Node body, Position position) implements Node {
        public Lambda {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    /** Lazy {@code if(condition, then, otherwise)}. */
    record Conditional(Node condition, Node then, Node otherwise, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /** A decision point: {@code branch(parameter, label [%when% condition] ~ expression, ...)}. */
    record Branch(String parameter, List<BranchOption> options, Position position) implements Node {
        public Branch {
            Objects.requireNonNull(parameter, "parameter");
            options = List.copyOf(options);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBranch(this);
        }
    }

    /**
     * One option of a branch. {@code label} is the label's source text (decoded for string labels) and
     * {@code labelValue} the value of the label literal: a string, a number or a boolean. {@code condition} is
     * {@code null} when the option is always eligible.
     */
    record BranchOption(String label, Object labelValue, Node condition, Node expression, Position position) {
        public BranchOption {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(labelValue, "labelValue");
            Objects.requireNonNull(expression, "expression");
        }
    }

    record Assignment(String name, Node value, Position position) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }
}
