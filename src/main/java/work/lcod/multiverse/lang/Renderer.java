package work.lcod.multiverse.lang;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints syntax trees back to canonical source. Two trees with the same meaning render identically, which is how
 * option definitions are compared and how per-universe code is shown.
 */
public final class Renderer implements Node.Visitor<String> {
    private static final Renderer INSTANCE = new Renderer();

    private Renderer() {}

    public static String render(Node node) {
        return node == null ? "true" : node.accept(INSTANCE);
    }

    public static String render(List<Node> statements) {
        return statements.stream().map(Renderer::render).collect(Collectors.joining("\n"));
    }

    public static String formatNumber(Double value) {
        double d = value;
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    public static String quote(String value) {
        var builder = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\r' -> builder.append("\\r");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }

    @Override
    public String visitLiteral(Node.Literal node) {
        Object value = node.value();
        if (value == null) {
            return "null";
        }
        if (value instanceof Double number) {
            return formatNumber(number);
        }
        if (value instanceof String text) {
            return quote(text);
        }
        return String.valueOf(value);
    }

    @Override
    public String visitIdentifier(Node.Identifier node) {
        return node.name();
    }

    @Override
    public String visitListLiteral(Node.ListLiteral node) {
        return "[" + joined(node.items()) + "]";
    }

    @Override
    public String visitUnary(Node.Unary node) {
        String symbol = node.operator() == TokenType.NOT ? "!" : "-";
        return symbol + wrap(node.operand(), precedence(node), false);
    }

    @Override
    public String visitBinary(Node.Binary node) {
        int own = precedence(node);
        boolean comparison = own == 4;
        return wrap(node.left(), own, comparison) + " " + symbol(node.operator()) + " " + wrap(node.right(), own, true);
    }

    @Override
    public String visitMember(Node.Member node) {
        return wrap(node.target(), 8, false) + "." + node.name();
    }

    @Override
    public String visitIndex(Node.Index node) {
        return wrap(node.target(), 8, false) + "[" + render(node.index()) + "]";
    }

    @Override
    public String visitCall(Node.Call node) {
        return wrap(node.callee(), 8, false) + "(" + joined(node.arguments()) + ")";
    }

    @Override
    public String visitLambda(Node.Lambda node) {
        String params = node.parameters().size() == 1
            ? node.parameters().get(0)
            : "(" + String.join(", ", node.parameters()) + ")";
        return params + " -> " + render(node.body());
    }

    @Override
    public String visitConditional(Node.Conditional node) {
        return "if(" + render(node.condition()) + ", " + render(node.then()) + ", " + render(node.otherwise()) + ")";
    }

    @Override
    public String visitBranch(Node.Branch node) {
        var builder = new StringBuilder("branch(").append(node.parameter());
        for (var option : node.options()) {
            builder.append(", ").append(renderOption(option));
        }
        return builder.append(')').toString();
    }

    @Override
    public String visitAssignment(Node.Assignment node) {
        return node.name() + " <- " + render(node.value());
    }

    public static String renderOption(Node.BranchOption option) {
        var builder = new StringBuilder(renderLabel(option.label(), option.labelValue()));
        if (option.condition() != null) {
            builder.append(" %when% ").append(render(option.condition()));
        }
        return builder.append(" ~ ").append(render(option.expression())).toString();
    }

    /**
     * Label as it is written in a branch: strings quoted, numbers and booleans in their source spelling.
     */
    public static String renderLabel(String label, Object labelValue) {
        return labelValue instanceof String ? quote(label) : label;
    }

    private String joined(List<Node> nodes) {
        return nodes.stream().map(Renderer::render).collect(Collectors.joining(", "));
    }

    private String wrap(Node child, int parentPrecedence, boolean parenthesizeEqual) {
        int childPrecedence = precedence(child);
        String text = render(child);
        if (childPrecedence < parentPrecedence || (parenthesizeEqual && childPrecedence == parentPrecedence)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static int precedence(Node node) {
        if (node instanceof Node.Lambda) {
            return 0;
        }
        if (node instanceof Node.Unary unary) {
            return unary.operator() == TokenType.NOT ? 3 : 7;
        }
        if (node instanceof Node.Binary binary) {
            return switch (binary.operator()) {
                case OR -> 1;
                case AND -> 2;
                case EQ, NE, LT, LE, GT, GE, IN -> 4;
                case PLUS, MINUS -> 5;
                default -> 6;
            };
        }
        return 9;
    }

    private static String symbol(TokenType operator) {
        return switch (operator) {
            case OR -> "||";
            case AND -> "&&";
            case EQ -> "==";
            case NE -> "!=";
            case LT -> "<";
            case LE -> "<=";
            case GT -> ">";
            case GE -> ">=";
            case IN -> "in";
            case PLUS -> "+";
            case MINUS -> "-";
            case STAR -> "*";
            case SLASH -> "/";
            case PERCENT -> "%";
            default -> throw new IllegalArgumentException("Not a binary operator: " + operator);
        };
    }
}
