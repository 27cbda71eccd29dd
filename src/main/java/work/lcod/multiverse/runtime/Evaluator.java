package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.TokenType;
import work.lcod.multiverse.table.Table;

/**
 * Tree-walking interpreter over branch-free syntax trees. Assignments bind in the evaluator's environment.
 */
public final class Evaluator implements Node.Visitor<Object> {
    private final ExecutionContext ctx;
    private final Environment env;

    public Evaluator(ExecutionContext ctx, Environment env) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.env = Objects.requireNonNull(env, "env");
    }

    public Object evaluate(Node node) {
        try {
            return node.accept(this);
        } catch (EvaluationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new EvaluationException("at " + node.position() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Object visitLiteral(Node.Literal node) {
        return node.value();
    }

    @Override
    public Object visitIdentifier(Node.Identifier node) {
        if (env.isBound(node.name())) {
            return env.lookup(node.name());
        }
        var entry = ctx.functions().get(node.name());
        if (entry != null) {
            return new FunctionValue.HostReference(entry);
        }
        throw new EvaluationException("'" + node.name() + "' is not bound (at " + node.position() + ")");
    }

    @Override
    public Object visitListLiteral(Node.ListLiteral node) {
        var items = new ArrayList<>(node.items().size());
        for (var item : node.items()) {
            items.add(evaluate(item));
        }
        return Values.normalize(items);
    }

    @Override
    public Object visitUnary(Node.Unary node) {
        var operand = evaluate(node.operand());
        if (node.operator() == TokenType.NOT) {
            return !Values.asBoolean(operand, "'!'");
        }
        return -Values.asNumber(operand, "unary '-'");
    }

    @Override
    public Object visitBinary(Node.Binary node) {
        var operator = node.operator();
        if (operator == TokenType.AND) {
            return Values.asBoolean(evaluate(node.left()), "'&&'") && Values.asBoolean(evaluate(node.right()), "'&&'");
        }
        if (operator == TokenType.OR) {
            return Values.asBoolean(evaluate(node.left()), "'||'") || Values.asBoolean(evaluate(node.right()), "'||'");
        }
        var left = evaluate(node.left());
        var right = evaluate(node.right());
        return switch (operator) {
            case EQ -> Values.equal(left, right);
            case NE -> !Values.equal(left, right);
            case LT -> Values.compare(left, right, "'<'") < 0;
            case LE -> Values.compare(left, right, "'<='") <= 0;
            case GT -> Values.compare(left, right, "'>'") > 0;
            case GE -> Values.compare(left, right, "'>='") >= 0;
            case IN -> contains(right, left);
            case PLUS -> plus(left, right);
            case MINUS -> Values.asNumber(left, "'-'") - Values.asNumber(right, "'-'");
            case STAR -> Values.asNumber(left, "'*'") * Values.asNumber(right, "'*'");
            case SLASH -> Values.asNumber(left, "'/'") / Values.asNumber(right, "'/'");
            case PERCENT -> Values.asNumber(left, "'%'") % Values.asNumber(right, "'%'");
            default -> throw new IllegalStateException("Unexpected binary operator " + operator);
        };
    }

    private static Object plus(Object left, Object right) {
        if (left instanceof String || right instanceof String) {
            return Values.display(left) + Values.display(right);
        }
        return Values.asNumber(left, "'+'") + Values.asNumber(right, "'+'");
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof List<?> list) {
            return list.stream().anyMatch(candidate -> Values.equal(candidate, item));
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(item);
        }
        if (container instanceof Table table) {
            return item instanceof String column && table.hasColumn(column);
        }
        if (container instanceof String text) {
            return item instanceof String part && text.contains(part);
        }
        throw new EvaluationException("'in' expects a list, record, table or string but got " + Values.typeName(container));
    }

    @Override
    public Object visitMember(Node.Member node) {
        var target = evaluate(node.target());
        if (target instanceof Map<?, ?> record) {
            if (!record.containsKey(node.name())) {
                throw new EvaluationException("Record has no field '" + node.name() + "' (at " + node.position() + ")");
            }
            return record.get(node.name());
        }
        if (target instanceof Table table) {
            if (!table.hasColumn(node.name())) {
                throw new EvaluationException("Table has no column '" + node.name() + "' (at " + node.position() + ")");
            }
            return table.column(node.name());
        }
        throw new EvaluationException(
            "Cannot read '." + node.name() + "' of a " + Values.typeName(target) + " (at " + node.position() + ")"
        );
    }

    @Override
    public Object visitIndex(Node.Index node) {
        var target = evaluate(node.target());
        var index = evaluate(node.index());
        if (target instanceof List<?> list) {
            return list.get(position(index, list.size(), node));
        }
        if (target instanceof Table table) {
            return table.row(position(index, table.size(), node));
        }
        if (target instanceof Map<?, ?> record) {
            var key = Values.asString(index, "record index");
            if (!record.containsKey(key)) {
                throw new EvaluationException("Record has no field '" + key + "' (at " + node.position() + ")");
            }
            return record.get(key);
        }
        throw new EvaluationException("Cannot index a " + Values.typeName(target) + " (at " + node.position() + ")");
    }

    private static int position(Object index, int size, Node.Index node) {
        double raw = Values.asNumber(index, "index");
        if (raw != Math.rint(raw) || raw < 0 || raw >= size) {
            throw new EvaluationException(
                "Index " + Values.display(index) + " out of range 0.." + (size - 1) + " (at " + node.position() + ")"
            );
        }
        return (int) raw;
    }

    @Override
    public Object visitCall(Node.Call node) {
        Object callee;
        if (node.callee() instanceof Node.Identifier name && !env.isBound(name.name())) {
            var entry = ctx.functions().get(name.name());
            if (entry == null) {
                throw new EvaluationException("Unknown function '" + name.name() + "' (at " + node.position() + ")");
            }
            callee = new FunctionValue.HostReference(entry);
        } else {
            callee = evaluate(node.callee());
        }
        var args = new ArrayList<>(node.arguments().size());
        for (var argument : node.arguments()) {
            args.add(evaluate(argument));
        }
        return ctx.call(callee, args);
    }

    @Override
    public Object visitLambda(Node.Lambda node) {
        return new FunctionValue.Closure(node.parameters(), node.body(), env);
    }

    @Override
    public Object visitConditional(Node.Conditional node) {
        if (Values.asBoolean(evaluate(node.condition()), "if()")) {
            return evaluate(node.then());
        }
        return evaluate(node.otherwise());
    }

    @Override
    public Object visitBranch(Node.Branch node) {
        throw new IllegalStateException(
            "branch(" + node.parameter() + ") reached the evaluator without being resolved for this universe"
        );
    }

    @Override
    public Object visitAssignment(Node.Assignment node) {
        var value = evaluate(node.value());
        env.define(node.name(), value);
        return value;
    }
}
