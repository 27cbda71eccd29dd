package work.lcod.multiverse.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.runtime.ExecutionContext;
import work.lcod.multiverse.runtime.FunctionRegistry;
import work.lcod.multiverse.runtime.Values;
import work.lcod.multiverse.table.Table;

/**
 * Value helpers available to every analysis: arithmetic, strings, lists and records.
 */
public final class CorePrimitives {
    private CorePrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("abs", 1, (ctx, args) -> Math.abs(number(args, 0, "abs")));
        registry.register("sqrt", 1, (ctx, args) -> Math.sqrt(number(args, 0, "sqrt")));
        registry.register("exp", 1, (ctx, args) -> Math.exp(number(args, 0, "exp")));
        registry.register("floor", 1, (ctx, args) -> Math.floor(number(args, 0, "floor")));
        registry.register("ceiling", 1, (ctx, args) -> Math.ceil(number(args, 0, "ceiling")));
        registry.register("pow", 2, (ctx, args) -> Math.pow(number(args, 0, "pow"), number(args, 1, "pow")));
        registry.register("log", 1, 2, CorePrimitives::log);
        registry.register("round", 1, 2, CorePrimitives::round);
        registry.register("min", 1, FunctionRegistry.VARIADIC, (ctx, args) -> extreme(args, "min", -1));
        registry.register("max", 1, FunctionRegistry.VARIADIC, (ctx, args) -> extreme(args, "max", 1));
        registry.register("sum", 1, (ctx, args) -> sum(numbers(args.get(0), "sum")));

        registry.register("length", 1, CorePrimitives::length);
        registry.register("paste", (ctx, args) -> join(args, " "));
        registry.register("paste0", (ctx, args) -> join(args, ""));
        registry.register("upper", 1, (ctx, args) -> Values.asString(args.get(0), "upper()").toUpperCase(Locale.ROOT));
        registry.register("lower", 1, (ctx, args) -> Values.asString(args.get(0), "lower()").toLowerCase(Locale.ROOT));
        registry.register("number", 1, CorePrimitives::toNumber);
        registry.register("string", 1, (ctx, args) -> Values.display(args.get(0)));
        registry.register("is_null", 1, (ctx, args) -> args.get(0) == null);

        registry.register("seq", 2, 3, CorePrimitives::seq);
        registry.register("concat", CorePrimitives::concat);
        registry.register("map", 2, CorePrimitives::map);
        registry.register("keep", 2, CorePrimitives::keep);
        registry.register("record", CorePrimitives::record);
        registry.register("stop", 1, CorePrimitives::stop);
        return registry;
    }

    static double number(List<Object> args, int index, String function) {
        return Values.asNumber(args.get(index), function + "()");
    }

    /**
     * Numbers of a list (or a single number). Used by the aggregations here and in {@link StatsPrimitives}.
     */
    static List<Double> numbers(Object value, String function) {
        if (value instanceof Number number) {
            return List.of(number.doubleValue());
        }
        var list = Values.asList(value, function + "()");
        var numbers = new ArrayList<Double>(list.size());
        for (var item : list) {
            numbers.add(Values.asNumber(item, function + "() element"));
        }
        return numbers;
    }

    static double sum(List<Double> values) {
        double total = 0;
        for (var value : values) {
            total += value;
        }
        return total;
    }

    private static Object log(ExecutionContext ctx, List<Object> args) {
        double x = number(args, 0, "log");
        if (args.size() == 1) {
            return Math.log(x);
        }
        return Math.log(x) / Math.log(number(args, 1, "log"));
    }

    private static Object round(ExecutionContext ctx, List<Object> args) {
        double x = number(args, 0, "round");
        int digits = args.size() > 1 ? (int) number(args, 1, "round") : 0;
        double scale = Math.pow(10, digits);
        return Math.round(x * scale) / scale;
    }

    private static Object extreme(List<Object> args, String function, int sign) {
        var values = new ArrayList<Double>();
        for (var arg : args) {
            values.addAll(numbers(arg, function));
        }
        if (values.isEmpty()) {
            throw new EvaluationException(function + "() of an empty list");
        }
        double best = values.get(0);
        for (var value : values) {
            if (Double.compare(value, best) * sign > 0) {
                best = value;
            }
        }
        return best;
    }

    private static Object length(ExecutionContext ctx, List<Object> args) {
        var value = args.get(0);
        if (value instanceof List<?> list) {
            return list.size();
        }
        if (value instanceof String text) {
            return text.length();
        }
        if (value instanceof Table table) {
            return table.size();
        }
        if (value instanceof Map<?, ?> record) {
            return record.size();
        }
        throw new EvaluationException("length() does not apply to a " + Values.typeName(value));
    }

    private static String join(List<Object> args, String separator) {
        return args.stream().map(Values::display).collect(Collectors.joining(separator));
    }

    private static Object toNumber(ExecutionContext ctx, List<Object> args) {
        var value = args.get(0);
        if (value instanceof Number) {
            return value;
        }
        var text = Values.asString(value, "number()").trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new EvaluationException("number(): '" + text + "' is not a number", ex);
        }
    }

    private static Object seq(ExecutionContext ctx, List<Object> args) {
        double from = number(args, 0, "seq");
        double to = number(args, 1, "seq");
        double by = args.size() > 2 ? number(args, 2, "seq") : (from <= to ? 1 : -1);
        if (by == 0 || (to - from) * by < 0) {
            throw new EvaluationException("seq(): step " + Values.display(by) + " never reaches " + Values.display(to));
        }
        var values = new ArrayList<Double>();
        long count = (long) Math.floor((to - from) / by + 1e-9) + 1;
        for (long i = 0; i < count; i++) {
            values.add(from + i * by);
        }
        return values;
    }

    private static Object concat(ExecutionContext ctx, List<Object> args) {
        var joined = new ArrayList<Object>();
        for (var arg : args) {
            if (arg instanceof List<?> list) {
                joined.addAll(list);
            } else {
                joined.add(arg);
            }
        }
        return joined;
    }

    private static Object map(ExecutionContext ctx, List<Object> args) {
        var list = Values.asList(args.get(0), "map()");
        var mapped = new ArrayList<Object>(list.size());
        for (var item : list) {
            mapped.add(ctx.call(args.get(1), Collections.singletonList(item)));
        }
        return mapped;
    }

    private static Object keep(ExecutionContext ctx, List<Object> args) {
        var list = Values.asList(args.get(0), "keep()");
        var kept = new ArrayList<Object>();
        for (var item : list) {
            if (Values.asBoolean(ctx.call(args.get(1), Collections.singletonList(item)), "keep() predicate")) {
                kept.add(item);
            }
        }
        return kept;
    }

    private static Object record(ExecutionContext ctx, List<Object> args) {
        if (args.size() % 2 != 0) {
            throw new EvaluationException("record() expects name/value pairs but got " + args.size() + " argument(s)");
        }
        var record = new LinkedHashMap<String, Object>();
        for (int i = 0; i < args.size(); i += 2) {
            record.put(Values.asString(args.get(i), "record() field name"), args.get(i + 1));
        }
        return record;
    }

    private static Object stop(ExecutionContext ctx, List<Object> args) {
        throw new EvaluationException(Values.display(args.get(0)));
    }
}
