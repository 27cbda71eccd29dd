package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.lang.Renderer;
import work.lcod.multiverse.table.Table;

/**
 * Value conversions shared by the interpreter and host functions.
 */
public final class Values {
    private Values() {}

    /**
     * Deep copy into the interpreter's value model: every number becomes a {@link Double}, lists and maps become
     * unmodifiable copies. Other objects pass through untouched.
     */
    public static Object normalize(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(normalize(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Table table) {
            var rows = new ArrayList<Map<String, Object>>(table.size());
            for (var row : table.rows()) {
                var cells = new LinkedHashMap<String, Object>();
                row.forEach((column, cell) -> cells.put(column, normalize(cell)));
                rows.add(cells);
            }
            return new Table(table.columns(), rows);
        }
        return value;
    }

    /**
     * Whether the value belongs to the interpreter's value model, nested lists, records and table cells included.
     */
    public static boolean isSupported(Object value) {
        if (value == null || value instanceof Number || value instanceof String || value instanceof Boolean
            || value instanceof FunctionValue) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().allMatch(Values::isSupported);
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(Values::isSupported);
        }
        if (value instanceof Table table) {
            return table.rows().stream().allMatch(row -> row.values().stream().allMatch(Values::isSupported));
        }
        return false;
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double) {
            return "number";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "record";
        }
        if (value instanceof Table) {
            return "table";
        }
        if (value instanceof FunctionValue) {
            return "function";
        }
        return value.getClass().getSimpleName();
    }

    public static double asNumber(Object value, String context) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new EvaluationException(context + " expects a number but got " + typeName(value));
    }

    public static boolean asBoolean(Object value, String context) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new EvaluationException(context + " expects a boolean but got " + typeName(value));
    }

    public static String asString(Object value, String context) {
        if (value instanceof String text) {
            return text;
        }
        throw new EvaluationException(context + " expects a string but got " + typeName(value));
    }

    public static List<?> asList(Object value, String context) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new EvaluationException(context + " expects a list but got " + typeName(value));
    }

    public static Table asTable(Object value, String context) {
        if (value instanceof Table table) {
            return table;
        }
        throw new EvaluationException(context + " expects a table but got " + typeName(value));
    }

    public static FunctionValue asFunction(Object value, String context) {
        if (value instanceof FunctionValue function) {
            return function;
        }
        throw new EvaluationException(context + " expects a function but got " + typeName(value));
    }

    public static boolean equal(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right, String context) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        throw new EvaluationException(
            context + " cannot compare " + typeName(left) + " with " + typeName(right)
        );
    }

    /**
     * Text form used by string concatenation and {@code paste}.
     */
    public static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double number) {
            return Renderer.formatNumber(number);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Values::display).collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }
}
