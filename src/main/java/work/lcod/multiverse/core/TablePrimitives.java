package work.lcod.multiverse.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.runtime.ExecutionContext;
import work.lcod.multiverse.runtime.FunctionRegistry;
import work.lcod.multiverse.runtime.Values;
import work.lcod.multiverse.table.Table;

/**
 * Table verbs. Row functions receive each row as a record; every verb returns a new table.
 */
public final class TablePrimitives {
    private TablePrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("as_table", 1, TablePrimitives::asTable);
        registry.register("nrow", 1, (ctx, args) -> table(args, "nrow").size());
        registry.register("ncol", 1, (ctx, args) -> table(args, "ncol").columns().size());
        registry.register("columns", 1, (ctx, args) -> table(args, "columns").columns());
        registry.register("column", 2, (ctx, args) -> column(table(args, "column"), Values.asString(args.get(1), "column()")));
        registry.register("filter", 2, TablePrimitives::filter);
        registry.register("mutate", 3, TablePrimitives::mutate);
        registry.register("select", 2, FunctionRegistry.VARIADIC, TablePrimitives::select);
        registry.register("arrange", 2, 3, TablePrimitives::arrange);
        registry.register("head", 2, TablePrimitives::head);
        return registry;
    }

    private static Table table(List<Object> args, String function) {
        return Values.asTable(args.get(0), function + "()");
    }

    private static List<Object> column(Table table, String name) {
        if (!table.hasColumn(name)) {
            throw new EvaluationException("Table has no column '" + name + "'; columns are " + table.columns());
        }
        return table.column(name);
    }

    /**
     * Builds a table from a list of records; columns are the union of record fields in first-seen order.
     */
    private static Object asTable(ExecutionContext ctx, List<Object> args) {
        if (args.get(0) instanceof Table table) {
            return table;
        }
        var records = Values.asList(args.get(0), "as_table()");
        var columns = new LinkedHashSet<String>();
        var rows = new ArrayList<Map<String, Object>>(records.size());
        for (var item : records) {
            if (!(item instanceof Map<?, ?> record)) {
                throw new EvaluationException("as_table() expects a list of records but found a " + Values.typeName(item));
            }
            var row = new LinkedHashMap<String, Object>();
            record.forEach((key, value) -> row.put(String.valueOf(key), value));
            columns.addAll(row.keySet());
            rows.add(row);
        }
        return new Table(new ArrayList<>(columns), rows);
    }

    private static Object filter(ExecutionContext ctx, List<Object> args) {
        var table = table(args, "filter");
        var rows = new ArrayList<Map<String, Object>>();
        for (var row : table.rows()) {
            if (Values.asBoolean(ctx.call(args.get(1), List.of(row)), "filter() predicate")) {
                rows.add(row);
            }
        }
        return new Table(table.columns(), rows);
    }

    private static Object mutate(ExecutionContext ctx, List<Object> args) {
        var table = table(args, "mutate");
        var name = Values.asString(args.get(1), "mutate() column name");
        var columns = new ArrayList<>(table.columns());
        if (!columns.contains(name)) {
            columns.add(name);
        }
        var rows = new ArrayList<Map<String, Object>>(table.size());
        for (var row : table.rows()) {
            var updated = new LinkedHashMap<>(row);
            updated.put(name, ctx.call(args.get(2), List.of(row)));
            rows.add(updated);
        }
        return new Table(columns, rows);
    }

    private static Object select(ExecutionContext ctx, List<Object> args) {
        var table = table(args, "select");
        var names = new ArrayList<String>();
        for (var arg : args.subList(1, args.size())) {
            if (arg instanceof List<?> list) {
                list.forEach(item -> names.add(Values.asString(item, "select() column name")));
            } else {
                names.add(Values.asString(arg, "select() column name"));
            }
        }
        var rows = new ArrayList<Map<String, Object>>(table.size());
        for (var row : table.rows()) {
            var selected = new LinkedHashMap<String, Object>();
            for (var name : names) {
                if (!table.hasColumn(name)) {
                    throw new EvaluationException("Table has no column '" + name + "'; columns are " + table.columns());
                }
                selected.put(name, row.get(name));
            }
            rows.add(selected);
        }
        return new Table(names, rows);
    }

    private static Object arrange(ExecutionContext ctx, List<Object> args) {
        var table = table(args, "arrange");
        var name = Values.asString(args.get(1), "arrange() column name");
        column(table, name);
        boolean descending = args.size() > 2 && Values.asBoolean(args.get(2), "arrange() descending flag");
        Comparator<Map<String, Object>> order = (left, right) -> {
            var a = left.get(name);
            var b = right.get(name);
            if (a == null || b == null) {
                // nulls sort after values when ascending
                return a == null ? (b == null ? 0 : 1) : -1;
            }
            return Values.compare(a, b, "arrange()");
        };
        if (descending) {
            order = order.reversed();
        }
        var rows = new ArrayList<>(table.rows());
        rows.sort(order);
        return new Table(table.columns(), rows);
    }

    private static Object head(ExecutionContext ctx, List<Object> args) {
        var table = table(args, "head");
        int count = (int) Math.max(0, Math.min(table.size(), Values.asNumber(args.get(1), "head() count")));
        return new Table(table.columns(), table.rows().subList(0, count));
    }
}
