package work.lcod.multiverse.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.runtime.ExecutionResult;
import work.lcod.multiverse.table.Table;
import work.lcod.multiverse.universe.Universe;

/**
 * Collects one variable from every universe into a single table. Never executes anything: universes without a
 * result are reported as {@code not_executed}.
 */
public final class ResultExtractor {
    public static final String UNIVERSE_COLUMN = ".universe";
    public static final String STATUS_COLUMN = ".status";
    public static final String ERROR_COLUMN = ".error";

    private ResultExtractor() {}

    public static Table extract(
        String name,
        List<Universe> universes,
        List<Parameter> parameters,
        Function<Universe, Optional<ExecutionResult>> results
    ) {
        var fixed = new ArrayList<String>();
        fixed.add(UNIVERSE_COLUMN);
        parameters.forEach(parameter -> fixed.add(parameter.name()));
        fixed.add(STATUS_COLUMN);
        fixed.add(ERROR_COLUMN);
        var reserved = Set.copyOf(fixed);
        var scalarColumn = reserved.contains(name) ? name + ".value" : name;

        var valueColumns = new LinkedHashSet<String>();
        boolean scalarSeen = false;
        var rows = new ArrayList<Map<String, Object>>();
        for (var universe : universes) {
            var result = results.apply(universe);
            var base = new LinkedHashMap<String, Object>();
            base.put(UNIVERSE_COLUMN, universe.id());
            parameters.forEach(parameter -> base.put(parameter.name(), universe.label(parameter.name())));
            base.put(STATUS_COLUMN, status(result, name).label());
            base.put(ERROR_COLUMN, result.filter(r -> !r.succeeded()).map(r -> r.failure().getMessage()).orElse(null));

            var value = result.filter(r -> r.isBound(name)).map(r -> r.value(name)).orElse(null);
            if (value instanceof Table table) {
                var renamed = new LinkedHashMap<String, String>();
                for (var column : table.columns()) {
                    var target = reserved.contains(column) || column.equals(scalarColumn) ? name + "." + column : column;
                    renamed.put(column, target);
                    valueColumns.add(target);
                }
                if (table.isEmpty()) {
                    rows.add(base);
                    continue;
                }
                for (var subRow : table.rows()) {
                    var row = new LinkedHashMap<>(base);
                    renamed.forEach((column, target) -> row.put(target, subRow.get(column)));
                    rows.add(row);
                }
            } else {
                if (value != null) {
                    scalarSeen = true;
                }
                base.put(scalarColumn, value);
                rows.add(base);
            }
        }

        var columns = new ArrayList<>(fixed);
        if (scalarSeen || valueColumns.isEmpty()) {
            columns.add(scalarColumn);
        }
        columns.addAll(valueColumns);
        if (!columns.contains(scalarColumn)) {
            // only tables were bound; drop the placeholder cells
            rows.forEach(row -> row.remove(scalarColumn));
        }
        return new Table(columns, rows);
    }

    static VariableStatus status(Optional<ExecutionResult> result, String name) {
        if (result.isEmpty()) {
            return VariableStatus.NOT_EXECUTED;
        }
        if (!result.get().succeeded()) {
            return VariableStatus.FAILED;
        }
        return result.get().isBound(name) ? VariableStatus.OK : VariableStatus.UNBOUND;
    }
}
