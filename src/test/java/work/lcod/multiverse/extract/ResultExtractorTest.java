package work.lcod.multiverse.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.branch.BranchExtractor;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.branch.ParameterRegistry;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.error.UniverseExecutionException;
import work.lcod.multiverse.lang.Parser;
import work.lcod.multiverse.runtime.ExecutionResult;
import work.lcod.multiverse.table.Table;
import work.lcod.multiverse.universe.Universe;

class ResultExtractorTest {
    private static final List<Parameter> PARAMETERS = parameters("branch(model, lm ~ 1, glm ~ 2, gam ~ 3)");
    private static final List<Universe> UNIVERSES = List.of(
        new Universe(1, Map.of("model", "lm")),
        new Universe(2, Map.of("model", "glm")),
        new Universe(3, Map.of("model", "gam"))
    );

    private static List<Parameter> parameters(String code) {
        var registry = new ParameterRegistry();
        registry.merge(BranchExtractor.extract(Parser.parse(code)), 0);
        return registry.parameters();
    }

    private static ExecutionResult success(Universe universe, Map<String, Object> bindings) {
        return new ExecutionResult(universe.id(), universe.assignment(), bindings, 2, null);
    }

    private static ExecutionResult failure(Universe universe, Map<String, Object> bindings) {
        var error = new UniverseExecutionException(universe.id(), 1, new EvaluationException("singular fit"));
        return new ExecutionResult(universe.id(), universe.assignment(), bindings, 1, error);
    }

    private static Table extract(String name, Map<Integer, ExecutionResult> results) {
        return ResultExtractor.extract(name, UNIVERSES, PARAMETERS, u -> Optional.ofNullable(results.get(u.id())));
    }

    @Test
    void reportsEveryUniverseWithItsStatus() {
        var results = new HashMap<Integer, ExecutionResult>();
        results.put(1, success(UNIVERSES.get(0), Map.of("estimate", 0.5)));
        results.put(2, failure(UNIVERSES.get(1), Map.of("estimate", 0.7)));

        var table = extract("estimate", results);
        assertEquals(List.of(".universe", "model", ".status", ".error", "estimate"), table.columns());
        assertEquals(List.of(1, 2, 3), table.column(".universe"));
        assertEquals(List.of("lm", "glm", "gam"), table.column("model"));
        assertEquals(List.of("ok", "failed", "not_executed"), table.column(".status"));
        assertNull(table.get(0, ".error"));
        assertTrue(((String) table.get(1, ".error")).contains("singular fit"));
        // a value bound before the failing step is still reported
        assertEquals(0.7, table.get(1, "estimate"));
        assertNull(table.get(2, "estimate"));
    }

    @Test
    void unboundVariablesAreMarked() {
        var results = new HashMap<Integer, ExecutionResult>();
        UNIVERSES.forEach(u -> results.put(u.id(), success(u, u.id() == 2 ? Map.of() : Map.of("p", 0.01))));

        var table = extract("p", results);
        assertEquals(List.of("ok", "unbound", "ok"), table.column(".status"));
        assertNull(table.get(1, "p"));
    }

    @Test
    void nothingExecutedStillListsEveryUniverse() {
        var table = extract("estimate", Map.of());
        assertEquals(3, table.size());
        assertEquals(List.of("not_executed", "not_executed", "not_executed"), table.column(".status"));
        assertTrue(table.hasColumn("estimate"));
    }

    @Test
    void tableValuesExpandIntoOneRowPerSubRow() {
        var coefficients = Table.builder("term", "estimate", "model")
            .addRow("(Intercept)", 1.0, "x")
            .addRow("x", 2.0, "x")
            .build();
        var results = new HashMap<Integer, ExecutionResult>();
        results.put(1, success(UNIVERSES.get(0), Map.of("fit", coefficients)));
        results.put(2, success(UNIVERSES.get(1), Map.of("fit", Table.empty(coefficients.columns()))));

        var table = extract("fit", results);
        assertEquals(
            List.of(".universe", "model", ".status", ".error", "term", "estimate", "fit.model"),
            table.columns()
        );
        assertEquals(List.of(1, 1, 2, 3), table.column(".universe"));
        assertEquals(List.of("lm", "lm", "glm", "gam"), table.column("model"));
        assertEquals("x", table.get(1, "term"));
        assertEquals("x", table.get(0, "fit.model"));
        assertNull(table.get(2, "term"));
        assertEquals("ok", table.get(2, ".status"));
    }

    @Test
    void scalarColumnAvoidsFixedColumnNames() {
        var results = new HashMap<Integer, ExecutionResult>();
        results.put(1, success(UNIVERSES.get(0), Map.of("model", "fitted")));

        var table = extract("model", results);
        assertTrue(table.hasColumn("model.value"));
        assertEquals("lm", table.get(0, "model"));
        assertEquals("fitted", table.get(0, "model.value"));
    }

    @Test
    void mixesScalarAndTableValues() {
        var results = new HashMap<Integer, ExecutionResult>();
        results.put(1, success(UNIVERSES.get(0), Map.of("out", 3.0)));
        results.put(2, success(UNIVERSES.get(1), Map.of("out", Table.builder("out", "n").addRow(4.0, 10.0).build())));

        var table = extract("out", results);
        assertEquals(List.of(".universe", "model", ".status", ".error", "out", "out.out", "n"), table.columns());
        assertEquals(3.0, table.get(0, "out"));
        assertNull(table.get(0, "n"));
        assertEquals(4.0, table.get(1, "out.out"));
        assertNull(table.get(1, "out"));
    }
}
