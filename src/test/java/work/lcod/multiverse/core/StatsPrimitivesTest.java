package work.lcod.multiverse.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.lang.Parser;
import work.lcod.multiverse.runtime.DefaultFunctions;
import work.lcod.multiverse.runtime.Environment;
import work.lcod.multiverse.runtime.Evaluator;
import work.lcod.multiverse.runtime.ExecutionContext;
import work.lcod.multiverse.table.Table;

class StatsPrimitivesTest {
    private static Object eval(String code, Map<String, ?> inputs) {
        var env = Environment.frozen(inputs).child();
        var evaluator = new Evaluator(new ExecutionContext(DefaultFunctions.create(), 1, Map.of()), env);
        Object last = null;
        for (var statement : Parser.parse(code)) {
            last = evaluator.evaluate(statement);
        }
        return last;
    }

    private static double number(String code) {
        return (Double) eval(code, Map.of());
    }

    @Test
    void descriptiveStatistics() {
        assertEquals(2.5, number("mean([1, 2, 3, 4])"));
        assertEquals(2.0, number("median([3, 1, 2])"));
        assertEquals(2.5, number("median([4, 1, 3, 2])"));
        assertEquals(5.0 / 3.0, number("var([1, 2, 3, 4])"), 1e-12);
        assertEquals(Math.sqrt(5.0 / 3.0), number("sd([1, 2, 3, 4])"), 1e-12);
        assertEquals(2.0, number("quantile([1, 2, 3, 4, 5], 0.25)"));
        assertEquals(4.6, number("quantile([1, 2, 3, 4, 5], 0.9)"), 1e-12);
        assertEquals(1.0, number("cor([1, 2, 3], [2, 4, 6])"), 1e-12);
        assertEquals(-1.0, number("cor([1, 2, 3], [3, 2, 1])"), 1e-12);
    }

    @Test
    void rejectsDegenerateInput() {
        assertThrows(EvaluationException.class, () -> eval("mean([])", Map.of()));
        assertThrows(EvaluationException.class, () -> eval("sd([1])", Map.of()));
        assertThrows(EvaluationException.class, () -> eval("quantile([1, 2], 1.5)", Map.of()));
        assertThrows(EvaluationException.class, () -> eval("cor([1, 2, 3], [1, 2])", Map.of()));
    }

    @Test
    void linearFitRecoversAnExactLine() {
        var data = Table.builder("x", "y")
            .addRow(1, 3)
            .addRow(2, 5)
            .addRow(3, 7)
            .addRow(4, 9)
            .addRow(5, null)
            .build();
        var fit = (Table) eval("linear_fit(data, \"y\", \"x\")", Map.of("data", data));

        assertEquals(List.of("term", "estimate", "std_error", "t_value"), fit.columns());
        assertEquals(List.of("(Intercept)", "x"), fit.column("term"));
        assertEquals(1.0, (Double) fit.get(0, "estimate"), 1e-9);
        assertEquals(2.0, (Double) fit.get(1, "estimate"), 1e-9);
        assertEquals(0.0, (Double) fit.get(1, "std_error"), 1e-6);
    }

    @Test
    void linearFitReportsStandardErrors() {
        var data = Table.builder("x", "y")
            .addRow(0, 0)
            .addRow(1, 2)
            .addRow(2, 2)
            .addRow(3, 4)
            .build();
        var fit = (Table) eval("linear_fit(data, \"y\", [\"x\"])", Map.of("data", data));
        // slope 1.2, intercept 0.2, residuals (-0.2, 0.6, -0.6, 0.2): rss 0.8 over 2 degrees of freedom
        assertEquals(0.2, (Double) fit.get(0, "estimate"), 1e-9);
        assertEquals(1.2, (Double) fit.get(1, "estimate"), 1e-9);
        assertEquals(Math.sqrt(0.4 / 5.0), (Double) fit.get(1, "std_error"), 1e-9);
        assertEquals(1.2 / Math.sqrt(0.4 / 5.0), (Double) fit.get(1, "t_value"), 1e-9);
    }

    @Test
    void linearFitRejectsCollinearPredictors() {
        var data = Table.builder("x", "twice", "y")
            .addRow(1, 2, 1)
            .addRow(2, 4, 3)
            .addRow(3, 6, 2)
            .addRow(4, 8, 5)
            .build();
        var error = assertThrows(
            EvaluationException.class,
            () -> eval("linear_fit(data, \"y\", [\"x\", \"twice\"])", Map.of("data", data))
        );
        assertTrue(error.getMessage().contains("collinear"), error.getMessage());
        assertThrows(EvaluationException.class, () -> eval("linear_fit(data, \"y\", \"z\")", Map.of("data", data)));
    }
}
