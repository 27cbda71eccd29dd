package work.lcod.multiverse.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.lang.Parser;
import work.lcod.multiverse.table.Table;

class EvaluatorTest {
    private static Object eval(String code) {
        return eval(code, Environment.empty().child());
    }

    private static Object eval(String code, Environment env) {
        var ctx = new ExecutionContext(DefaultFunctions.create(), 1, Map.of());
        var evaluator = new Evaluator(ctx, env);
        Object last = null;
        for (var statement : Parser.parse(code)) {
            last = evaluator.evaluate(statement);
        }
        return last;
    }

    @Test
    void evaluatesArithmeticAsDoubles() {
        assertEquals(7.0, eval("1 + 2 * 3"));
        assertEquals(1.0, eval("7 % 3"));
        assertEquals(-2.5, eval("-5 / 2"));
    }

    @Test
    void concatenatesWhenEitherSideIsAString() {
        assertEquals("n=3", eval("\"n=\" + 3"));
        assertEquals("1.5x", eval("1.5 + \"x\""));
    }

    @Test
    void assignmentsBindInTheEnvironment() {
        var env = Environment.empty().child();
        eval("x <- 2; y = x * 10", env);
        assertEquals(Map.of("x", 2.0, "y", 20.0), env.locals());
    }

    @Test
    void logicalOperatorsShortCircuit() {
        assertEquals(false, eval("false && stop(\"never\")"));
        assertEquals(true, eval("true || stop(\"never\")"));
        assertThrows(EvaluationException.class, () -> eval("1 && true"));
    }

    @Test
    void conditionalIsLazy() {
        assertEquals("small", eval("if(1 < 2, \"small\", stop(\"never\"))"));
        assertThrows(EvaluationException.class, () -> eval("if(1, 2, 3)"));
    }

    @Test
    void membershipCoversListsRecordsAndStrings() {
        assertEquals(true, eval("2 in [1, 2, 3]"));
        assertEquals(false, eval("\"z\" in record(\"a\", 1)"));
        assertEquals(true, eval("\"ell\" in \"hello\""));
    }

    @Test
    void lambdasCloseOverTheirScope() {
        assertEquals(List.of(3.0, 4.0), eval("k <- 2; add <- x -> x + k; map([1, 2], add)"));
        assertEquals(6.0, eval("mul <- (a, b) -> a * b; mul(2, 3)"));
    }

    @Test
    void readsRecordFieldsTableColumnsAndIndexes() {
        var env = Environment.frozen(Map.of(
            "people", Table.builder("name", "age").addRow("ann", 31).addRow("bob", 17).build()
        )).child();
        assertEquals(List.of("ann", "bob"), eval("people.name", env));
        assertEquals(17.0, eval("people[1].age", env));
        assertEquals(1.0, eval("nrow(filter(people, p -> p.age >= 18))", env));
        assertEquals("b", eval("[\"a\", \"b\"][1]", env));
    }

    @Test
    void reportsUnboundNamesAndUnknownFunctions() {
        var unbound = assertThrows(EvaluationException.class, () -> eval("missing + 1"));
        assertTrue(unbound.getMessage().contains("'missing' is not bound"), unbound.getMessage());
        var unknown = assertThrows(EvaluationException.class, () -> eval("nope(1)"));
        assertTrue(unknown.getMessage().contains("Unknown function 'nope'"), unknown.getMessage());
    }

    @Test
    void checksHostFunctionArity() {
        var error = assertThrows(EvaluationException.class, () -> eval("sqrt(1, 2)"));
        assertTrue(error.getMessage().contains("sqrt() takes 1 argument(s) but got 2"), error.getMessage());
    }

    @Test
    void inputScopeIsReadOnly() {
        var inputs = Environment.frozen(Map.of("data", List.of(1, 2)));
        assertThrows(EvaluationException.class, () -> eval("data <- 3", inputs));
        var scope = inputs.child();
        eval("data <- 3", scope);
        assertEquals(3.0, scope.lookup("data"));
        assertEquals(List.of(1.0, 2.0), inputs.lookup("data"));
    }

    @Test
    void runawayRecursionIsAnEvaluationError() {
        var error = assertThrows(EvaluationException.class, () -> eval("f <- x -> f(x); f(1)"));
        assertTrue(error.getMessage().contains("Call depth exceeded"), error.getMessage());
    }

    @Test
    void hostFunctionsAcceptNull() {
        assertEquals(true, eval("is_null(null)"));
        assertFalse((Boolean) eval("is_null(0)"));
        assertNull(eval("null"));
    }
}
