package work.lcod.multiverse.universe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.branch.BranchExtractor;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.branch.ParameterRegistry;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.error.NoValidUniverseException;
import work.lcod.multiverse.error.UniverseLimitExceededException;
import work.lcod.multiverse.lang.Parser;
import work.lcod.multiverse.runtime.DefaultFunctions;
import work.lcod.multiverse.runtime.GuardEvaluator;

class UniverseExpanderTest {
    private static List<Parameter> parameters(String code) {
        var registry = new ParameterRegistry();
        registry.merge(BranchExtractor.extract(Parser.parse(code)), 0);
        return registry.parameters();
    }

    private static UniverseExpander expander() {
        return new UniverseExpander(new GuardEvaluator(DefaultFunctions.create()), 100_000);
    }

    @Test
    void withoutConditionsExpansionIsTheCartesianProduct() {
        var params = parameters("branch(a, a1 ~ 1, a2 ~ 2, a3 ~ 3)\nbranch(b, b1 ~ 1, b2 ~ 2)\nbranch(c, c1 ~ 1, c2 ~ 2)");
        var universes = expander().expand(params);
        assertEquals(12, universes.size());
        assertEquals(Map.of("a", "a1", "b", "b1", "c", "c1"), universes.get(0).assignment());
        assertEquals(Map.of("a", "a1", "b", "b1", "c", "c2"), universes.get(1).assignment());
        assertEquals(Map.of("a", "a3", "b", "b2", "c", "c2"), universes.get(11).assignment());
        for (int i = 0; i < universes.size(); i++) {
            assertEquals(i + 1, universes.get(i).id());
        }
    }

    @Test
    void noParametersMeansOneEmptyUniverse() {
        var universes = expander().expand(List.of());
        assertEquals(1, universes.size());
        assertTrue(universes.get(0).assignment().isEmpty());
    }

    @Test
    void guardedOptionsPruneCombinations() {
        var params = parameters(
            "branch(p1, a ~ 1, b ~ 2, c ~ 3, d ~ 4, e ~ 5)\n"
                + "branch(p2, a ~ 1, b ~ 2, c ~ 3)\n"
                + "branch(p3, a ~ 1, b ~ 2, c ~ 3)\n"
                + "branch(p4, x ~ 1, y %when% p2 != \"a\" ~ 2, z %when% p2 != \"b\" ~ 3)\n"
                + "branch(p5, on ~ true, off ~ false)"
        );
        var universes = expander().expand(params);
        assertEquals(210, universes.size());
        assertTrue(universes.stream().noneMatch(u -> u.label("p2").equals("a") && u.label("p4").equals("y")));
        assertTrue(universes.stream().noneMatch(u -> u.label("p2").equals("b") && u.label("p4").equals("z")));
    }

    @Test
    void expansionIsDeterministic() {
        var params = parameters("branch(a, x ~ 1, y ~ 2)\nbranch(b, u %when% a == \"y\" ~ 1, v ~ 2)");
        assertEquals(expander().expand(params), expander().expand(params));
        assertEquals(3, expander().expand(params).size());
    }

    @Test
    void conditionsSeeNumericLabelsAsNumbers() {
        var params = parameters("k <- branch(k, 1 ~ 1, 2 ~ 2)\nv <- branch(v, a %when% k == 1 ~ 10, b ~ 20)");
        var universes = expander().expand(params);
        assertEquals(
            List.of(Map.of("k", "1", "v", "a"), Map.of("k", "1", "v", "b"), Map.of("k", "2", "v", "b")),
            universes.stream().map(Universe::assignment).toList()
        );
        assertEquals(Map.of("k", "1", "v", "a"), expander().defaultUniverse(params).orElseThrow().assignment());
    }

    @Test
    void conditionsSeeBooleanLabelsAsBooleans() {
        var params = parameters("branch(strict, true ~ 1, false ~ 0)\nbranch(cutoff, high %when% strict ~ 3, low ~ 2)");
        var universes = expander().expand(params);
        assertEquals(
            List.of(
                Map.of("strict", "true", "cutoff", "high"),
                Map.of("strict", "true", "cutoff", "low"),
                Map.of("strict", "false", "cutoff", "low")
            ),
            universes.stream().map(Universe::assignment).toList()
        );
    }

    @Test
    void defaultUniverseIsTheFirstExpandedUniverse() {
        var params = parameters(
            "branch(a, x ~ 1, y ~ 2)\n"
                + "branch(b, u %when% a == \"y\" ~ 1, v %when% a == \"y\" ~ 2, w ~ 3)\n"
                + "branch(c, k %when% b == \"u\" ~ 1, l ~ 2)"
        );
        var first = expander().expand(params).get(0);
        var fallback = expander().defaultUniverse(params).orElseThrow();
        assertEquals(first, fallback);
        assertEquals(Map.of("a", "x", "b", "w", "c", "l"), fallback.assignment());
    }

    @Test
    void reportsWhenEveryCombinationIsExcluded() {
        var params = parameters("branch(a, x ~ 1)\nbranch(b, u %when% a == \"y\" ~ 1)");
        var error = assertThrows(NoValidUniverseException.class, () -> expander().expand(params));
        assertEquals("no_valid_universe", error.code());
        assertTrue(expander().defaultUniverse(params).isEmpty());
    }

    @Test
    void stopsAtTheConfiguredCeiling() {
        var params = parameters("branch(a, a1 ~ 1, a2 ~ 2, a3 ~ 3)\nbranch(b, b1 ~ 1, b2 ~ 2, b3 ~ 3)");
        var limited = new UniverseExpander(Guard.unconditional(), 8);
        var error = assertThrows(UniverseLimitExceededException.class, () -> limited.expand(params));
        assertTrue(error.getMessage().contains("'b'"), error.getMessage());
    }

    @Test
    void nonBooleanConditionsAreEvaluationErrors() {
        var params = parameters("branch(a, x ~ 1)\nbranch(b, u %when% a ~ 1)");
        assertThrows(EvaluationException.class, () -> expander().expand(params));
    }
}
