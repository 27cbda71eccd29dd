package work.lcod.multiverse.branch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.error.DuplicateOptionLabelException;
import work.lcod.multiverse.error.InconsistentBranchDefinitionException;
import work.lcod.multiverse.error.UnknownParameterReferenceException;
import work.lcod.multiverse.lang.Parser;

class ParameterRegistryTest {
    private static List<BranchDeclaration> declarations(String code) {
        return BranchExtractor.extract(Parser.parse(code));
    }

    @Test
    void extractsDeclarationsInTextualOrder() {
        var found = declarations("y <- branch(b, one ~ 1, two ~ 2) + branch(a, x ~ 3)\nz <- branch(c, k ~ 0)");
        assertEquals(List.of("b", "a", "c"), found.stream().map(BranchDeclaration::parameter).toList());
        assertEquals(2, found.get(0).options().size());
    }

    @Test
    void rejectsDuplicateLabelsWithinOneBranch() {
        var error = assertThrows(DuplicateOptionLabelException.class, () -> declarations("branch(p, a ~ 1, a ~ 2)"));
        assertEquals("duplicate_option_label", error.code());
    }

    @Test
    void mergesInFirstSeenOrderAndExtendsParameters() {
        var registry = new ParameterRegistry();
        assertTrue(registry.merge(declarations("branch(alpha, a ~ 1, b ~ 2)\nbranch(beta, x ~ 1)"), 0));
        assertTrue(registry.merge(declarations("branch(alpha, a ~ 1, c ~ 3)"), 1));

        assertEquals(List.of("alpha", "beta"), registry.parameters().stream().map(Parameter::name).toList());
        var alpha = registry.find("alpha").orElseThrow();
        assertEquals(List.of("a", "b", "c"), alpha.labels());
        assertEquals(0, alpha.declaredAt());
        assertEquals(2, registry.version());
    }

    @Test
    void identicalRedeclarationIsNotAChange() {
        var registry = new ParameterRegistry();
        registry.merge(declarations("branch(alpha, a ~ x + 1)"), 0);
        var before = registry.parameters();
        assertFalse(registry.merge(declarations("branch(alpha, a ~ (x + 1))"), 1));
        assertSame(before, registry.parameters());
        assertEquals(1, registry.version());
    }

    @Test
    void rejectsConflictingRedefinition() {
        var registry = new ParameterRegistry();
        registry.merge(declarations("branch(alpha, a ~ 1)"), 0);
        var error = assertThrows(
            InconsistentBranchDefinitionException.class,
            () -> registry.merge(declarations("branch(alpha, a ~ 2)"), 1)
        );
        assertEquals("inconsistent_branch_definition", error.code());
    }

    @Test
    void numberAndStringLabelsWithTheSameTextConflict() {
        var registry = new ParameterRegistry();
        registry.merge(declarations("branch(k, 1 ~ 1)"), 0);
        assertThrows(InconsistentBranchDefinitionException.class, () -> registry.merge(declarations("branch(k, \"1\" ~ 1)"), 1));
        assertFalse(registry.merge(declarations("branch(k, 1 ~ 1)"), 2));
    }

    @Test
    void conditionsMayOnlyReferenceEarlierParameters() {
        var registry = new ParameterRegistry();
        registry.merge(declarations("branch(first, a ~ 1, b ~ 2)"), 0);
        assertTrue(registry.merge(declarations("branch(second, x %when% first == \"a\" ~ 1, y ~ 2)"), 1));

        assertThrows(
            UnknownParameterReferenceException.class,
            () -> registry.merge(declarations("branch(third, x %when% later == \"a\" ~ 1)"), 2)
        );
        assertThrows(
            UnknownParameterReferenceException.class,
            () -> registry.merge(declarations("branch(third, x %when% third == \"a\" ~ 1)"), 2)
        );
        assertThrows(
            UnknownParameterReferenceException.class,
            () -> registry.merge(declarations("branch(third, x %when% fourth == \"z\" ~ 1)\nbranch(fourth, z ~ 1)"), 2)
        );
    }

    @Test
    void failedMergeLeavesRegistryUntouched() {
        var registry = new ParameterRegistry();
        registry.merge(declarations("branch(alpha, a ~ 1)"), 0);
        var before = registry.parameters();

        assertThrows(
            UnknownParameterReferenceException.class,
            () -> registry.merge(declarations("branch(beta, x ~ 1)\nbranch(gamma, y %when% missing ~ 1)"), 1)
        );
        assertSame(before, registry.parameters());
        assertEquals(1, registry.version());
        assertTrue(registry.find("beta").isEmpty());
    }
}
