package work.lcod.multiverse.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.error.BranchParseException;

class ParserTest {
    @Test
    void parsesStatementsSeparatedByNewlinesAndSemicolons() {
        var statements = Parser.parse("x <- 1; y = x + 2\n# comment\nz <- [x, y]");
        assertEquals(3, statements.size());
        var first = assertInstanceOf(Node.Assignment.class, statements.get(0));
        assertEquals("x", first.name());
        assertEquals("z <- [x, y]", Renderer.render(statements.get(2)));
    }

    @Test
    void respectsOperatorPrecedence() {
        var node = Parser.parseExpression("1 + 2 * 3 == 7 && !false");
        assertEquals("1 + 2 * 3 == 7 && !false", Renderer.render(node));
        var binary = assertInstanceOf(Node.Binary.class, node);
        assertEquals(TokenType.AND, binary.operator());
    }

    @Test
    void keepsExplicitParenthesesWhenRendering() {
        assertEquals("(1 + 2) * 3", Renderer.render(Parser.parseExpression("(1 + 2) * 3")));
        assertEquals("1 - (2 - 3)", Renderer.render(Parser.parseExpression("1 - (2 - 3)")));
    }

    @Test
    void parsesLambdasCallsAndPostfixChains() {
        var node = Parser.parseExpression("filter(data, row -> row.age >= 18)[0].name");
        assertEquals("filter(data, row -> row.age >= 18)[0].name", Renderer.render(node));
        var pair = Parser.parseExpression("(a, b) -> a + b");
        var lambda = assertInstanceOf(Node.Lambda.class, pair);
        assertEquals(List.of("a", "b"), lambda.parameters());
    }

    @Test
    void parsesBranchWithConditionsAcrossLines() {
        var statements = Parser.parse(
            "y <- branch(model,\n"
                + "  \"linear\" ~ x,\n"
                + "  log %when% scale == \"positive\" ~ log(x),\n"
                + "  2 ~ x * 2\n"
                + ")"
        );
        var assignment = assertInstanceOf(Node.Assignment.class, statements.get(0));
        var branch = assertInstanceOf(Node.Branch.class, assignment.value());
        assertEquals("model", branch.parameter());
        assertEquals(3, branch.options().size());
        assertEquals("linear", branch.options().get(0).label());
        assertNull(branch.options().get(0).condition());
        assertEquals("log", branch.options().get(1).label());
        assertEquals("scale == \"positive\"", Renderer.render(branch.options().get(1).condition()));
        assertEquals("2", branch.options().get(2).label());
    }

    @Test
    void numericLabelsKeepTheirSpelling() {
        var branch = assertInstanceOf(Node.Branch.class, Parser.parseExpression("branch(p, 1 ~ 1, 1.0 ~ 2, true ~ 3, \"t\" ~ 4)"));
        assertEquals(List.of("1", "1.0", "true", "t"), branch.options().stream().map(Node.BranchOption::label).toList());
        assertEquals(List.of(1.0, 1.0, true, "t"), branch.options().stream().map(Node.BranchOption::labelValue).toList());
        assertEquals("branch(p, 1 ~ 1, 1.0 ~ 2, true ~ 3, \"t\" ~ 4)", Renderer.render(branch));
    }

    @Test
    void rejectsMalformedBranches() {
        var missingTilde = assertThrows(BranchParseException.class, () -> Parser.parse("branch(p, a x)"));
        assertTrue(missingTilde.getMessage().contains("Expected '~'"), missingTilde.getMessage());

        var missingExpression = assertThrows(BranchParseException.class, () -> Parser.parse("branch(p, a ~ )"));
        assertTrue(missingExpression.getMessage().contains("Missing expression"), missingExpression.getMessage());

        var missingLabel = assertThrows(BranchParseException.class, () -> Parser.parse("branch(p, ~ 1)"));
        assertTrue(missingLabel.getMessage().contains("Missing option label"), missingLabel.getMessage());

        var noOptions = assertThrows(BranchParseException.class, () -> Parser.parse("branch(p)"));
        assertTrue(noOptions.getMessage().contains("declares no options"), noOptions.getMessage());

        var noName = assertThrows(BranchParseException.class, () -> Parser.parse("branch(1, a ~ 1)"));
        assertTrue(noName.getMessage().contains("requires a parameter name"), noName.getMessage());
    }

    @Test
    void rejectsNestedBranches() {
        var error = assertThrows(
            BranchParseException.class,
            () -> Parser.parse("branch(a, x ~ branch(b, y ~ 1))")
        );
        assertTrue(error.getMessage().contains("cannot be nested"), error.getMessage());
        assertEquals("parse_error", error.code());
    }

    @Test
    void reportsLineAndColumn() {
        var error = assertThrows(BranchParseException.class, () -> Parser.parse("x <- 1\ny <- (2 +"));
        assertEquals(2, error.line());
        assertTrue(error.getMessage().contains("line 2"), error.getMessage());
    }

    @Test
    void rejectsChainedComparisons() {
        assertThrows(BranchParseException.class, () -> Parser.parseExpression("1 < 2 < 3"));
    }

    @Test
    void collectsFreeVariablesExcludingLambdaParametersAndCallees() {
        var node = Parser.parseExpression("mean(map(xs, x -> x * k)) > threshold");
        assertEquals(Set.of("xs", "k", "threshold"), FreeVariables.of(node));
    }
}
