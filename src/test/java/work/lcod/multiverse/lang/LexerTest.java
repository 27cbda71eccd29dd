package work.lcod.multiverse.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.multiverse.error.BranchParseException;

class LexerTest {
    @Test
    void recognisesWhenMarkerAndAssignmentArrow() {
        var types = Lexer.tokenize("a %when% b ~ c <- 1 % 2").stream().map(Token::type).toList();
        assertEquals(
            List.of(
                TokenType.IDENT, TokenType.WHEN, TokenType.IDENT, TokenType.TILDE, TokenType.IDENT,
                TokenType.ASSIGN, TokenType.NUMBER, TokenType.PERCENT, TokenType.NUMBER, TokenType.EOF
            ),
            types
        );
    }

    @Test
    void suppressesNewlinesInsideParentheses() {
        var types = Lexer.tokenize("f(1,\n2)\nx").stream().map(Token::type).toList();
        assertEquals(
            List.of(
                TokenType.IDENT, TokenType.LPAREN, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER,
                TokenType.RPAREN, TokenType.NEWLINE, TokenType.IDENT, TokenType.EOF
            ),
            types
        );
    }

    @Test
    void decodesLiterals() {
        var tokens = Lexer.tokenize("'it\\'s' 2.5e2 .5");
        assertEquals("it's", tokens.get(0).value());
        assertEquals(250.0, tokens.get(1).value());
        assertEquals(0.5, tokens.get(2).value());
    }

    @Test
    void tracksPositions() {
        var tokens = Lexer.tokenize("x\n  yy");
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
    }

    @Test
    void rejectsUnterminatedStrings() {
        var error = assertThrows(BranchParseException.class, () -> Lexer.tokenize("x <- \"open"));
        assertEquals(1, error.line());
        assertEquals(6, error.column());
    }
}
