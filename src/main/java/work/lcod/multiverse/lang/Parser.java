package work.lcod.multiverse.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.multiverse.error.BranchParseException;

/**
 * Recursive-descent parser for analysis code fragments.
 */
public final class Parser {
    private static final Set<TokenType> COMPARISONS = Set.of(
        TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.IN
    );

    private final List<Token> tokens;
    private int current;
    private int branchDepth;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a fragment into its statements. Statements are separated by newlines or {@code ;}.
     */
    public static List<Node> parse(String source) {
        return new Parser(Lexer.tokenize(source)).statements();
    }

    /**
     * Parses a single expression, rejecting trailing input.
     */
    public static Node parseExpression(String source) {
        var parser = new Parser(Lexer.tokenize(source));
        parser.skipSeparators();
        var node = parser.expression();
        parser.skipSeparators();
        parser.expect(TokenType.EOF, "Unexpected input after expression");
        return node;
    }

    private List<Node> statements() {
        var statements = new ArrayList<Node>();
        skipSeparators();
        while (!check(TokenType.EOF)) {
            statements.add(statement());
            if (!check(TokenType.EOF) && !check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON)) {
                throw error(peek(), "Expected end of statement but found " + peek());
            }
            skipSeparators();
        }
        return List.copyOf(statements);
    }

    private Node statement() {
        if (check(TokenType.IDENT) && (checkAt(1, TokenType.ASSIGN) || checkAt(1, TokenType.EQUALS))) {
            var name = advance();
            advance();
            skipNewlines();
            return new Node.Assignment(name.text(), expression(), name.position());
        }
        return expression();
    }

    private Node expression() {
        if (check(TokenType.IDENT) && checkAt(1, TokenType.ARROW)) {
            var param = advance();
            advance();
            skipNewlines();
            return new Node.Lambda(List.of(param.text()), expression(), param.position());
        }
        if (check(TokenType.LPAREN) && isParenthesizedLambda()) {
            var open = advance();
            var params = new ArrayList<String>();
            while (!check(TokenType.RPAREN)) {
                params.add(advance().text());
                match(TokenType.COMMA);
            }
            advance();
            advance();
            skipNewlines();
            return new Node.Lambda(params, expression(), open.position());
        }
        return or();
    }

    private boolean isParenthesizedLambda() {
        int index = current + 1;
        if (tokenAt(index).type() == TokenType.RPAREN) {
            return tokenAt(index + 1).type() == TokenType.ARROW;
        }
        while (true) {
            if (tokenAt(index).type() != TokenType.IDENT) {
                return false;
            }
            index++;
            var next = tokenAt(index).type();
            if (next == TokenType.RPAREN) {
                return tokenAt(index + 1).type() == TokenType.ARROW;
            }
            if (next != TokenType.COMMA) {
                return false;
            }
            index++;
        }
    }

    private Node or() {
        var left = and();
        while (check(TokenType.OR)) {
            var op = advance();
            skipNewlines();
            left = new Node.Binary(op.type(), left, and(), op.position());
        }
        return left;
    }

    private Node and() {
        var left = not();
        while (check(TokenType.AND)) {
            var op = advance();
            skipNewlines();
            left = new Node.Binary(op.type(), left, not(), op.position());
        }
        return left;
    }

    private Node not() {
        if (check(TokenType.NOT)) {
            var op = advance();
            return new Node.Unary(op.type(), not(), op.position());
        }
        return comparison();
    }

    private Node comparison() {
        var left = additive();
        if (COMPARISONS.contains(peek().type())) {
            var op = advance();
            skipNewlines();
            left = new Node.Binary(op.type(), left, additive(), op.position());
            if (COMPARISONS.contains(peek().type())) {
                throw error(peek(), "Comparisons cannot be chained; use parentheses");
            }
        }
        return left;
    }

    private Node additive() {
        var left = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            var op = advance();
            skipNewlines();
            left = new Node.Binary(op.type(), left, term(), op.position());
        }
        return left;
    }

    private Node term() {
        var left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            var op = advance();
            skipNewlines();
            left = new Node.Binary(op.type(), left, unary(), op.position());
        }
        return left;
    }

    private Node unary() {
        if (check(TokenType.MINUS)) {
            var op = advance();
            return new Node.Unary(op.type(), unary(), op.position());
        }
        return postfix();
    }

    private Node postfix() {
        var node = primary();
        while (true) {
            if (check(TokenType.DOT)) {
                var dot = advance();
                var name = expect(TokenType.IDENT, "Expected field name after '.'");
                node = new Node.Member(node, name.text(), dot.position());
            } else if (check(TokenType.LBRACKET)) {
                var open = advance();
                var index = expression();
                expect(TokenType.RBRACKET, "Expected ']' after index");
                node = new Node.Index(node, index, open.position());
            } else if (check(TokenType.LPAREN)) {
                var open = advance();
                node = new Node.Call(node, arguments(), open.position());
            } else {
                return node;
            }
        }
    }

    private List<Node> arguments() {
        var args = new ArrayList<Node>();
        if (match(TokenType.RPAREN)) {
            return args;
        }
        do {
            args.add(expression());
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Node primary() {
        var token = peek();
        switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                return new Node.Literal(token.value(), token.position());
            }
            case TRUE -> {
                advance();
                return new Node.Literal(Boolean.TRUE, token.position());
            }
            case FALSE -> {
                advance();
                return new Node.Literal(Boolean.FALSE, token.position());
            }
            case NULL -> {
                advance();
                return new Node.Literal(null, token.position());
            }
            case IDENT -> {
                advance();
                return new Node.Identifier(token.text(), token.position());
            }
            case LPAREN -> {
                advance();
                var inner = expression();
                expect(TokenType.RPAREN, "Expected ')'");
                return inner;
            }
            case LBRACKET -> {
                advance();
                var items = new ArrayList<Node>();
                if (!check(TokenType.RBRACKET)) {
                    do {
                        items.add(expression());
                    } while (match(TokenType.COMMA));
                }
                expect(TokenType.RBRACKET, "Expected ']' after list items");
                return new Node.ListLiteral(items, token.position());
            }
            case IF -> {
                return conditional();
            }
            case BRANCH -> {
                return branch();
            }
            default -> throw error(token, "Expected an expression but found " + token);
        }
    }

    private Node conditional() {
        var keyword = advance();
        expect(TokenType.LPAREN, "Expected '(' after if");
        var condition = expression();
        expect(TokenType.COMMA, "if() takes a condition, a value and an alternative");
        var then = expression();
        expect(TokenType.COMMA, "if() takes a condition, a value and an alternative");
        var otherwise = expression();
        expect(TokenType.RPAREN, "Expected ')' to close if()");
        return new Node.Conditional(condition, then, otherwise, keyword.position());
    }

    private Node branch() {
        var keyword = advance();
        if (branchDepth > 0) {
            throw error(keyword, "branch() cannot be nested inside another branch option");
        }
        expect(TokenType.LPAREN, "Expected '(' after branch");
        var nameToken = peek();
        String parameter;
        if (nameToken.type() == TokenType.IDENT) {
            parameter = advance().text();
        } else if (nameToken.type() == TokenType.STRING) {
            parameter = String.valueOf(advance().value());
        } else {
            throw error(nameToken, "branch() requires a parameter name");
        }
        if (parameter.isBlank()) {
            throw error(nameToken, "branch() parameter name cannot be blank");
        }
        if (parameter.startsWith(".")) {
            // leading dots are reserved for the .universe/.status/.error columns
            throw error(nameToken, "branch() parameter name cannot start with '.'");
        }
        if (check(TokenType.RPAREN)) {
            throw error(peek(), "branch(" + parameter + ") declares no options");
        }
        var options = new ArrayList<Node.BranchOption>();
        branchDepth++;
        try {
            while (match(TokenType.COMMA)) {
                options.add(option(parameter));
            }
        } finally {
            branchDepth--;
        }
        if (options.isEmpty()) {
            throw error(peek(), "Expected ',' before the options of branch(" + parameter + ")");
        }
        expect(TokenType.RPAREN, "Expected ')' to close branch(" + parameter + ")");
        return new Node.Branch(parameter, options, keyword.position());
    }

    private Node.BranchOption option(String parameter) {
        var labelToken = peek();
        Object labelValue = switch (labelToken.type()) {
            case STRING, NUMBER -> labelToken.value();
            case IDENT -> labelToken.text();
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            default -> throw error(labelToken, "Missing option label in branch(" + parameter + ")");
        };
        // numbers keep their source spelling so that 1 and 1.0 stay distinct labels
        String label = labelValue instanceof String text ? text : labelToken.text();
        advance();
        if (label.isBlank()) {
            throw error(labelToken, "Option labels of branch(" + parameter + ") cannot be blank");
        }
        Node condition = null;
        if (match(TokenType.WHEN)) {
            if (check(TokenType.TILDE)) {
                throw error(peek(), "Missing condition after %when% for option '" + label + "'");
            }
            condition = expression();
        }
        expect(TokenType.TILDE, "Expected '~' after option '" + label + "' of branch(" + parameter + ")");
        if (check(TokenType.COMMA) || check(TokenType.RPAREN) || check(TokenType.EOF)) {
            throw error(peek(), "Missing expression for option '" + label + "' of branch(" + parameter + ")");
        }
        var expression = expression();
        return new Node.BranchOption(label, labelValue, condition, expression, labelToken.position());
    }

    private void skipSeparators() {
        while (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message + " (found " + peek() + ")");
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAt(int distance, TokenType type) {
        return tokenAt(current + distance).type() == type;
    }

    private Token peek() {
        return tokenAt(current);
    }

    private Token tokenAt(int index) {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private Token advance() {
        var token = peek();
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private static BranchParseException error(Token token, String message) {
        return new BranchParseException(message, token.line(), token.column());
    }
}
