package work.lcod.multiverse.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.multiverse.error.BranchParseException;

/**
 * Turns analysis code into tokens. Newlines are significant only outside parentheses and brackets.
 */
public final class Lexer {
    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "true", TokenType.TRUE,
        "false", TokenType.FALSE,
        "null", TokenType.NULL,
        "if", TokenType.IF,
        "in", TokenType.IN,
        "branch", TokenType.BRANCH
    );
    private static final String WHEN = "%when%";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int offset;
    private int line = 1;
    private int column = 1;
    private int nesting;

    private Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).run();
    }

    private List<Token> run() {
        while (!atEnd()) {
            char c = peek();
            if (c == '\n') {
                if (nesting == 0) {
                    add(TokenType.NEWLINE, "\\n", null, line, column);
                }
                advance();
                continue;
            }
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }
            if (c == '#') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekAt(1)))) {
                number();
                continue;
            }
            if (c == '"' || c == '\'') {
                string(c);
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                identifier();
                continue;
            }
            symbol(c);
        }
        add(TokenType.EOF, "", null, line, column);
        return tokens;
    }

    private void number() {
        int startLine = line;
        int startColumn = column;
        int start = offset;
        while (Character.isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && Character.isDigit(peekAt(1))) {
            advance();
            while (Character.isDigit(peek())) {
                advance();
            }
        }
        if ((peek() == 'e' || peek() == 'E')
            && (Character.isDigit(peekAt(1)) || ((peekAt(1) == '+' || peekAt(1) == '-') && Character.isDigit(peekAt(2))))) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (Character.isDigit(peek())) {
                advance();
            }
        }
        String text = source.substring(start, offset);
        add(TokenType.NUMBER, text, Double.parseDouble(text), startLine, startColumn);
    }

    private void string(char quote) {
        int startLine = line;
        int startColumn = column;
        int start = offset;
        advance();
        var decoded = new StringBuilder();
        while (true) {
            if (atEnd() || peek() == '\n') {
                throw new BranchParseException("Unterminated string literal", startLine, startColumn);
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                if (atEnd()) {
                    throw new BranchParseException("Unterminated string literal", startLine, startColumn);
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> decoded.append('\n');
                    case 't' -> decoded.append('\t');
                    case 'r' -> decoded.append('\r');
                    case '\\', '"', '\'' -> decoded.append(escaped);
                    default -> throw new BranchParseException("Unknown escape sequence \\" + escaped, line, column - 2);
                }
                continue;
            }
            decoded.append(c);
        }
        add(TokenType.STRING, source.substring(start, offset), decoded.toString(), startLine, startColumn);
    }

    private void identifier() {
        int startLine = line;
        int startColumn = column;
        int start = offset;
        while (Character.isLetterOrDigit(peek()) || peek() == '_') {
            advance();
        }
        String text = source.substring(start, offset);
        add(KEYWORDS.getOrDefault(text, TokenType.IDENT), text, null, startLine, startColumn);
    }

    private void symbol(char c) {
        int startLine = line;
        int startColumn = column;
        if (c == '%' && source.startsWith(WHEN, offset)) {
            for (int i = 0; i < WHEN.length(); i++) {
                advance();
            }
            add(TokenType.WHEN, WHEN, null, startLine, startColumn);
            return;
        }
        char next = peekAt(1);
        TokenType type;
        String text;
        if (c == '<' && next == '-') {
            type = TokenType.ASSIGN;
            text = "<-";
        } else if (c == '-' && next == '>') {
            type = TokenType.ARROW;
            text = "->";
        } else if (c == '=' && next == '=') {
            type = TokenType.EQ;
            text = "==";
        } else if (c == '!' && next == '=') {
            type = TokenType.NE;
            text = "!=";
        } else if (c == '<' && next == '=') {
            type = TokenType.LE;
            text = "<=";
        } else if (c == '>' && next == '=') {
            type = TokenType.GE;
            text = ">=";
        } else if (c == '&' && next == '&') {
            type = TokenType.AND;
            text = "&&";
        } else if (c == '|' && next == '|') {
            type = TokenType.OR;
            text = "||";
        } else {
            text = String.valueOf(c);
            type = switch (c) {
                case '=' -> TokenType.EQUALS;
                case '<' -> TokenType.LT;
                case '>' -> TokenType.GT;
                case '!' -> TokenType.NOT;
                case '+' -> TokenType.PLUS;
                case '-' -> TokenType.MINUS;
                case '*' -> TokenType.STAR;
                case '/' -> TokenType.SLASH;
                case '%' -> TokenType.PERCENT;
                case '~' -> TokenType.TILDE;
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                case '[' -> TokenType.LBRACKET;
                case ']' -> TokenType.RBRACKET;
                case ',' -> TokenType.COMMA;
                case '.' -> TokenType.DOT;
                case ';' -> TokenType.SEMICOLON;
                default -> throw new BranchParseException("Unexpected character '" + c + "'", startLine, startColumn);
            };
        }
        for (int i = 0; i < text.length(); i++) {
            advance();
        }
        if (type == TokenType.LPAREN || type == TokenType.LBRACKET) {
            nesting++;
        } else if ((type == TokenType.RPAREN || type == TokenType.RBRACKET) && nesting > 0) {
            nesting--;
        }
        add(type, text, null, startLine, startColumn);
    }

    private void add(TokenType type, String text, Object value, int tokenLine, int tokenColumn) {
        tokens.add(new Token(type, text, value, tokenLine, tokenColumn));
    }

    private boolean atEnd() {
        return offset >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int distance) {
        int index = offset + distance;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char advance() {
        char c = source.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
