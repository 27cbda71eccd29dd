package work.lcod.multiverse.lang;

/**
 * Lexical token with its 1-based source position. {@code value} holds the decoded literal for numbers and strings.
 */
public record Token(TokenType type, String text, Object value, int line, int column) {
    public Position position() {
        return new Position(line, column);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
