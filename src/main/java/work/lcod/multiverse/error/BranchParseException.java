package work.lcod.multiverse.error;

/**
 * Raised when a code fragment cannot be tokenized or parsed, including malformed {@code branch(...)} calls.
 */
public final class BranchParseException extends MultiverseException {
    private final int line;
    private final int column;

    public BranchParseException(String message, int line, int column) {
        super("parse_error", message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
