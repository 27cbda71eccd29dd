package work.lcod.multiverse.error;

/**
 * Base class for engine failures. Carries a stable machine-readable code next to the message.
 */
public abstract class MultiverseException extends RuntimeException {
    private final String code;

    protected MultiverseException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected MultiverseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
