package work.lcod.multiverse.error;

/**
 * Failure while evaluating analysis code: unbound names, type errors, or an exception thrown by a host function.
 */
public final class EvaluationException extends MultiverseException {
    public EvaluationException(String message) {
        super("evaluation_error", message);
    }

    public EvaluationException(String message, Throwable cause) {
        super("evaluation_error", message, cause);
    }
}
