package work.lcod.multiverse.error;

/**
 * Records that one universe stopped at a given step. Stored in results, never thrown across universes.
 */
public final class UniverseExecutionException extends MultiverseException {
    private final int universeId;
    private final int stepIndex;

    public UniverseExecutionException(int universeId, int stepIndex, Throwable cause) {
        super("execution_error", describe(universeId, stepIndex, cause), cause);
        this.universeId = universeId;
        this.stepIndex = stepIndex;
    }

    public int universeId() {
        return universeId;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public UniverseExecutionException withUniverseId(int id) {
        if (id == universeId) {
            return this;
        }
        return new UniverseExecutionException(id, stepIndex, getCause());
    }

    private static String describe(int universeId, int stepIndex, Throwable cause) {
        String detail = cause == null ? null : cause.getMessage();
        if (detail == null || detail.isBlank()) {
            detail = cause == null ? "unknown failure" : cause.getClass().getSimpleName();
        }
        return "Universe " + universeId + " failed at step " + stepIndex + ": " + detail;
    }
}
