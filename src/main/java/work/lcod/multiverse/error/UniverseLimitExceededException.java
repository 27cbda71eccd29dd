package work.lcod.multiverse.error;

public final class UniverseLimitExceededException extends MultiverseException {
    private final int limit;

    public UniverseLimitExceededException(int limit, String parameter, long reached) {
        super(
            "universe_limit_exceeded",
            "Expansion reached " + reached + " partial universes at parameter '" + parameter + "' (limit " + limit + ")"
        );
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
