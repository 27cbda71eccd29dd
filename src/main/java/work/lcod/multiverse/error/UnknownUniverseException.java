package work.lcod.multiverse.error;

public final class UnknownUniverseException extends MultiverseException {
    public UnknownUniverseException(int universeId, int universeCount) {
        super("unknown_universe", "Universe " + universeId + " does not exist (valid ids: 1.." + universeCount + ")");
    }
}
