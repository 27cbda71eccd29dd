package work.lcod.multiverse.error;

public final class NoValidUniverseException extends MultiverseException {
    public NoValidUniverseException(String message) {
        super("no_valid_universe", message);
    }
}
