package work.lcod.multiverse.extract;

import java.util.Locale;

/**
 * Value of the {@code .status} column of an extracted table.
 */
public enum VariableStatus {
    OK,
    FAILED,
    UNBOUND,
    NOT_EXECUTED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
