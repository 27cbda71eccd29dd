package work.lcod.multiverse.error;

public final class DuplicateOptionLabelException extends MultiverseException {
    private final String parameter;
    private final String label;

    public DuplicateOptionLabelException(String parameter, String label) {
        super("duplicate_option_label", "Option '" + label + "' is declared twice for parameter '" + parameter + "'");
        this.parameter = parameter;
        this.label = label;
    }

    public String parameter() {
        return parameter;
    }

    public String label() {
        return label;
    }
}
