package work.lcod.multiverse.error;

/**
 * A {@code %when%} condition names something that is not a parameter declared before the option's own parameter.
 */
public final class UnknownParameterReferenceException extends MultiverseException {
    private final String parameter;
    private final String label;
    private final String reference;

    public UnknownParameterReferenceException(String parameter, String label, String reference, String reason) {
        super(
            "unknown_parameter_reference",
            "Condition of option '" + label + "' in parameter '" + parameter + "' references '" + reference + "': " + reason
        );
        this.parameter = parameter;
        this.label = label;
        this.reference = reference;
    }

    public String parameter() {
        return parameter;
    }

    public String label() {
        return label;
    }

    public String reference() {
        return reference;
    }
}
