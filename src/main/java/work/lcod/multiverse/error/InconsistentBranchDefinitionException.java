package work.lcod.multiverse.error;

/**
 * A known option label was redeclared with a different expression or condition.
 */
public final class InconsistentBranchDefinitionException extends MultiverseException {
    private final String parameter;
    private final String label;

    public InconsistentBranchDefinitionException(String parameter, String label, String existing, String redeclared) {
        super(
            "inconsistent_branch_definition",
            "Option '" + label + "' of parameter '" + parameter + "' is already defined as `" + existing
                + "` and cannot be redefined as `" + redeclared + "`"
        );
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
