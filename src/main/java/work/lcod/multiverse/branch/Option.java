package work.lcod.multiverse.branch;

import java.util.Objects;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.Renderer;

/**
 * One choice of a parameter: the expression substituted for the branch and the guard deciding eligibility.
 * {@code labelValue} is what later conditions see for this choice (the label literal as a string, number or
 * boolean). A {@code null} condition means the option is always eligible.
 */
public record Option(String parameter, String label, Object labelValue, Node expression, Node condition) {
    public Option {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(labelValue, "labelValue");
        Objects.requireNonNull(expression, "expression");
    }

    public boolean isConditional() {
        return condition != null;
    }

    public String expressionSource() {
        return Renderer.render(expression);
    }

    public String conditionSource() {
        return Renderer.render(condition);
    }

    /**
     * Canonical form used to detect conflicting redefinitions of the same label.
     */
    String definition() {
        var builder = new StringBuilder(Renderer.renderLabel(label, labelValue));
        if (condition != null) {
            builder.append(" %when% ").append(conditionSource());
        }
        return builder.append(" ~ ").append(expressionSource()).toString();
    }
}
