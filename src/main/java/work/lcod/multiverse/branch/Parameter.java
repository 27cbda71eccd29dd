package work.lcod.multiverse.branch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A decision point with its options in declaration order. {@code declaredAt} is the index of the code step that
 * first declared it.
 */
public record Parameter(String name, List<Option> options, int declaredAt) {
    public Parameter {
        Objects.requireNonNull(name, "name");
        options = List.copyOf(options);
    }

    public List<String> labels() {
        return options.stream().map(Option::label).toList();
    }

    public Optional<Option> option(String label) {
        return options.stream().filter(option -> option.label().equals(label)).findFirst();
    }

    Parameter withOption(Option option) {
        var extended = new ArrayList<>(options);
        extended.add(option);
        return new Parameter(name, extended, declaredAt);
    }
}
