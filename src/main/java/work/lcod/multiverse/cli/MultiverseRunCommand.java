package work.lcod.multiverse.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.multiverse.api.LogLevel;
import work.lcod.multiverse.api.Multiverse;
import work.lcod.multiverse.api.MultiverseConfiguration;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.io.ConfigurationLoader;
import work.lcod.multiverse.io.DataLoader;
import work.lcod.multiverse.io.ScriptLoader;
import work.lcod.multiverse.runtime.ExecutionResult;
import work.lcod.multiverse.runtime.FunctionValue;
import work.lcod.multiverse.table.Table;

@CommandLine.Command(
    name = "multiverse-run",
    description = "Expand an analysis script into its universes, execute them and print the results as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MultiverseRunCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(MultiverseRunCommand.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    enum ExecuteMode { NONE, DEFAULT, ALL }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--script"},
        required = true,
        description = "Analysis script (.yaml, .yml, .json, .toml, or plain text with '---' step separators)."
    )
    private Path script;

    @CommandLine.Option(
        names = {"-d", "--data"},
        paramLabel = "NAME=PATH",
        description = "Bind a CSV or JSON file to a read-only input variable."
    )
    private Map<String, Path> data = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--config",
        description = "TOML engine configuration ([engine] and [data] tables).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-e", "--execute"},
        description = "Which universes to execute (${COMPLETION-CANDIDATES}).",
        defaultValue = "all"
    )
    private ExecuteMode execute = ExecuteMode.ALL;

    @CommandLine.Option(
        names = {"-x", "--extract"},
        paramLabel = "VARIABLE",
        description = "Variable to extract from every universe; may be repeated."
    )
    private List<String> extract = new ArrayList<>();

    @CommandLine.Option(
        names = {"-p", "--parallelism"},
        description = "Worker threads for full execution (default: available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer parallelism;

    @CommandLine.Option(
        names = "--max-universes",
        description = "Fail when an expansion would exceed this many universes.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxUniverses;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogbackConfigurator.apply(LogLevel.from(logLevelRaw));

        var builder = MultiverseConfiguration.builder();
        if (config != null) {
            ConfigurationLoader.load(config, builder);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (maxUniverses != null) {
            builder.maxUniverses(maxUniverses);
        }
        data.forEach((name, path) -> builder.input(name, DataLoader.load(path)));
        // the selected mode decides what runs once every step is in
        builder.executeDefaultOnAdd(false);

        var multiverse = Multiverse.create(builder.build());
        var steps = ScriptLoader.load(script);
        LOG.info("Loaded {} step(s) from {}", steps.size(), script);
        for (var step : steps) {
            multiverse.addCode(step);
        }

        List<ExecutionResult> results = switch (execute) {
            case ALL -> multiverse.executeAll();
            case DEFAULT -> List.of(multiverse.executeUniverse(1));
            case NONE -> List.of();
        };

        var output = new LinkedHashMap<String, Object>();
        output.put("version", multiverse.version());
        output.put("parameters", describeParameters(multiverse.parameters()));
        output.put("universes", describeTable(multiverse.expand()));
        output.put("results", describeResults(results));
        var extracted = new LinkedHashMap<String, Object>();
        for (var name : extract) {
            extracted.put(name, describeTable(multiverse.extractVariable(name)));
        }
        output.put("extracted", extracted);
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(output));
        spec.commandLine().getOut().flush();
        return 0;
    }

    private static List<Object> describeParameters(List<Parameter> parameters) {
        var described = new ArrayList<Object>();
        for (var parameter : parameters) {
            var options = new ArrayList<Object>();
            for (var option : parameter.options()) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("label", option.label());
                entry.put("expression", option.expressionSource());
                if (option.isConditional()) {
                    entry.put("condition", option.conditionSource());
                }
                options.add(entry);
            }
            var entry = new LinkedHashMap<String, Object>();
            entry.put("name", parameter.name());
            entry.put("options", options);
            described.add(entry);
        }
        return described;
    }

    private static List<Object> describeResults(List<ExecutionResult> results) {
        var described = new ArrayList<Object>();
        for (var result : results) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("universe", result.universeId());
            entry.put("status", result.status().name().toLowerCase(Locale.ROOT));
            entry.put("completedSteps", result.completedSteps());
            if (!result.succeeded()) {
                entry.put("error", result.failure().getMessage());
            }
            described.add(entry);
        }
        return described;
    }

    private static Map<String, Object> describeTable(Table table) {
        var rows = new ArrayList<Object>(table.size());
        for (var row : table.rows()) {
            rows.add(toJson(row));
        }
        var described = new LinkedHashMap<String, Object>();
        described.put("columns", table.columns());
        described.put("rows", rows);
        return described;
    }

    /**
     * Converts interpreter values into plain JSON trees; functions are printed by their source.
     */
    static Object toJson(Object value) {
        if (value instanceof Table table) {
            return describeTable(table);
        }
        if (value instanceof FunctionValue function) {
            return "<function " + function.describe() + ">";
        }
        if (value instanceof Map<?, ?> map) {
            var converted = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> converted.put(String.valueOf(key), toJson(item)));
            return converted;
        }
        if (value instanceof List<?> list) {
            var converted = new ArrayList<Object>(list.size());
            list.forEach(item -> converted.add(toJson(item)));
            return converted;
        }
        return value;
    }
}
