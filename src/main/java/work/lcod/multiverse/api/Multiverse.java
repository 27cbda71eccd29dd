package work.lcod.multiverse.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.multiverse.branch.BranchExtractor;
import work.lcod.multiverse.branch.Parameter;
import work.lcod.multiverse.branch.ParameterRegistry;
import work.lcod.multiverse.code.CodeStore;
import work.lcod.multiverse.error.MultiverseException;
import work.lcod.multiverse.error.NoValidUniverseException;
import work.lcod.multiverse.error.UnknownUniverseException;
import work.lcod.multiverse.extract.ResultExtractor;
import work.lcod.multiverse.extract.VariableStatus;
import work.lcod.multiverse.lang.Parser;
import work.lcod.multiverse.runtime.DefaultFunctions;
import work.lcod.multiverse.runtime.Environment;
import work.lcod.multiverse.runtime.ExecutionEngine;
import work.lcod.multiverse.runtime.ExecutionResult;
import work.lcod.multiverse.runtime.ExecutionSnapshot;
import work.lcod.multiverse.runtime.FunctionRegistry;
import work.lcod.multiverse.runtime.GuardEvaluator;
import work.lcod.multiverse.runtime.UniverseRunner;
import work.lcod.multiverse.table.Table;
import work.lcod.multiverse.universe.Universe;
import work.lcod.multiverse.universe.UniverseExpander;

/**
 * Public entry point: accumulates analysis code, derives its universes, executes them and extracts results.
 * Instances may be shared between threads; every operation is serialized on the instance.
 */
public final class Multiverse {
    private static final Logger LOG = LoggerFactory.getLogger(Multiverse.class);

    private final MultiverseConfiguration configuration;
    private final CodeStore code = new CodeStore();
    private final ParameterRegistry registry = new ParameterRegistry();
    private final FunctionRegistry functions;
    private final Environment inputs;
    private final UniverseExpander expander;
    private final ExecutionEngine engine;

    private long version;
    private long universesVersion = -1;
    private List<Universe> universes = List.of();

    private Multiverse(MultiverseConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.functions = DefaultFunctions.create();
        configuration.functions().forEach(functions::register);
        this.inputs = Environment.frozen(configuration.inputs());
        this.expander = new UniverseExpander(new GuardEvaluator(functions), configuration.maxUniverses());
        this.engine = new ExecutionEngine(configuration.parallelism());
    }

    public static Multiverse create() {
        return create(MultiverseConfiguration.defaults());
    }

    public static Multiverse create(MultiverseConfiguration configuration) {
        return new Multiverse(configuration);
    }

    public MultiverseConfiguration configuration() {
        return configuration;
    }

    /**
     * Appends a code fragment. The fragment is parsed and its branch declarations merged into the parameter
     * table; on any structural error the multiverse is left exactly as it was. Cached results are dropped and,
     * unless disabled, the default universe is executed.
     *
     * @return the index of the appended step
     */
    public synchronized int addCode(String fragment) {
        Objects.requireNonNull(fragment, "fragment");
        var statements = Parser.parse(fragment);
        var declarations = BranchExtractor.extract(statements);
        boolean changed = registry.merge(declarations, code.size());
        var step = code.append(fragment, statements);
        version++;
        engine.invalidate();
        LOG.info(
            "Appended step {} ({} branch declaration(s){}); {} parameter(s) in total",
            step.index(),
            declarations.size(),
            changed ? ", parameters changed" : "",
            registry.parameters().size()
        );
        if (configuration.executeDefaultOnAdd()) {
            runDefaultUniverse();
        }
        return step.index();
    }

    private void runDefaultUniverse() {
        try {
            var universe = defaultUniverse();
            if (universe.isEmpty()) {
                LOG.warn("No valid universe; default universe not executed");
                return;
            }
            engine.execute(snapshot(), universe.get());
        } catch (MultiverseException ex) {
            LOG.warn("Default universe not executed: {}", ex.getMessage());
        }
    }

    public List<Parameter> parameters() {
        return registry.parameters();
    }

    public Optional<Parameter> parameter(String name) {
        return registry.find(name);
    }

    /**
     * Every valid universe, ids {@code 1..n}. Memoised until the parameter table changes.
     *
     * @throws NoValidUniverseException when the conditions exclude every combination
     */
    public synchronized List<Universe> universes() {
        if (universesVersion != registry.version()) {
            universes = expander.expand(registry.parameters());
            universesVersion = registry.version();
            LOG.debug("Expanded {} universe(s) from {} parameter(s)", universes.size(), registry.parameters().size());
        }
        return universes;
    }

    /**
     * The universe listing as a table: {@code .universe}, one column per parameter, then the execution
     * {@code .status} ({@code ok}, {@code failed} or {@code not_executed}) and the failure message in
     * {@code .error}.
     */
    public synchronized Table expand() {
        var columns = new ArrayList<String>();
        columns.add(ResultExtractor.UNIVERSE_COLUMN);
        registry.parameters().forEach(parameter -> columns.add(parameter.name()));
        columns.add(ResultExtractor.STATUS_COLUMN);
        columns.add(ResultExtractor.ERROR_COLUMN);
        var snapshot = snapshot();
        var builder = Table.builder(columns);
        for (var universe : universes()) {
            var result = engine.cached(snapshot, universe);
            var status = result.map(r -> r.succeeded() ? VariableStatus.OK : VariableStatus.FAILED)
                .orElse(VariableStatus.NOT_EXECUTED);
            var row = new ArrayList<Object>();
            row.add(universe.id());
            row.addAll(universe.assignment().values());
            row.add(status.label());
            row.add(result.filter(r -> !r.succeeded()).map(r -> r.failure().getMessage()).orElse(null));
            builder.addRow(row.toArray());
        }
        return builder.build();
    }

    /**
     * First valid universe in option order. Computed without a full expansion when none is memoised.
     */
    public synchronized Optional<Universe> defaultUniverse() {
        if (universesVersion == registry.version()) {
            return universes.stream().findFirst();
        }
        return expander.defaultUniverse(registry.parameters());
    }

    public synchronized Universe universe(int id) {
        var all = universes();
        if (id < 1 || id > all.size()) {
            throw new UnknownUniverseException(id, all.size());
        }
        return all.get(id - 1);
    }

    /**
     * All appended code, in order.
     */
    public String code() {
        return code.text();
    }

    /**
     * The code of one universe with every branch replaced by its chosen expression.
     */
    public synchronized String universeCode(int id) {
        return String.join("\n", UniverseRunner.render(snapshot(), universe(id)));
    }

    /**
     * Executes every valid universe, reusing cached results, and returns the results in id order.
     */
    public synchronized List<ExecutionResult> executeAll() {
        var all = universes();
        return engine.executeAll(snapshot(), all);
    }

    public synchronized ExecutionResult executeUniverse(int id) {
        return engine.execute(snapshot(), universe(id));
    }

    /**
     * Result of a universe if it has been executed against the current code.
     */
    public synchronized Optional<ExecutionResult> result(int id) {
        return engine.cached(snapshot(), universe(id));
    }

    /**
     * Gathers {@code name} from every universe. Universes that have not run are reported as not executed.
     */
    public synchronized Table extractVariable(String name) {
        Objects.requireNonNull(name, "name");
        var snapshot = snapshot();
        return ResultExtractor.extract(name, universes(), registry.parameters(), universe -> engine.cached(snapshot, universe));
    }

    /**
     * Incremented by every successful {@link #addCode(String)}.
     */
    public synchronized long version() {
        return version;
    }

    private ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(code.contentHash(), code.steps(), registry.parameters(), inputs, functions);
    }
}
