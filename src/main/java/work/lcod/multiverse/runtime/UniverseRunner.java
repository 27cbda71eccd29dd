package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.multiverse.error.UniverseExecutionException;
import work.lcod.multiverse.lang.Node;
import work.lcod.multiverse.lang.Renderer;
import work.lcod.multiverse.universe.Universe;

/**
 * Runs the steps of one universe sequentially in a private scope whose parent is the shared input scope.
 */
public final class UniverseRunner {
    private static final Logger LOG = LoggerFactory.getLogger(UniverseRunner.class);

    private UniverseRunner() {}

    public static ExecutionResult run(ExecutionSnapshot snapshot, Universe universe) {
        var rewriter = new StepRewriter(snapshot.parametersByName(), universe.assignment());
        var ctx = new ExecutionContext(snapshot.functions(), universe.id(), universe.assignment());
        var scope = snapshot.inputs().child();
        var steps = snapshot.steps();

        for (int index = 0; index < steps.size(); index++) {
            var staging = scope.child();
            try {
                var evaluator = new Evaluator(ctx, staging);
                for (var statement : rewriter.rewrite(steps.get(index).statements())) {
                    evaluator.evaluate(statement);
                }
            } catch (RuntimeException | StackOverflowError ex) {
                var failure = new UniverseExecutionException(universe.id(), index, ex);
                LOG.debug("{}", failure.getMessage());
                return new ExecutionResult(universe.id(), universe.assignment(), scope.locals(), index, failure);
            }
            staging.commitTo(scope);
        }
        LOG.trace("Universe {} completed {} step(s)", universe.id(), steps.size());
        return new ExecutionResult(universe.id(), universe.assignment(), scope.locals(), steps.size(), null);
    }

    /**
     * Canonical source of every step as it runs in the given universe.
     */
    public static List<String> render(ExecutionSnapshot snapshot, Universe universe) {
        var rewriter = new StepRewriter(snapshot.parametersByName(), universe.assignment());
        var rendered = new ArrayList<String>(snapshot.steps().size());
        for (var step : snapshot.steps()) {
            List<Node> statements = rewriter.rewrite(step.statements());
            rendered.add(Renderer.render(statements));
        }
        return List.copyOf(rendered);
    }
}
