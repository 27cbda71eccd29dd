package work.lcod.multiverse.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.multiverse.error.EvaluationException;
import work.lcod.multiverse.runtime.ExecutionContext;
import work.lcod.multiverse.runtime.FunctionRegistry;
import work.lcod.multiverse.runtime.Values;
import work.lcod.multiverse.table.Table;

/**
 * Descriptive statistics and an ordinary least squares fit. Enough to drive demo analyses; real models are
 * registered by the embedding application.
 */
public final class StatsPrimitives {
    private StatsPrimitives() {}

    public static FunctionRegistry register(FunctionRegistry registry) {
        registry.register("mean", 1, (ctx, args) -> mean(nonEmpty(args.get(0), "mean")));
        registry.register("median", 1, (ctx, args) -> quantile(nonEmpty(args.get(0), "median"), 0.5));
        registry.register("var", 1, (ctx, args) -> variance(atLeastTwo(args.get(0), "var")));
        registry.register("sd", 1, (ctx, args) -> Math.sqrt(variance(atLeastTwo(args.get(0), "sd"))));
        registry.register("quantile", 2, StatsPrimitives::quantile);
        registry.register("cor", 2, StatsPrimitives::cor);
        registry.register("linear_fit", 3, StatsPrimitives::linearFit);
        return registry;
    }

    private static List<Double> nonEmpty(Object value, String function) {
        var values = CorePrimitives.numbers(value, function);
        if (values.isEmpty()) {
            throw new EvaluationException(function + "() of an empty list");
        }
        return values;
    }

    private static List<Double> atLeastTwo(Object value, String function) {
        var values = CorePrimitives.numbers(value, function);
        if (values.size() < 2) {
            throw new EvaluationException(function + "() needs at least two values but got " + values.size());
        }
        return values;
    }

    static double mean(List<Double> values) {
        return CorePrimitives.sum(values) / values.size();
    }

    static double variance(List<Double> values) {
        double mean = mean(values);
        double squares = 0;
        for (var value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / (values.size() - 1);
    }

    /**
     * Linear interpolation between order statistics (type 7).
     */
    static double quantile(List<Double> values, double probability) {
        var sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        double position = probability * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted.get(lower) + (position - lower) * (sorted.get(upper) - sorted.get(lower));
    }

    private static Object quantile(ExecutionContext ctx, List<Object> args) {
        double probability = Values.asNumber(args.get(1), "quantile() probability");
        if (probability < 0 || probability > 1) {
            throw new EvaluationException("quantile() probability must be within [0, 1] but got " + Values.display(probability));
        }
        return quantile(nonEmpty(args.get(0), "quantile"), probability);
    }

    private static Object cor(ExecutionContext ctx, List<Object> args) {
        var x = atLeastTwo(args.get(0), "cor");
        var y = atLeastTwo(args.get(1), "cor");
        if (x.size() != y.size()) {
            throw new EvaluationException("cor() needs equally long lists but got " + x.size() + " and " + y.size());
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < x.size(); i++) {
            double dx = x.get(i) - meanX;
            double dy = y.get(i) - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        return sxy / Math.sqrt(sxx * syy);
    }

    /**
     * {@code linear_fit(table, outcome, predictors)} regresses {@code outcome} on an intercept plus the predictor
     * columns. Rows with a missing value in any used column are dropped. Returns one row per term with
     * {@code term}, {@code estimate}, {@code std_error} and {@code t_value}.
     */
    private static Object linearFit(ExecutionContext ctx, List<Object> args) {
        var table = Values.asTable(args.get(0), "linear_fit()");
        var outcome = Values.asString(args.get(1), "linear_fit() outcome");
        var predictors = new ArrayList<String>();
        if (args.get(2) instanceof List<?> names) {
            names.forEach(name -> predictors.add(Values.asString(name, "linear_fit() predictor")));
        } else {
            predictors.add(Values.asString(args.get(2), "linear_fit() predictor"));
        }
        var used = new ArrayList<String>();
        used.add(outcome);
        used.addAll(predictors);
        for (var column : used) {
            if (!table.hasColumn(column)) {
                throw new EvaluationException("linear_fit(): table has no column '" + column + "'");
            }
        }

        var x = new ArrayList<double[]>();
        var y = new ArrayList<Double>();
        for (var row : table.rows()) {
            if (used.stream().anyMatch(column -> row.get(column) == null)) {
                continue;
            }
            var features = new double[predictors.size() + 1];
            features[0] = 1;
            for (int j = 0; j < predictors.size(); j++) {
                features[j + 1] = Values.asNumber(row.get(predictors.get(j)), "linear_fit() predictor '" + predictors.get(j) + "'");
            }
            x.add(features);
            y.add(Values.asNumber(row.get(outcome), "linear_fit() outcome '" + outcome + "'"));
        }
        int n = x.size();
        int p = predictors.size() + 1;
        if (n < p) {
            throw new EvaluationException("linear_fit() needs at least " + p + " complete rows but got " + n);
        }

        var xtx = new double[p][p];
        var xty = new double[p];
        for (int i = 0; i < n; i++) {
            var features = x.get(i);
            for (int a = 0; a < p; a++) {
                xty[a] += features[a] * y.get(i);
                for (int b = 0; b < p; b++) {
                    xtx[a][b] += features[a] * features[b];
                }
            }
        }
        var inverse = invert(xtx);
        var beta = new double[p];
        for (int a = 0; a < p; a++) {
            for (int b = 0; b < p; b++) {
                beta[a] += inverse[a][b] * xty[b];
            }
        }
        double rss = 0;
        for (int i = 0; i < n; i++) {
            double fitted = 0;
            for (int a = 0; a < p; a++) {
                fitted += x.get(i)[a] * beta[a];
            }
            rss += (y.get(i) - fitted) * (y.get(i) - fitted);
        }
        Double sigma2 = n > p ? rss / (n - p) : null;

        var rows = new ArrayList<Map<String, Object>>(p);
        for (int a = 0; a < p; a++) {
            var row = new LinkedHashMap<String, Object>();
            row.put("term", a == 0 ? "(Intercept)" : predictors.get(a - 1));
            row.put("estimate", beta[a]);
            Double se = sigma2 == null ? null : Math.sqrt(sigma2 * inverse[a][a]);
            row.put("std_error", se);
            row.put("t_value", se == null ? null : beta[a] / se);
            rows.add(row);
        }
        return new Table(List.of("term", "estimate", "std_error", "t_value"), rows);
    }

    /**
     * Gauss-Jordan elimination with partial pivoting.
     */
    private static double[][] invert(double[][] matrix) {
        int size = matrix.length;
        var work = new double[size][2 * size];
        for (int i = 0; i < size; i++) {
            System.arraycopy(matrix[i], 0, work[i], 0, size);
            work[i][size + i] = 1;
        }
        for (int col = 0; col < size; col++) {
            int pivot = col;
            for (int row = col + 1; row < size; row++) {
                if (Math.abs(work[row][col]) > Math.abs(work[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(work[pivot][col]) < 1e-12) {
                throw new EvaluationException("linear_fit(): predictors are collinear");
            }
            var swap = work[col];
            work[col] = work[pivot];
            work[pivot] = swap;
            double scale = work[col][col];
            for (int k = 0; k < 2 * size; k++) {
                work[col][k] /= scale;
            }
            for (int row = 0; row < size; row++) {
                if (row == col) {
                    continue;
                }
                double factor = work[row][col];
                for (int k = 0; k < 2 * size; k++) {
                    work[row][k] -= factor * work[col][k];
                }
            }
        }
        var inverse = new double[size][size];
        for (int i = 0; i < size; i++) {
            System.arraycopy(work[i], size, inverse[i], 0, size);
        }
        return inverse;
    }
}
