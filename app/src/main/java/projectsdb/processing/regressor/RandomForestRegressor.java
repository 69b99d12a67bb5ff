package projectsdb.processing.regressor;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.regression.RegressionTree;
import projectsdb.config.RandomForestConfig;
import projectsdb.processing.parallel.ParallelContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Bosque aleatorio de regresión: ensamble por bagging de árboles CART con reducción de varianza.
 * <p>
 * Cada árbol usa la semilla {@code seed + índice}, así que el resultado es el mismo con
 * cualquier número de trabajadores. La predicción es la media de los árboles.
 */
@Slf4j
public class RandomForestRegressor extends AbstractRegressor {

    static final String TARGET = "depth";

    private final RandomForestConfig config;
    private List<RegressionTree> trees = List.of();

    public RandomForestRegressor(RandomForestConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "RF";
    }

    @Override
    public String getDescription() {
        return String.format("%d árboles, bootstrap=%s, semilla=%d, profundidad<=%d",
                config.trees(), config.bootstrap(), config.seed(), config.maxDepth());
    }

    @Override
    protected void doFit(double[][] features, double[] targets, ParallelContext context) {
        int n = features.length;
        String[] names = columnNames(features[0].length);
        Formula formula = Formula.lhs(TARGET);

        List<Callable<RegressionTree>> tasks = new ArrayList<>(config.trees());
        for (int t = 0; t < config.trees(); t++) {
            final long treeSeed = config.seed() + t;
            tasks.add(() -> {
                int[] rows = config.bootstrap() ? bootstrap(n, treeSeed) : identity(n);
                DataFrame frame = DataFrame.of(withTarget(features, targets, rows), names);
                return RegressionTree.fit(formula, frame, config.maxDepth(), Math.max(2, n), config.nodeSize());
            });
        }
        this.trees = List.copyOf(context.invokeAll(tasks));
    }

    @Override
    protected double[] doPredict(double[][] features, ParallelContext context) {
        // La columna objetivo va a cero: solo se necesita para que el esquema coincida con el de ajuste.
        DataFrame frame = DataFrame.of(withTarget(features, new double[features.length], identity(features.length)),
                columnNames(features[0].length));
        double[] out = new double[features.length];

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int[] range : context.chunks(features.length)) {
            final int from = range[0];
            final int to = range[1];
            tasks.add(() -> {
                for (int i = from; i < to; i++) {
                    Tuple row = frame.get(i);
                    double sum = 0.0;
                    for (RegressionTree tree : trees) {
                        sum += tree.predict(row);
                    }
                    out[i] = sum / trees.size();
                }
                return null;
            });
        }
        context.invokeAll(tasks);
        return out;
    }

    public int getTreeCount() {
        return trees.size();
    }

    static int[] bootstrap(int n, long seed) {
        MersenneTwister rng = new MersenneTwister(seed);
        int[] rows = new int[n];
        for (int i = 0; i < n; i++) {
            rows[i] = rng.nextInt(n);
        }
        return rows;
    }

    private static int[] identity(int n) {
        int[] rows = new int[n];
        for (int i = 0; i < n; i++) {
            rows[i] = i;
        }
        return rows;
    }

    private static double[][] withTarget(double[][] features, double[] targets, int[] rows) {
        int p = features[0].length;
        double[][] data = new double[rows.length][p + 1];
        for (int i = 0; i < rows.length; i++) {
            System.arraycopy(features[rows[i]], 0, data[i], 0, p);
            data[i][p] = targets[rows[i]];
        }
        return data;
    }

    private static String[] columnNames(int bands) {
        String[] names = new String[bands + 1];
        for (int b = 0; b < bands; b++) {
            names[b] = "band" + (b + 1);
        }
        names[bands] = TARGET;
        return names;
    }
}
