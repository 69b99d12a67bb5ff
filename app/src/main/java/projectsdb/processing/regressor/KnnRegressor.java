package projectsdb.processing.regressor;

import lombok.extern.slf4j.Slf4j;
import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;
import projectsdb.config.KnnConfig;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.processing.parallel.ParallelContext;

import java.util.Arrays;

/**
 * Regresión por k vecinos más cercanos con distancia euclídea.
 * <p>
 * Con ponderación por distancia, un vecino a distancia cero absorbe todo el peso
 * (si hay varios, se promedian entre ellos).
 */
@Slf4j
public class KnnRegressor extends AbstractRegressor {

    private final KnnConfig config;

    private double[][] keys;
    private double[] targets;
    private KDTree<Integer> tree;

    public KnnRegressor(KnnConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "KNN";
    }

    @Override
    public String getDescription() {
        return String.format("k=%d, ponderación=%s, búsqueda=%s, hoja=%d",
                config.neighbors(), config.weighting(), config.search(), config.leafSize());
    }

    @Override
    protected void doFit(double[][] features, double[] targets, ParallelContext context) {
        if (config.neighbors() > features.length) {
            throw new ConfigurationException("KNN: k=" + config.neighbors() + " supera el número de muestras de entrenamiento ("
                    + features.length + ")");
        }
        this.keys = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            keys[i] = features[i].clone();
        }
        this.targets = targets.clone();

        if (useTree(features.length)) {
            Integer[] index = new Integer[keys.length];
            for (int i = 0; i < index.length; i++) {
                index[i] = i;
            }
            this.tree = new KDTree<>(keys, index);
        } else {
            this.tree = null;
        }
        log.debug("KNN: búsqueda por {}", tree != null ? "KD-tree" : "fuerza bruta");
    }

    private boolean useTree(int n) {
        return switch (config.search()) {
            case KD_TREE -> true;
            case BRUTE -> false;
            case AUTO -> n > config.leafSize();
        };
    }

    @Override
    protected double[] doPredict(double[][] features, ParallelContext context) {
        return context.mapRows(features, this::predictOne);
    }

    private double predictOne(double[] query) {
        int k = config.neighbors();
        int[] index = new int[k];
        double[] distance = new double[k];
        if (tree != null) {
            // KDTree excluye las claves idénticas por referencia: se consulta con una copia.
            Neighbor<double[], Integer>[] found = tree.knn(query.clone(), k);
            for (int i = 0; i < k; i++) {
                index[i] = found[i].value;
                distance[i] = found[i].distance;
            }
        } else {
            bruteForce(query, index, distance);
        }
        return combine(index, distance);
    }

    private void bruteForce(double[] query, int[] index, double[] distance) {
        int k = index.length;
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        Arrays.fill(index, -1);
        for (int i = 0; i < keys.length; i++) {
            double d = euclidean(query, keys[i]);
            if (d >= distance[k - 1]) {
                continue;
            }
            // Inserción ordenada; los empates conservan el orden de entrenamiento.
            int pos = k - 1;
            while (pos > 0 && distance[pos - 1] > d) {
                distance[pos] = distance[pos - 1];
                index[pos] = index[pos - 1];
                pos--;
            }
            distance[pos] = d;
            index[pos] = i;
        }
    }

    private double combine(int[] index, double[] distance) {
        if (config.weighting() == KnnConfig.Weighting.UNIFORM) {
            double sum = 0.0;
            for (int i : index) {
                sum += targets[i];
            }
            return sum / index.length;
        }

        double exactSum = 0.0;
        int exactCount = 0;
        for (int i = 0; i < index.length; i++) {
            if (distance[i] == 0.0) {
                exactSum += targets[index[i]];
                exactCount++;
            }
        }
        if (exactCount > 0) {
            return exactSum / exactCount;
        }

        double weighted = 0.0;
        double weights = 0.0;
        for (int i = 0; i < index.length; i++) {
            double w = 1.0 / distance[i];
            weighted += w * targets[index[i]];
            weights += w;
        }
        return weighted / weights;
    }

    static double euclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
