package projectsdb.processing.regressor;

import lombok.extern.slf4j.Slf4j;
import projectsdb.processing.i.IRegressor;
import projectsdb.processing.parallel.ParallelContext;

/**
 * Base común de los estimadores: comprueba la forma de las entradas, registra la duración del
 * ajuste y exige un ajuste previo antes de predecir.
 */
@Slf4j
public abstract class AbstractRegressor implements IRegressor {

    private int featureCount = -1;
    private volatile boolean fitted;

    @Override
    public final void fit(double[][] features, double[] targets, ParallelContext context) {
        if (features == null || targets == null || features.length == 0) {
            throw new IllegalArgumentException(getName() + ": no hay datos de entrenamiento.");
        }
        if (features.length != targets.length) {
            throw new IllegalArgumentException(getName() + ": " + features.length + " filas y "
                    + targets.length + " objetivos.");
        }
        int columns = checkColumns(features, features[0].length);

        long start = System.nanoTime();
        doFit(features, targets, context);
        this.featureCount = columns;
        this.fitted = true;
        log.info("{} ajustado con {} muestras y {} bandas en {} ms.", getName(), features.length, columns,
                (System.nanoTime() - start) / 1_000_000);
    }

    @Override
    public final double[] predict(double[][] features, ParallelContext context) {
        if (!fitted) {
            throw new IllegalStateException(getName() + ": el modelo no está ajustado.");
        }
        if (features.length == 0) {
            return new double[0];
        }
        checkColumns(features, featureCount);
        return doPredict(features, context);
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    protected int getFeatureCount() {
        return featureCount;
    }

    protected abstract void doFit(double[][] features, double[] targets, ParallelContext context);

    protected abstract double[] doPredict(double[][] features, ParallelContext context);

    private int checkColumns(double[][] features, int expected) {
        for (int i = 0; i < features.length; i++) {
            if (features[i].length != expected) {
                throw new IllegalArgumentException(getName() + ": la fila " + i + " tiene " + features[i].length
                        + " columnas, se esperaban " + expected);
            }
        }
        return expected;
    }
}
