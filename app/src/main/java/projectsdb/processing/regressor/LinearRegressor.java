package projectsdb.processing.regressor;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.StatUtils;
import projectsdb.config.MlrConfig;
import projectsdb.processing.parallel.ParallelContext;

/**
 * Regresión lineal múltiple por mínimos cuadrados ordinarios.
 * <p>
 * Se resuelve con la pseudoinversa (SVD), de modo que bandas colineales o menos muestras que
 * bandas producen la solución de norma mínima en lugar de un error. Con término independiente,
 * las columnas se centran antes de resolver.
 */
@Slf4j
public class LinearRegressor extends AbstractRegressor {

    private final MlrConfig config;

    private double[] coefficients;
    private double intercept;

    public LinearRegressor(MlrConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "MLR";
    }

    @Override
    public String getDescription() {
        return "Mínimos cuadrados, intercepto=" + config.fitIntercept();
    }

    @Override
    protected void doFit(double[][] features, double[] targets, ParallelContext context) {
        int n = features.length;
        int p = features[0].length;

        double[] columnMeans = new double[p];
        double targetMean = 0.0;
        if (config.fitIntercept()) {
            for (double[] row : features) {
                for (int j = 0; j < p; j++) {
                    columnMeans[j] += row[j];
                }
            }
            for (int j = 0; j < p; j++) {
                columnMeans[j] /= n;
            }
            targetMean = StatUtils.mean(targets);
        }

        // Array2DRowRealMatrix copia siempre; la entrada del llamador nunca se modifica.
        double[][] design = new double[n][p];
        double[] response = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                design[i][j] = features[i][j] - columnMeans[j];
            }
            response[i] = targets[i] - targetMean;
        }

        RealVector solution = new SingularValueDecomposition(new Array2DRowRealMatrix(design, false))
                .getSolver()
                .solve(new ArrayRealVector(response, false));
        this.coefficients = solution.toArray();

        double offset = 0.0;
        for (int j = 0; j < p; j++) {
            offset += coefficients[j] * columnMeans[j];
        }
        this.intercept = config.fitIntercept() ? targetMean - offset : 0.0;
        log.debug("MLR: intercepto={}, coeficientes={}", intercept, coefficients);
    }

    @Override
    protected double[] doPredict(double[][] features, ParallelContext context) {
        return context.mapRows(features, row -> {
            double value = intercept;
            for (int j = 0; j < coefficients.length; j++) {
                value += coefficients[j] * row[j];
            }
            return value;
        });
    }

    public double[] getCoefficients() {
        return coefficients == null ? null : coefficients.clone();
    }

    public double getIntercept() {
        return intercept;
    }
}
