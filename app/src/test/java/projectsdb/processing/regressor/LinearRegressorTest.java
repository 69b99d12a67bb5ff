package projectsdb.processing.regressor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsdb.config.MlrConfig;
import projectsdb.processing.parallel.ParallelContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LinearRegressorTest {

    private static final double[][] X = {{1, 2}, {2, 1}, {3, 5}, {4, 3}, {5, 8}, {6, 2}};

    private static double[] targets(double intercept, double b1, double b2) {
        double[] y = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            y[i] = intercept + b1 * X[i][0] + b2 * X[i][1];
        }
        return y;
    }

    @Test
    @DisplayName("Recupera coeficientes e intercepto exactos de datos lineales")
    void fit_recoversLinearModel() {
        LinearRegressor mlr = new LinearRegressor(MlrConfig.defaults());

        mlr.fit(X, targets(-3.0, 0.5, -1.25), ParallelContext.sequential());

        assertThat(mlr.getIntercept()).isCloseTo(-3.0, within(1e-9));
        assertThat(mlr.getCoefficients()).containsExactly(new double[]{0.5, -1.25}, within(1e-9));
        assertThat(mlr.predict(new double[][]{{10, 10}}, ParallelContext.sequential())[0]).isCloseTo(-10.5, within(1e-9));
    }

    @Test
    @DisplayName("Sin intercepto el modelo pasa por el origen")
    void fit_withoutIntercept() {
        LinearRegressor mlr = new LinearRegressor(new MlrConfig(false, true));

        mlr.fit(X, targets(0.0, 2.0, 1.0), ParallelContext.sequential());

        assertThat(mlr.getIntercept()).isZero();
        assertThat(mlr.predict(new double[][]{{0, 0}}, ParallelContext.sequential())[0]).isZero();
        assertThat(mlr.getCoefficients()).containsExactly(new double[]{2.0, 1.0}, within(1e-9));
    }

    @Test
    @DisplayName("Bandas colineales no rompen el ajuste y la predicción sigue siendo exacta")
    void fit_collinearBands() {
        double[][] x = {{1, 2}, {2, 4}, {3, 6}, {4, 8}};
        double[] y = {-2, -4, -6, -8};
        LinearRegressor mlr = new LinearRegressor(MlrConfig.defaults());

        mlr.fit(x, y, ParallelContext.sequential());

        assertThat(mlr.predict(new double[][]{{5, 10}}, ParallelContext.sequential())[0]).isCloseTo(-10.0, within(1e-9));
    }

    @Test
    @DisplayName("El ajuste no modifica los arrays del llamador")
    void fit_doesNotMutateInput() {
        double[][] x = {{1, 2}, {2, 1}, {3, 5}};
        double[] y = {-1, -2, -3};

        new LinearRegressor(MlrConfig.defaults()).fit(x, y, ParallelContext.sequential());

        assertThat(x[0]).containsExactly(1, 2);
        assertThat(y).containsExactly(-1, -2, -3);
    }
}
