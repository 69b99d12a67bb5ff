package projectsdb.processing.regressor;

import lombok.extern.slf4j.Slf4j;
import smile.math.kernel.GaussianKernel;
import smile.math.kernel.HyperbolicTangentKernel;
import smile.math.kernel.LinearKernel;
import smile.math.kernel.MercerKernel;
import smile.math.kernel.PolynomialKernel;
import smile.regression.Regression;
import smile.regression.SVR;
import projectsdb.config.SvmConfig;
import projectsdb.processing.parallel.ParallelContext;

/**
 * Regresión epsilon-SVR sobre las bandas en bruto.
 * <p>
 * Núcleos: lineal {@code <x,y>}, polinómico {@code (gamma<x,y>)^d}, RBF {@code exp(-gamma|x-y|^2)}
 * y sigmoide {@code tanh(gamma<x,y>)}. El entrenamiento (SMO) es secuencial; la predicción
 * se reparte por filas.
 */
@Slf4j
public class SupportVectorRegressor extends AbstractRegressor {

    private final SvmConfig config;
    private Regression<double[]> model;

    public SupportVectorRegressor(SvmConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "SVM";
    }

    @Override
    public String getDescription() {
        return String.format("núcleo=%s, gamma=%s, C=%s, epsilon=%s", config.kernel(), config.gamma(), config.c(), config.epsilon());
    }

    @Override
    protected void doFit(double[][] features, double[] targets, ParallelContext context) {
        log.debug("SVM: caché solicitada {} MB (orientativa).", config.cacheSizeMb());
        this.model = SVR.fit(features, targets, kernel(config), config.epsilon(), config.c(), config.tolerance());
    }

    @Override
    protected double[] doPredict(double[][] features, ParallelContext context) {
        return context.mapRows(features, model::predict);
    }

    static MercerKernel<double[]> kernel(SvmConfig config) {
        return switch (config.kernel()) {
            case LINEAR -> new LinearKernel();
            case POLYNOMIAL -> new PolynomialKernel(config.degree(), config.gamma(), 0.0);
            // exp(-|x-y|^2 / (2 sigma^2)) == exp(-gamma |x-y|^2)
            case RBF -> new GaussianKernel(Math.sqrt(1.0 / (2.0 * config.gamma())));
            case SIGMOID -> new HyperbolicTangentKernel(config.gamma(), 0.0);
        };
    }
}
