package projectsdb.config;

import lombok.Builder;
import lombok.With;
import projectsdb.domain.exception.ConfigurationException;

/**
 * Opciones de la regresión por vectores de soporte (epsilon-SVR).
 *
 * @param kernel      Función núcleo.
 * @param gamma       Coeficiente del núcleo (no se usa con LINEAR).
 * @param c           Penalización C.
 * @param degree      Grado del polinomio; solo aplica al núcleo POLYNOMIAL.
 * @param epsilon     Anchura del tubo insensible.
 * @param tolerance   Tolerancia del criterio de parada.
 * @param cacheSizeMb Pista de memoria para la caché del núcleo durante el entrenamiento.
 */
@Builder
@With
public record SvmConfig(
        Kernel kernel,
        double gamma,
        double c,
        int degree,
        double epsilon,
        double tolerance,
        int cacheSizeMb
) implements MethodConfig {

    public static SvmConfig defaults() {
        return new SvmConfig(Kernel.RBF, 0.1, 1000.0, 3, 0.1, 1e-3, 8000);
    }

    @Override
    public RegressionMethod method() {
        return RegressionMethod.SVM;
    }

    @Override
    public void validate() {
        if (kernel == null) {
            throw new ConfigurationException("SVM: falta el núcleo.");
        }
        if (!(c > 0.0)) {
            throw new ConfigurationException("SVM: la penalización C debe ser > 0 (" + c + ")");
        }
        if (kernel != Kernel.LINEAR && !(gamma > 0.0)) {
            throw new ConfigurationException("SVM: gamma debe ser > 0 para el núcleo " + kernel + " (" + gamma + ")");
        }
        if (kernel == Kernel.POLYNOMIAL && degree < 1) {
            throw new ConfigurationException("SVM: el grado del polinomio debe ser >= 1 (" + degree + ")");
        }
        if (!(epsilon > 0.0) || !(tolerance > 0.0)) {
            throw new ConfigurationException("SVM: epsilon y la tolerancia deben ser > 0.");
        }
        if (cacheSizeMb < 1) {
            throw new ConfigurationException("SVM: tamaño de caché inválido (" + cacheSizeMb + " MB)");
        }
    }

    public enum Kernel {
        LINEAR,
        POLYNOMIAL,
        RBF,
        SIGMOID
    }
}
