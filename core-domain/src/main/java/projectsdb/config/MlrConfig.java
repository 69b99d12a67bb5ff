package projectsdb.config;

import lombok.Builder;
import lombok.With;

/**
 * Opciones de la regresión lineal múltiple por mínimos cuadrados.
 *
 * @param fitIntercept Ajusta el término independiente.
 * @param copyInput    Copia la matriz de entrada antes de ajustar.
 */
@Builder
@With
public record MlrConfig(
        boolean fitIntercept,
        boolean copyInput
) implements MethodConfig {

    public static MlrConfig defaults() {
        return new MlrConfig(true, true);
    }

    @Override
    public RegressionMethod method() {
        return RegressionMethod.MLR;
    }

    @Override
    public void validate() {
        // Cualquier combinación de flags es válida.
    }
}
