package projectsdb.config;

import lombok.Builder;
import lombok.With;
import projectsdb.domain.exception.ConfigurationException;

/**
 * Opciones del bosque aleatorio (ensamble de árboles de regresión por bagging).
 *
 * @param trees     Número de árboles.
 * @param criterion Criterio de partición de los nodos.
 * @param bootstrap Remuestreo con reemplazo por árbol. Sin él, cada árbol ve todo el entrenamiento.
 * @param seed      Semilla del remuestreo.
 * @param maxDepth  Profundidad máxima de cada árbol.
 * @param nodeSize  Número de muestras por debajo del cual un nodo no se divide.
 */
@Builder
@With
public record RandomForestConfig(
        int trees,
        SplitCriterion criterion,
        boolean bootstrap,
        long seed,
        int maxDepth,
        int nodeSize
) implements MethodConfig {

    public static RandomForestConfig defaults() {
        return new RandomForestConfig(300, SplitCriterion.SQUARED_ERROR, true, 0L, 64, 2);
    }

    @Override
    public RegressionMethod method() {
        return RegressionMethod.RF;
    }

    @Override
    public void validate() {
        if (trees < 1) {
            throw new ConfigurationException("RF: el número de árboles debe ser >= 1 (" + trees + ")");
        }
        if (criterion == null) {
            throw new ConfigurationException("RF: falta el criterio de partición.");
        }
        if (criterion != SplitCriterion.SQUARED_ERROR) {
            throw new ConfigurationException("RF: criterio no soportado: " + criterion
                    + ". Solo se admite reducción de varianza (SQUARED_ERROR).");
        }
        if (maxDepth < 2) {
            throw new ConfigurationException("RF: la profundidad máxima debe ser >= 2 (" + maxDepth + ")");
        }
        if (nodeSize < 2) {
            throw new ConfigurationException("RF: el tamaño de nodo debe ser >= 2 (" + nodeSize + ")");
        }
    }

    public enum SplitCriterion {
        SQUARED_ERROR,
        ABSOLUTE_ERROR
    }
}
