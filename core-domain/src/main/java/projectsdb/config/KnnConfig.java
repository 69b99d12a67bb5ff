package projectsdb.config;

import lombok.Builder;
import lombok.With;
import projectsdb.domain.exception.ConfigurationException;

/**
 * Opciones de la regresión por k vecinos más cercanos.
 *
 * @param neighbors Número de vecinos (k).
 * @param weighting Ponderación de los vecinos.
 * @param search    Estructura de búsqueda.
 * @param leafSize  Tamaño de hoja: en modo AUTO, conjuntos de entrenamiento de este tamaño
 *                  o menores se resuelven por fuerza bruta.
 */
@Builder
@With
public record KnnConfig(
        int neighbors,
        Weighting weighting,
        Search search,
        int leafSize
) implements MethodConfig {

    public static KnnConfig defaults() {
        return new KnnConfig(5, Weighting.DISTANCE, Search.AUTO, 30);
    }

    @Override
    public RegressionMethod method() {
        return RegressionMethod.KNN;
    }

    @Override
    public void validate() {
        if (neighbors < 1) {
            throw new ConfigurationException("KNN: el número de vecinos debe ser >= 1 (" + neighbors + ")");
        }
        if (leafSize < 1) {
            throw new ConfigurationException("KNN: el tamaño de hoja debe ser >= 1 (" + leafSize + ")");
        }
        if (weighting == null || search == null) {
            throw new ConfigurationException("KNN: faltan la ponderación o el algoritmo de búsqueda.");
        }
    }

    public enum Weighting {
        UNIFORM,
        /** Inverso de la distancia. */
        DISTANCE
    }

    public enum Search {
        AUTO,
        KD_TREE,
        BRUTE
    }
}
