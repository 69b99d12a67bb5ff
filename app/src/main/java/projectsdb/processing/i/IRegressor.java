package projectsdb.processing.i;

import projectsdb.processing.parallel.ParallelContext;

/**
 * Estrategia de regresión intercambiable. El pipeline no implementa ningún algoritmo de
 * aprendizaje: prepara los datos y delega el ajuste y la predicción en esta abstracción.
 */
public interface IRegressor extends IProcessingComponent {

    /**
     * Ajusta el modelo.
     *
     * @param features Matriz (muestras × bandas).
     * @param targets  Profundidad de cada muestra.
     * @param context  Pool de trabajo de este paso; el estimador lo usa si su algoritmo lo permite.
     */
    void fit(double[][] features, double[] targets, ParallelContext context);

    /**
     * Predice una profundidad por fila de {@code features}, en el mismo orden.
     *
     * @throws IllegalStateException si el modelo no se ha ajustado.
     */
    double[] predict(double[][] features, ParallelContext context);

    boolean isFitted();
}
