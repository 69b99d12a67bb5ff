package projectsdb.domain.event;

/**
 * Causas tipificadas por las que una ejecución del pipeline termina en {@link PipelineState#FAILED}.
 */
public enum FailureReason {
    /** No hay ráster o muestra cargados. */
    MISSING_INPUT,
    /** Geometrías que no son puntos o columna de profundidad no numérica. */
    INVALID_SAMPLE_TYPE,
    /** Ningún punto de la muestra cae dentro de la rejilla del ráster. */
    OUT_OF_BOUNDS,
    /** Parámetros inválidos o combinación de método no soportada. */
    CONFIGURATION,
    /** Tras filtrar no quedan filas suficientes para entrenar y validar. */
    INSUFFICIENT_SAMPLES,
    /** Error no previsto; el detalle queda en el log. */
    UNEXPECTED
}
