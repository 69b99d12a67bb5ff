package projectsdb.domain.event;

/**
 * Estados del pipeline. Estrictamente secuenciales, sin vuelta atrás:
 * IDLE → REPROJECTING → FILTERING → SAMPLING → SPLITTING → FITTING → PREDICTING_FULL → VALIDATING → DONE.
 * Cualquier error lleva a FAILED.
 */
public enum PipelineState {
    IDLE,
    REPROJECTING,
    FILTERING,
    SAMPLING,
    SPLITTING,
    FITTING,
    PREDICTING_FULL,
    VALIDATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
