package projectsdb.domain.event;

import java.time.Instant;

/**
 * Evento terminal que sustituye al resultado cuando una ejecución falla.
 */
public record PipelineFailure(Instant timestamp, FailureReason reason, String message) {
}
