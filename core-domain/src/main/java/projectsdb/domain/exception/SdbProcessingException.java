package projectsdb.domain.exception;

import lombok.Getter;
import projectsdb.domain.event.FailureReason;

/**
 * Raíz de los errores de negocio del pipeline de batimetría.
 * Cada subclase corresponde a una {@link FailureReason} concreta.
 */
@Getter
public abstract class SdbProcessingException extends RuntimeException {

    private final FailureReason reason;

    protected SdbProcessingException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected SdbProcessingException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
