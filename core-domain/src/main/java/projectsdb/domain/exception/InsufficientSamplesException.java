package projectsdb.domain.exception;

import projectsdb.domain.event.FailureReason;

public class InsufficientSamplesException extends SdbProcessingException {

    public InsufficientSamplesException(String message) {
        super(FailureReason.INSUFFICIENT_SAMPLES, message);
    }

    public InsufficientSamplesException(String message, Throwable cause) {
        super(FailureReason.INSUFFICIENT_SAMPLES, message, cause);
    }
}
