package projectsdb.domain.exception;

import projectsdb.domain.event.FailureReason;

public class OutOfBoundsException extends SdbProcessingException {

    public OutOfBoundsException(String message) {
        super(FailureReason.OUT_OF_BOUNDS, message);
    }

    public OutOfBoundsException(String message, Throwable cause) {
        super(FailureReason.OUT_OF_BOUNDS, message, cause);
    }
}
