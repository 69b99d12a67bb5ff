package projectsdb.domain.exception;

import projectsdb.domain.event.FailureReason;

public class InvalidSampleTypeException extends SdbProcessingException {

    public InvalidSampleTypeException(String message) {
        super(FailureReason.INVALID_SAMPLE_TYPE, message);
    }

    public InvalidSampleTypeException(String message, Throwable cause) {
        super(FailureReason.INVALID_SAMPLE_TYPE, message, cause);
    }
}
