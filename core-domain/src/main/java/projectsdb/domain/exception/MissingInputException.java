package projectsdb.domain.exception;

import projectsdb.domain.event.FailureReason;

public class MissingInputException extends SdbProcessingException {

    public MissingInputException(String message) {
        super(FailureReason.MISSING_INPUT, message);
    }

    public MissingInputException(String message, Throwable cause) {
        super(FailureReason.MISSING_INPUT, message, cause);
    }
}
