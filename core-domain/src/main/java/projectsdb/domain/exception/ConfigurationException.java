package projectsdb.domain.exception;

import projectsdb.domain.event.FailureReason;

public class ConfigurationException extends SdbProcessingException {

    public ConfigurationException(String message) {
        super(FailureReason.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureReason.CONFIGURATION, message, cause);
    }
}
