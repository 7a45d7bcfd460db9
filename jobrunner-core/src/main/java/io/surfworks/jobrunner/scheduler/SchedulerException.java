package io.surfworks.jobrunner.scheduler;

/**
 * Exception thrown when a scheduler operation fails.
 */
public class SchedulerException extends Exception {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
