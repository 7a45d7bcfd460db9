package io.surfworks.jobrunner.snapshot;

/**
 * A snapshot record lacks a field its type requires, or holds it with the wrong shape.
 */
public class MalformedRecordException extends SnapshotException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
