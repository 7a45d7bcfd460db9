package io.surfworks.jobrunner.snapshot;

import io.surfworks.jobrunner.pipeline.PipelineException;

/**
 * A persisted snapshot cannot be turned back into a tree.
 *
 * <p>Decoding is all or nothing: no partial tree is ever returned.
 */
public class SnapshotException extends PipelineException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
