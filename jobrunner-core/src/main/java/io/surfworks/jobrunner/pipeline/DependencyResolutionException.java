package io.surfworks.jobrunner.pipeline;

/**
 * A node needed a predecessor id that was never produced.
 */
public class DependencyResolutionException extends PipelineException {

    public DependencyResolutionException(String message) {
        super(message);
    }
}
