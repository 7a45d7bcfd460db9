package io.surfworks.jobrunner.snapshot;

/**
 * A snapshot record names a node type that does not exist.
 */
public class UnknownVariantException extends SnapshotException {

    private final String type;

    public UnknownVariantException(String type) {
        super("Unknown node type: " + type);
        this.type = type;
    }

    /**
     * Returns the unrecognized discriminator.
     */
    public String type() {
        return type;
    }
}
