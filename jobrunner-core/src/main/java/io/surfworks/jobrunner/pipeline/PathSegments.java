package io.surfworks.jobrunner.pipeline;

/**
 * Checks for names that become output-directory segments.
 */
final class PathSegments {

    private PathSegments() {
    }

    /**
     * Returns the value if it is a single plain path segment.
     *
     * @throws IllegalArgumentException if it is blank or contains a separator or {@code ..}
     */
    static String require(String value, String what) {
        if (value.isBlank() || value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException(what + " must be a plain path segment: '" + value + "'");
        }
        return value;
    }
}
