package io.surfworks.jobrunner.job;

import java.util.List;
import java.util.Objects;

/**
 * Named resource/environment profile a job runs under, e.g. a GPU class.
 *
 * @param name       Profile name as referenced by jobs
 * @param sbatchArgs Scheduler arguments the profile expands to
 */
public record ResourceProfile(String name, List<String> sbatchArgs) {

    public ResourceProfile {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(sbatchArgs, "sbatchArgs cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        sbatchArgs = List.copyOf(sbatchArgs);
    }

    /**
     * Creates a profile from its arguments.
     */
    public static ResourceProfile of(String name, String... sbatchArgs) {
        return new ResourceProfile(name, List.of(sbatchArgs));
    }

    /**
     * Returns true if the profile requests GPUs.
     */
    public boolean requestsGpu() {
        return sbatchArgs.stream().anyMatch(arg -> arg.startsWith("--gpus") || arg.startsWith("--gres=gpu"));
    }
}
