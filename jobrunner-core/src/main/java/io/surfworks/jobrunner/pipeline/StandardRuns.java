package io.surfworks.jobrunner.pipeline;

/**
 * Ready-made job trees.
 */
public final class StandardRuns {

    /** GPU classes the standard benchmark fans out to */
    public static final String[] BENCHMARK_PROFILES = {
            "A100l", "A100", "A6000", "H100", "L40S", "rtx8000", "v100"
    };

    private StandardRuns() {
    }

    /**
     * Pin, install and prepare once, then run the benchmark on every GPU class.
     */
    public static Sequential benchmark() {
        JobNode[] runs = new JobNode[BENCHMARK_PROFILES.length];
        for (int i = 0; i < runs.length; i++) {
            runs[i] = new Job("run", BENCHMARK_PROFILES[i]);
        }
        return Sequential.of(
                new Job("pin", "pin"),
                new Job("install", "install"),
                new Job("prepare", "prepare"),
                Parallel.of(runs)
        );
    }
}
