package io.surfworks.jobrunner.pipeline;

import io.surfworks.jobrunner.job.ResourceProfile;
import io.surfworks.jobrunner.profile.ProfileRegistry;
import io.surfworks.jobrunner.profile.ScriptTemplates;
import io.surfworks.jobrunner.scheduler.Scheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds a compiler over a temp directory with templates and profiles for every
 * script and profile name the pipeline tests use.
 */
final class CompilerFixture {

    static final String[] SCRIPTS = {"a", "b", "c", "d", "e", "pin", "install", "prepare", "run"};

    private CompilerFixture() {
    }

    static DependencyCompiler create(Scheduler scheduler, Path dir) throws IOException {
        Path templates = dir.resolve("templates");
        Files.createDirectories(templates);
        for (String script : SCRIPTS) {
            Files.writeString(templates.resolve(script + ScriptTemplates.EXTENSION),
                    "#!/bin/bash\necho " + script + "\n");
        }

        ProfileRegistry profiles = ProfileRegistry.of(
                ResourceProfile.of("cpu", "--cpus-per-task=4"),
                ResourceProfile.of("pin", "--cpus-per-task=1"),
                ResourceProfile.of("install", "--cpus-per-task=8"),
                ResourceProfile.of("prepare", "--cpus-per-task=8"));
        for (String gpu : StandardRuns.BENCHMARK_PROFILES) {
            profiles = profiles.with(ResourceProfile.of(gpu, "--gpus-per-task=" + gpu.toLowerCase() + ":1"));
        }

        return new DependencyCompiler(scheduler, profiles, new ScriptTemplates(templates), dir.resolve("work"));
    }
}
