package io.surfworks.jobrunner.profile;

import io.surfworks.jobrunner.job.ResourceProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsProfilesInFileOrder() throws IOException {
        Path file = tempDir.resolve("profiles.json");
        Files.writeString(file, """
                {
                  "profiles": {
                    "pin": { "sbatch_args": ["--cpus-per-task=1"] },
                    "A100": { "sbatch_args": ["--gpus-per-task=a100:1", "--mem=64G"] }
                  }
                }
                """);

        ProfileRegistry registry = ProfileRegistry.load(file);

        assertEquals(List.of("pin", "A100"), registry.names());
        assertEquals(List.of("--gpus-per-task=a100:1", "--mem=64G"),
                registry.find("A100").orElseThrow().sbatchArgs());
        assertTrue(registry.find("H100").isEmpty());
    }

    @Test
    void savedRegistryLoadsBack() throws IOException {
        ProfileRegistry registry = ProfileRegistry.of(
                ResourceProfile.of("install", "--cpus-per-task=8"),
                ResourceProfile.of("H100", "--gres=gpu:h100:1"));
        Path file = tempDir.resolve("config").resolve("slurm-profiles.json");

        registry.save(file);
        ProfileRegistry loaded = ProfileRegistry.load(file);

        assertEquals(registry.names(), loaded.names());
        assertEquals(registry.find("H100"), loaded.find("H100"));
    }

    @Test
    void fileWithoutProfilesIsRejected() throws IOException {
        Path file = tempDir.resolve("profiles.json");
        Files.writeString(file, "{\"gpus\": {}}");

        assertThrows(IOException.class, () -> ProfileRegistry.load(file));
    }

    @Test
    void profileWithoutArgumentsIsRejected() throws IOException {
        Path file = tempDir.resolve("profiles.json");
        Files.writeString(file, "{\"profiles\": {\"A100\": {}}}");

        assertThrows(IOException.class, () -> ProfileRegistry.load(file));
    }

    @Test
    void withReturnsACopy() {
        ProfileRegistry empty = ProfileRegistry.empty();
        ProfileRegistry one = empty.with(ResourceProfile.of("cpu"));

        assertEquals(List.of(), empty.names());
        assertEquals(List.of("cpu"), one.names());
    }

    @Test
    void gpuProfilesAreRecognized() {
        assertTrue(ResourceProfile.of("A100", "--gpus-per-task=a100:1").requestsGpu());
        assertTrue(ResourceProfile.of("H100", "--gres=gpu:h100:1").requestsGpu());
        assertFalse(ResourceProfile.of("pin", "--cpus-per-task=1").requestsGpu());
    }
}
