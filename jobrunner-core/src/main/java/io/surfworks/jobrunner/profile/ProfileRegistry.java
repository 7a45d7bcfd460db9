package io.surfworks.jobrunner.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.jobrunner.job.ResourceProfile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named resource profiles jobs refer to.
 *
 * <p>File format:
 * <pre>
 * {
 *   "profiles": {
 *     "A100": { "sbatch_args": ["--gpus-per-task=a100l:1", "--cpus-per-task=8"] }
 *   }
 * }
 * </pre>
 *
 * <p>Immutable; {@link #with(ResourceProfile)} returns a copy.
 */
public final class ProfileRegistry {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, ResourceProfile> profiles;

    private ProfileRegistry(Map<String, ResourceProfile> profiles) {
        this.profiles = profiles;
    }

    /**
     * Returns a registry with the given profiles.
     */
    public static ProfileRegistry of(ResourceProfile... profiles) {
        Map<String, ResourceProfile> map = new LinkedHashMap<>();
        for (ResourceProfile profile : profiles) {
            map.put(profile.name(), profile);
        }
        return new ProfileRegistry(map);
    }

    /**
     * Returns an empty registry.
     */
    public static ProfileRegistry empty() {
        return new ProfileRegistry(Map.of());
    }

    /**
     * Loads profiles from a JSON file.
     *
     * @throws IOException if the file cannot be read or is not a profile file
     */
    public static ProfileRegistry load(Path file) throws IOException {
        JsonNode root = JSON.readTree(file.toFile());
        JsonNode node = root == null ? null : root.get("profiles");
        if (node == null || !node.isObject()) {
            throw new IOException("Missing 'profiles' object in " + file);
        }

        Map<String, ResourceProfile> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode args = entry.getValue().get("sbatch_args");
            if (args == null || !args.isArray()) {
                throw new IOException("Profile '" + entry.getKey() + "' has no 'sbatch_args' array in " + file);
            }
            List<String> sbatchArgs = new ArrayList<>();
            args.forEach(arg -> sbatchArgs.add(arg.asText()));
            map.put(entry.getKey(), new ResourceProfile(entry.getKey(), sbatchArgs));
        }
        return new ProfileRegistry(map);
    }

    /**
     * Saves profiles to a JSON file.
     */
    public void save(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        ObjectNode node = root.putObject("profiles");
        for (ResourceProfile profile : profiles.values()) {
            ArrayNode args = node.putObject(profile.name()).putArray("sbatch_args");
            profile.sbatchArgs().forEach(args::add);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
    }

    /**
     * Looks up a profile by name.
     */
    public Optional<ResourceProfile> find(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /**
     * Returns a copy with the profile added or replaced.
     */
    public ProfileRegistry with(ResourceProfile profile) {
        Map<String, ResourceProfile> map = new LinkedHashMap<>(profiles);
        map.put(profile.name(), profile);
        return new ProfileRegistry(map);
    }

    /**
     * Returns profile names in definition order.
     */
    public List<String> names() {
        return List.copyOf(profiles.keySet());
    }
}
