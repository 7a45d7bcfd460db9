package io.surfworks.jobrunner.scheduler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry for scheduler implementations.
 *
 * <p>Thread-safe. Schedulers are created on demand via factory functions.
 */
public final class SchedulerRegistry {

    private static final Map<String, Supplier<Scheduler>> FACTORIES = new ConcurrentHashMap<>();

    private SchedulerRegistry() {} // Utility class

    /**
     * Registers a scheduler factory.
     *
     * @param name    Scheduler name (e.g. "slurm")
     * @param factory Factory function that creates scheduler instances
     */
    public static void register(String name, Supplier<Scheduler> factory) {
        FACTORIES.put(name.toLowerCase(), factory);
    }

    /**
     * Checks if a scheduler is registered.
     */
    public static boolean isRegistered(String name) {
        return FACTORIES.containsKey(name.toLowerCase());
    }

    /**
     * Gets a new instance of a registered scheduler.
     *
     * @throws IllegalArgumentException if the scheduler is not registered
     */
    public static Scheduler get(String name) {
        Supplier<Scheduler> factory = FACTORIES.get(name.toLowerCase());
        if (factory == null) {
            throw new IllegalArgumentException(
                    "Scheduler '" + name + "' not registered. Available: " + available());
        }
        return factory.get();
    }

    /**
     * Gets list of available scheduler names.
     */
    public static List<String> available() {
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Clears all registered schedulers (mainly for testing).
     */
    public static void clear() {
        FACTORIES.clear();
    }
}
