package io.surfworks.jobrunner.job;

import java.util.Locale;

/**
 * Condition under which a job is released relative to its predecessors.
 * The wire form is the Slurm {@code --dependency} keyword.
 */
public enum DependencyEvent {
    /** Start once every predecessor has started */
    AFTER("after"),

    /** Start once every predecessor completed successfully */
    AFTER_OK("afterok"),

    /** Start once every predecessor terminated, whatever the outcome */
    AFTER_ANY("afterany"),

    /** Start once every predecessor terminated in failure */
    AFTER_NOT_OK("afternotok"),

    /** Start once no other job with the same name and user is running */
    SINGLETON("singleton");

    private final String keyword;

    DependencyEvent(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the scheduler keyword (e.g. "afterok").
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Returns true if this event is expressed against predecessor ids.
     */
    public boolean takesIds() {
        return this != SINGLETON;
    }

    /**
     * Parses a scheduler keyword or enum name.
     *
     * @throws IllegalArgumentException for unknown events
     */
    public static DependencyEvent fromKeyword(String keyword) {
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (DependencyEvent event : values()) {
            if (event.keyword.equals(normalized) || event.name().equalsIgnoreCase(normalized)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown dependency event: " + keyword);
    }
}
