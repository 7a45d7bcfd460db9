package io.surfworks.jobrunner.job;

import java.util.List;
import java.util.Objects;

/**
 * A dependency clause attached to a submission.
 *
 * <p>Renders as {@code <event>:<id>[,<id>...]}. All listed ids must satisfy
 * the event (AND semantic). {@link #OR} is reserved for either-of sets and is
 * never produced here, but ids containing either separator are rejected.
 *
 * @param event       Release condition
 * @param externalIds Predecessor ids, in declared order
 */
public record Dependency(DependencyEvent event, List<String> externalIds) {

    /** Separator for predecessors that must all satisfy the event */
    public static final String AND = ",";

    /** Separator for predecessors of which any one satisfies the event */
    public static final String OR = "?";

    public Dependency {
        Objects.requireNonNull(event, "event cannot be null");
        Objects.requireNonNull(externalIds, "externalIds cannot be null");

        externalIds = List.copyOf(externalIds);
        if (event.takesIds() && externalIds.isEmpty()) {
            throw new IllegalArgumentException(event.keyword() + " requires at least one job id");
        }
        for (String id : externalIds) {
            requireValidId(id);
        }
    }

    /**
     * Creates a dependency on all the given ids.
     */
    public static Dependency on(DependencyEvent event, List<String> externalIds) {
        return new Dependency(event, externalIds);
    }

    /**
     * Creates an {@code afterok} dependency on all the given ids.
     */
    public static Dependency afterOk(String... externalIds) {
        return new Dependency(DependencyEvent.AFTER_OK, List.of(externalIds));
    }

    /**
     * Returns the predecessor ids joined with {@link #AND}.
     */
    public String joinedIds() {
        return String.join(AND, externalIds);
    }

    /**
     * Returns the clause value, e.g. {@code afterok:12,13}.
     */
    public String toClause() {
        if (!event.takesIds()) {
            return event.keyword();
        }
        return event.keyword() + ":" + joinedIds();
    }

    /**
     * Returns the scheduler argument, e.g. {@code --dependency=afterok:12,13}.
     */
    public String toArgument() {
        return "--dependency=" + toClause();
    }

    /**
     * Returns true if the id is non-blank and free of the reserved separators.
     */
    public static boolean isValidId(String externalId) {
        return externalId != null
                && !externalId.isBlank()
                && !externalId.contains(AND)
                && !externalId.contains(OR);
    }

    /**
     * Checks that an id may appear in a dependency clause.
     *
     * @throws IllegalArgumentException if the id is blank or contains a reserved separator
     */
    public static String requireValidId(String externalId) {
        if (!isValidId(externalId)) {
            throw new IllegalArgumentException("Invalid job id for dependency: '" + externalId + "'");
        }
        return externalId;
    }
}
