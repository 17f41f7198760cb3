package fwapi.core.model.gc;

/**
 * Outcome of garbage-collecting one rule for one target VM.
 *
 * <p>Decisions are recomputed on every pass and never stored.
 */
public sealed interface GcDecision {

    /** The rule still selects a live endpoint, or is exempt from cleanup. */
    record Keep(String reason) implements GcDecision {}

    /** The rule can no longer match any VM. */
    record Delete(String reason) implements GcDecision {}

    /** A backend call failed; the pass must stop. */
    record Fail(String reason, Throwable cause) implements GcDecision {}

    default boolean isKeep() {
        return this instanceof Keep;
    }

    default boolean isDelete() {
        return this instanceof Delete;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * Short lowercase label, used for logs and metric tags.
     *
     * @return {@code keep}, {@code delete} or {@code fail}
     */
    default String outcome() {
        if (this instanceof Keep) {
            return "keep";
        }
        if (this instanceof Delete) {
            return "delete";
        }
        return "fail";
    }

    static GcDecision keep(String reason) {
        return new Keep(reason);
    }

    static GcDecision delete(String reason) {
        return new Delete(reason);
    }

    static GcDecision fail(String reason, Throwable cause) {
        return new Fail(reason, cause);
    }
}
