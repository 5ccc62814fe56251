package com.threatintel.auth.domain;

import java.util.function.Predicate;

/**
 * A condition compiled into an executable lambda, evaluated against an {@link EventRecord}.
 * <p>
 * This is the in-process alternative to a query expression: stream consumers and
 * notification dispatch test events against it without going through a database.
 *
 * @see com.threatintel.auth.engine.PredicateCompiler
 */
@FunctionalInterface
public interface CompiledCondition extends Predicate<EventRecord> {

    /**
     * Evaluates this condition against the given event.
     *
     * @param event the event
     * @return true if condition matches, false otherwise
     */
    boolean matches(EventRecord event);

    @Override
    default boolean test(EventRecord event) {
        return matches(event);
    }

    default CompiledCondition and(CompiledCondition other) {
        return event -> this.matches(event) && other.matches(event);
    }

    default CompiledCondition or(CompiledCondition other) {
        return event -> this.matches(event) || other.matches(event);
    }

    default CompiledCondition not() {
        return event -> !this.matches(event);
    }
}
