package io.github.manjago.memsim.shell;

import io.github.manjago.memsim.core.PlacementStrategy;

/**
 * One parsed line of the allocator protocol.
 */
public sealed interface Command {

    /** {@code RQ <owner> <size> <strategy>} */
    record Request(String owner, int size, PlacementStrategy strategy) implements Command {}

    /** {@code RL <owner>} */
    record Release(String owner) implements Command {}

    /** {@code C} */
    record Compact() implements Command {}

    /** {@code STAT} */
    record Status() implements Command {}

    /** {@code X} */
    record Exit() implements Command {}

    /** Blank line. */
    record Empty() implements Command {}

    /** Known keyword with malformed arguments. */
    record Invalid(String input, String reason) implements Command {}

    /** Unrecognized keyword. */
    record Unknown(String input) implements Command {}
}
