package io.github.manjago.memsim.core;

/**
 * Outcome of an allocation request.
 *
 * None of the failures are exceptional: the partition is left untouched and the
 * caller decides how to report it.
 */
public enum AllocationResult {

    /** Block allocated. */
    ALLOCATED,

    /** No free block is large enough for the request. */
    INSUFFICIENT_MEMORY,

    /** Requested size is zero or negative. */
    INVALID_SIZE,

    /** The owner already holds a block and the allocator runs with {@link OwnerPolicy#SINGLE}. */
    DUPLICATE_OWNER;

    public boolean isSuccess() {
        return this == ALLOCATED;
    }
}
