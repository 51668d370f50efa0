package io.github.manjago.memsim.core;

/**
 * Snapshot of allocator statistics.
 */
public record AllocatorStats(
    int capacity,
    int blockCount,
    int freeBlockCount,
    int usedMemory,
    int freeMemory,
    int largestFreeBlock,
    double fragmentation,
    int allocations,
    int failedAllocations,
    int releases,
    int failedReleases,
    int compactions,
    int blocksRelocated
) {

    /**
     * Share of the address space currently allocated, in percent.
     */
    public double usagePercent() {
        return capacity > 0 ? 100.0 * usedMemory / capacity : 0;
    }

    /**
     * Share of allocation requests that failed, in percent.
     */
    public double allocationFailurePercent() {
        int requests = allocations + failedAllocations;
        return requests > 0 ? 100.0 * failedAllocations / requests : 0;
    }

    @Override
    public String toString() {
        return String.format("""
            === Allocator Statistics ===
            Memory:
              Used:             %,d / %,d (%.1f%%)
              Free:             %,d in %,d block(s)
              Largest free:     %,d
              Fragmentation:    %.1f%%
              Blocks:           %,d

            Requests:
              Allocations:      %,d ok, %,d failed (%.1f%% failed)
              Releases:         %,d ok, %,d unknown owner
              Compactions:      %,d (%,d blocks relocated)
            """,
            usedMemory, capacity, usagePercent(),
            freeMemory, freeBlockCount,
            largestFreeBlock,
            fragmentation * 100,
            blockCount,
            allocations, failedAllocations, allocationFailurePercent(),
            releases, failedReleases,
            compactions, blocksRelocated
        );
    }
}
