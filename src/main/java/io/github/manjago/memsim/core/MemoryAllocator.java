package io.github.manjago.memsim.core;

import java.util.List;

/**
 * Contiguous allocator over a fixed address space {@code [0, capacity)}.
 *
 * The address space is always partitioned into blocks that are sorted by address,
 * do not overlap and leave no gaps. Adjacent free blocks never survive a public call.
 *
 * Implementations are single-threaded: callers that share an allocator must guard
 * every call with their own lock.
 */
public interface MemoryAllocator {

    /**
     * Allocate a contiguous block for an owner.
     *
     * @param owner non-empty owner label
     * @param size number of cells to allocate
     * @param strategy how to choose among the free blocks that fit
     * @return outcome; the partition only changes on {@link AllocationResult#ALLOCATED}
     */
    AllocationResult allocate(String owner, int size, PlacementStrategy strategy);

    /**
     * Free every block held by an owner and coalesce the freed space with its neighbours.
     *
     * @param owner owner label
     * @return false if the owner held nothing (partition unchanged)
     */
    boolean release(String owner);

    /**
     * Move all allocated blocks to the bottom of the address space, keeping their order,
     * and leave at most one free block at the top.
     *
     * @return number of blocks whose start address changed
     */
    int compact();

    /**
     * Snapshot of the partition in ascending address order.
     *
     * @return immutable list of blocks
     */
    List<Block> status();

    /**
     * Get total address space size.
     *
     * @return capacity in cells
     */
    int getCapacity();

    /**
     * Get total free memory, possibly fragmented across several blocks.
     *
     * @return free cells
     */
    int getFreeMemory();

    /**
     * Get the size of the largest free block, which bounds the largest request that can succeed.
     *
     * @return size of largest free block, or 0 if no free memory
     */
    int getLargestFreeBlock();

    /**
     * Get number of free blocks (for diagnostics).
     *
     * @return count of separate free blocks
     */
    int getFreeBlockCount();

    default int getUsedMemory() {
        return getCapacity() - getFreeMemory();
    }

    /**
     * Calculate external fragmentation.
     *
     * @return 0.0 (all free memory in one block) to 1.0 (highly fragmented)
     */
    default double getFragmentation() {
        int freeMemory = getFreeMemory();
        if (freeMemory == 0) {
            return 0.0;
        }
        int largestBlock = getLargestFreeBlock();
        return 1.0 - ((double) largestBlock / freeMemory);
    }
}
