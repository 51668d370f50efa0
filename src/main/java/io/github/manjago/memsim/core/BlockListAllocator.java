package io.github.manjago.memsim.core;

import io.github.manjago.memsim.config.AllocatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Allocator backed by an ordered list of blocks covering the whole address space.
 *
 * Features:
 * - First Fit, Best Fit and Worst Fit placement (see {@link PlacementStrategy})
 * - Coalescing: adjacent free blocks are merged on release()
 * - Compaction: allocated blocks are packed towards address 0
 * - O(n) allocate, release and compact
 *
 * Both free and allocated blocks live in the same list, sorted by start address,
 * so a status snapshot is just a copy of the list.
 *
 * Not thread-safe.
 */
public class BlockListAllocator implements MemoryAllocator {

    private static final Logger log = LoggerFactory.getLogger(BlockListAllocator.class);

    private static final Comparator<Block> BY_START = Comparator.comparingInt(Block::start);

    private final int capacity;
    private final OwnerPolicy ownerPolicy;
    private final boolean verifyInvariants;
    private List<Block> blocks;

    // Statistics
    private int allocations = 0;
    private int failedAllocations = 0;
    private int releases = 0;
    private int failedReleases = 0;
    private int compactions = 0;
    private int blocksRelocated = 0;

    /**
     * Create an allocator with one owner per label and invariant checking enabled.
     *
     * @param capacity total size of the address space
     */
    public BlockListAllocator(int capacity) {
        this(capacity, OwnerPolicy.SINGLE, true);
    }

    /**
     * Create a new allocator with all memory initially free.
     *
     * @param capacity total size of the address space
     * @param ownerPolicy whether a label may hold several blocks
     * @param verifyInvariants check the partition after every mutation
     */
    public BlockListAllocator(int capacity, OwnerPolicy ownerPolicy, boolean verifyInvariants) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ownerPolicy = Objects.requireNonNull(ownerPolicy, "ownerPolicy");
        this.verifyInvariants = verifyInvariants;
        this.blocks = new ArrayList<>();
        this.blocks.add(Block.free(0, capacity - 1));

        log.debug("BlockListAllocator created with {} cells, owner policy {}", capacity, ownerPolicy);
    }

    /**
     * Create an allocator from configuration.
     */
    public static BlockListAllocator fromConfig(AllocatorConfig config) {
        return new BlockListAllocator(config.capacity(), config.ownerPolicy(), config.verifyInvariants());
    }

    @Override
    public AllocationResult allocate(String owner, int size, PlacementStrategy strategy) {
        requireOwner(owner);
        Objects.requireNonNull(strategy, "strategy");

        if (size <= 0) {
            log.warn("Invalid allocation request: owner={}, size={}", owner, size);
            failedAllocations++;
            return AllocationResult.INVALID_SIZE;
        }
        if (ownerPolicy == OwnerPolicy.SINGLE && holdsBlock(owner)) {
            log.warn("Allocation rejected: {} already holds memory", owner);
            failedAllocations++;
            return AllocationResult.DUPLICATE_OWNER;
        }

        int index = strategy.select(blocks, size);
        if (index == PlacementStrategy.NOT_FOUND) {
            log.debug("Allocation failed ({}): {} requested {} cells, largest block is {}",
                      strategy.getDisplayName(), owner, size, getLargestFreeBlock());
            failedAllocations++;
            return AllocationResult.INSUFFICIENT_MEMORY;
        }

        Block hole = blocks.get(index);
        Block allocated = Block.allocated(hole.start(), hole.start() + size - 1, owner);
        blocks.set(index, allocated);
        if (hole.size() > size) {
            // Split the block - remainder stays free right after the allocation
            blocks.add(index + 1, Block.free(allocated.end() + 1, hole.end()));
        }

        allocations++;
        log.debug("Allocated {} ({}) from hole {}", allocated, strategy.getDisplayName(), hole);
        checkInvariants("allocate");
        return AllocationResult.ALLOCATED;
    }

    @Override
    public boolean release(String owner) {
        requireOwner(owner);

        int freed = 0;
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.isOwnedBy(owner)) {
                blocks.set(i, block.release());
                freed++;
            }
        }

        if (freed == 0) {
            log.debug("Release failed: {} holds no memory", owner);
            failedReleases++;
            return false;
        }

        coalesce();
        releases++;
        log.debug("Released {} block(s) of {}", freed, owner);
        checkInvariants("release");
        return true;
    }

    /**
     * Merge every run of adjacent free blocks into a single block.
     */
    private void coalesce() {
        blocks.sort(BY_START);

        int i = 0;
        while (i < blocks.size() - 1) {
            Block current = blocks.get(i);
            Block next = blocks.get(i + 1);

            if (current.isFree() && next.isFree()) {
                // Merge and stay on the same index: the merged block may touch another free one
                Block merged = Block.free(current.start(), next.end());
                blocks.set(i, merged);
                blocks.remove(i + 1);
                log.trace("Coalesced blocks: {} + {} -> {}", current, next, merged);
            } else {
                i++;
            }
        }
    }

    @Override
    public int compact() {
        double fragBefore = getFragmentation();
        int freeBlocksBefore = getFreeBlockCount();

        blocks.sort(BY_START);

        List<Block> packed = new ArrayList<>(blocks.size());
        int nextFreeAddr = 0;
        int moved = 0;

        for (Block block : blocks) {
            if (block.isFree()) {
                continue;
            }
            if (block.start() != nextFreeAddr) {
                log.trace("Moving {} to {}", block, nextFreeAddr);
                moved++;
            }
            Block relocated = block.moveTo(nextFreeAddr);
            packed.add(relocated);
            nextFreeAddr = relocated.end() + 1;
        }

        if (nextFreeAddr < capacity) {
            packed.add(Block.free(nextFreeAddr, capacity - 1));
        }

        blocks = packed;
        compactions++;
        blocksRelocated += moved;

        log.info("Compaction #{}: moved {} blocks, fragmentation {}% -> {}%, free blocks {} -> {}",
                 compactions, moved,
                 String.format("%.1f", fragBefore * 100),
                 String.format("%.1f", getFragmentation() * 100),
                 freeBlocksBefore, getFreeBlockCount());
        checkInvariants("compact");
        return moved;
    }

    @Override
    public List<Block> status() {
        return List.copyOf(blocks);
    }

    /**
     * Get the blocks currently held by an owner, in address order.
     */
    public List<Block> getBlocksOwnedBy(String owner) {
        return blocks.stream()
                .filter(b -> b.isOwnedBy(owner))
                .toList();
    }

    public OwnerPolicy getOwnerPolicy() {
        return ownerPolicy;
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public int getFreeMemory() {
        return blocks.stream()
                .filter(Block::isFree)
                .mapToInt(Block::size)
                .sum();
    }

    @Override
    public int getLargestFreeBlock() {
        return blocks.stream()
                .filter(Block::isFree)
                .mapToInt(Block::size)
                .max()
                .orElse(0);
    }

    @Override
    public int getFreeBlockCount() {
        return (int) blocks.stream()
                .filter(Block::isFree)
                .count();
    }

    /**
     * Get a statistics snapshot.
     */
    public AllocatorStats getStats() {
        return new AllocatorStats(
                capacity,
                blocks.size(),
                getFreeBlockCount(),
                getUsedMemory(),
                getFreeMemory(),
                getLargestFreeBlock(),
                getFragmentation(),
                allocations,
                failedAllocations,
                releases,
                failedReleases,
                compactions,
                blocksRelocated
        );
    }

    /**
     * Check the partition: blocks sorted, no overlap, no gap, exact coverage of
     * {@code [0, capacity)} and no two adjacent free blocks.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void verifyInvariants() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("Partition is empty");
        }
        if (blocks.get(0).start() != 0) {
            throw new IllegalStateException("Partition does not start at 0: " + blocks.get(0));
        }
        for (int i = 1; i < blocks.size(); i++) {
            Block prev = blocks.get(i - 1);
            Block current = blocks.get(i);
            if (current.start() <= prev.end()) {
                throw new IllegalStateException("Overlapping or unsorted blocks: " + prev + ", " + current);
            }
            if (current.start() != prev.end() + 1) {
                throw new IllegalStateException("Gap between blocks: " + prev + ", " + current);
            }
            if (prev.isFree() && current.isFree()) {
                throw new IllegalStateException("Adjacent free blocks: " + prev + ", " + current);
            }
        }
        Block last = blocks.get(blocks.size() - 1);
        if (last.end() != capacity - 1) {
            throw new IllegalStateException(
                    "Partition ends at " + last.end() + ", expected " + (capacity - 1));
        }
    }

    private void checkInvariants(String operation) {
        if (!verifyInvariants) {
            return;
        }
        try {
            verifyInvariants();
        } catch (IllegalStateException e) {
            log.error("BUG: partition corrupted after {}: {} ({})", operation, e.getMessage(), getPartitionSnapshot());
            throw e;
        }
    }

    private boolean holdsBlock(String owner) {
        for (Block block : blocks) {
            if (block.isOwnedBy(owner)) {
                return true;
            }
        }
        return false;
    }

    private static void requireOwner(String owner) {
        Objects.requireNonNull(owner, "owner");
        if (owner.isEmpty()) {
            throw new IllegalArgumentException("Owner label must not be empty");
        }
    }

    /**
     * Get a snapshot of the partition for diagnostics.
     *
     * @return string representation of all blocks
     */
    public String getPartitionSnapshot() {
        StringBuilder sb = new StringBuilder("Partition: ");
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(blocks.get(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("BlockListAllocator[capacity=%d, free=%d, used=%d, blocks=%d, frag=%.1f%%]",
                capacity, getFreeMemory(), getUsedMemory(),
                blocks.size(), getFragmentation() * 100);
    }
}
