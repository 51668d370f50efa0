package io.github.manjago.memsim.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.manjago.memsim.core.PlacementStrategy.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for compaction of the block list.
 */
class CompactionTest {

    private static final int CAPACITY = 100;

    private BlockListAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new BlockListAllocator(CAPACITY);
    }

    @Test
    @DisplayName("compact packs scattered blocks to the bottom in address order")
    void compactPacksScatteredBlocks() {
        // Sizes 10, 20, 30 with gaps between them
        allocator.allocate("G1", 5, FIRST_FIT);   // 0-4
        allocator.allocate("A", 10, FIRST_FIT);   // 5-14
        allocator.allocate("G2", 15, FIRST_FIT);  // 15-29
        allocator.allocate("B", 20, FIRST_FIT);   // 30-49
        allocator.allocate("G3", 5, FIRST_FIT);   // 50-54
        allocator.allocate("C", 30, FIRST_FIT);   // 55-84
        allocator.release("G1");
        allocator.release("G2");
        allocator.release("G3");

        int moved = allocator.compact();

        assertEquals(List.of(
                Block.allocated(0, 9, "A"),
                Block.allocated(10, 29, "B"),
                Block.allocated(30, 59, "C"),
                Block.free(60, 99)
        ), allocator.status());
        assertEquals(3, moved);
    }

    @Test
    @DisplayName("compact keeps address order, not allocation order")
    void compactKeepsAddressOrder() {
        allocator.allocate("X", 50, FIRST_FIT);   // 0-49
        allocator.allocate("A", 20, FIRST_FIT);   // 50-69
        allocator.release("X");
        allocator.allocate("B", 10, FIRST_FIT);   // 0-9, allocated after A

        int moved = allocator.compact();

        assertEquals(List.of(
                Block.allocated(0, 9, "B"),
                Block.allocated(10, 29, "A"),
                Block.free(30, 99)
        ), allocator.status());
        assertEquals(1, moved);  // B was already in place
    }

    @Test
    @DisplayName("compact on an already packed partition moves nothing")
    void compactAlreadyPacked() {
        allocator.allocate("A", 10, FIRST_FIT);
        allocator.allocate("B", 10, FIRST_FIT);
        List<Block> before = allocator.status();

        assertEquals(0, allocator.compact());
        assertEquals(before, allocator.status());
    }

    @Test
    @DisplayName("compact on empty memory keeps one free block")
    void compactEmpty() {
        assertEquals(0, allocator.compact());
        assertEquals(List.of(Block.free(0, CAPACITY - 1)), allocator.status());
    }

    @Test
    @DisplayName("compact on full memory leaves no free block")
    void compactFull() {
        allocator.allocate("A", 60, FIRST_FIT);
        allocator.allocate("B", 40, FIRST_FIT);

        allocator.compact();

        assertEquals(List.of(
                Block.allocated(0, 59, "A"),
                Block.allocated(60, 99, "B")
        ), allocator.status());
        assertEquals(0, allocator.getFreeBlockCount());
    }

    @Test
    @DisplayName("compact removes external fragmentation")
    void compactEnablesFailedAllocation() {
        allocator.allocate("A", 30, FIRST_FIT);   // 0-29
        allocator.allocate("B", 20, FIRST_FIT);   // 30-49
        allocator.allocate("C", 30, FIRST_FIT);   // 50-79
        allocator.allocate("D", 20, FIRST_FIT);   // 80-99
        allocator.release("B");
        allocator.release("D");

        // 40 cells free, but in two holes of 20
        assertEquals(40, allocator.getFreeMemory());
        assertEquals(AllocationResult.INSUFFICIENT_MEMORY, allocator.allocate("E", 40, FIRST_FIT));
        assertEquals(0.5, allocator.getFragmentation(), 0.001);

        allocator.compact();
        assertEquals(1, allocator.getFreeBlockCount());
        assertEquals(0.0, allocator.getFragmentation(), 0.001);

        assertEquals(AllocationResult.ALLOCATED, allocator.allocate("E", 40, FIRST_FIT));
        assertEquals(Block.allocated(60, 99, "E"), allocator.getBlocksOwnedBy("E").get(0));
    }

    @Test
    @DisplayName("compact keeps blocks of the same owner separate")
    void compactKeepsSameOwnerBlocksSeparate() {
        allocator = new BlockListAllocator(CAPACITY, OwnerPolicy.MULTIPLE, true);
        allocator.allocate("A", 10, FIRST_FIT);   // 0-9
        allocator.allocate("X", 10, FIRST_FIT);   // 10-19
        allocator.allocate("A", 10, FIRST_FIT);   // 20-29
        allocator.release("X");

        allocator.compact();

        assertEquals(List.of(
                Block.allocated(0, 9, "A"),
                Block.allocated(10, 19, "A"),
                Block.free(20, 99)
        ), allocator.status());
    }

    @Test
    @DisplayName("compact statistics accumulate")
    void compactStatistics() {
        allocator.allocate("X", 10, FIRST_FIT);
        allocator.allocate("A", 10, FIRST_FIT);
        allocator.release("X");
        allocator.compact();
        allocator.compact();

        AllocatorStats stats = allocator.getStats();
        assertEquals(2, stats.compactions());
        assertEquals(1, stats.blocksRelocated());
    }
}
