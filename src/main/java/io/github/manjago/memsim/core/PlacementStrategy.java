package io.github.manjago.memsim.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Placement strategies for choosing the free block that receives an allocation.
 *
 * All strategies scan the partition in ascending address order and only consider
 * free blocks at least as large as the request. Ties are always resolved in favour
 * of the lowest address.
 */
public enum PlacementStrategy {

    /** First free block that is large enough. */
    FIRST_FIT('F', "first-fit") {
        @Override
        public int select(List<Block> partition, int size) {
            for (int i = 0; i < partition.size(); i++) {
                if (fits(partition.get(i), size)) {
                    return i;
                }
            }
            return NOT_FOUND;
        }
    },

    /** Smallest free block that is large enough. */
    BEST_FIT('B', "best-fit") {
        @Override
        public int select(List<Block> partition, int size) {
            int bestIndex = NOT_FOUND;
            int bestSize = Integer.MAX_VALUE;
            for (int i = 0; i < partition.size(); i++) {
                Block block = partition.get(i);
                // strict '<' keeps the lowest address among equal sizes
                if (fits(block, size) && block.size() < bestSize) {
                    bestSize = block.size();
                    bestIndex = i;
                }
            }
            return bestIndex;
        }
    },

    /** Largest free block, provided it is large enough. */
    WORST_FIT('W', "worst-fit") {
        @Override
        public int select(List<Block> partition, int size) {
            int worstIndex = NOT_FOUND;
            int worstSize = -1;
            for (int i = 0; i < partition.size(); i++) {
                Block block = partition.get(i);
                if (fits(block, size) && block.size() > worstSize) {
                    worstSize = block.size();
                    worstIndex = i;
                }
            }
            return worstIndex;
        }
    };

    /** Returned by {@link #select} when no free block can hold the request. */
    public static final int NOT_FOUND = -1;

    private final char code;
    private final String displayName;

    PlacementStrategy(char code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Pick the block that should receive an allocation of {@code size} cells.
     *
     * @param partition blocks sorted by start address
     * @param size requested size, positive
     * @return index into {@code partition}, or {@link #NOT_FOUND}
     */
    public abstract int select(List<Block> partition, int size);

    public char getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    private static boolean fits(Block block, int size) {
        return block.isFree() && block.size() >= size;
    }

    /**
     * Look up a strategy by its protocol letter (F, B or W), ignoring case.
     *
     * @return strategy or null if the letter is not a strategy code
     */
    @Contract(pure = true)
    public static @Nullable PlacementStrategy fromCode(char code) {
        char upper = Character.toUpperCase(code);
        for (PlacementStrategy strategy : values()) {
            if (strategy.code == upper) {
                return strategy;
            }
        }
        return null;
    }
}
