package io.github.manjago.memsim.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A contiguous address range {@code [start, end]} (both inclusive) with a uniform status.
 *
 * A block is either free ({@code owner == null}) or allocated to exactly one owner label.
 * Blocks are immutable: splitting, merging and relocation always produce new instances.
 */
public record Block(int start, int end, @Nullable String owner) {

    public Block {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    String.format("Invalid block range [%d:%d]", start, end));
        }
        if (owner != null && owner.isEmpty()) {
            throw new IllegalArgumentException("Owner label must not be empty");
        }
    }

    /**
     * Create a free block.
     */
    @Contract(pure = true)
    public static @NotNull Block free(int start, int end) {
        return new Block(start, end, null);
    }

    /**
     * Create a block allocated to {@code owner}.
     */
    @Contract(pure = true)
    public static @NotNull Block allocated(int start, int end, @NotNull String owner) {
        return new Block(start, end, owner);
    }

    public int size() {
        return end - start + 1;
    }

    public boolean isFree() {
        return owner == null;
    }

    public boolean isOwnedBy(@NotNull String label) {
        return label.equals(owner);
    }

    /**
     * Same range, owner cleared.
     */
    public @NotNull Block release() {
        return isFree() ? this : free(start, end);
    }

    /**
     * Same size and owner, moved to start at {@code newStart}.
     */
    public @NotNull Block moveTo(int newStart) {
        return new Block(newStart, newStart + size() - 1, owner);
    }

    @Override
    public String toString() {
        return String.format("[%d-%d, size=%d, %s]", start, end, size(), isFree() ? "free" : owner);
    }
}
