package io.github.manjago.memsim.shell;

import io.github.manjago.memsim.core.Block;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the partition in the {@code STAT} format, one line per block.
 *
 * <pre>
 * Addresses [0:29] Process P1 (30 bytes)
 * Addresses [30:99] Unused (70 bytes)
 * </pre>
 */
public class StatusPrinter {

    private final PrintStream out;
    private boolean showSizes = true;

    public StatusPrinter() {
        this(System.out);
    }

    public StatusPrinter(PrintStream out) {
        this.out = out;
    }

    public StatusPrinter showSizes(boolean show) {
        this.showSizes = show;
        return this;
    }

    /**
     * Print all blocks.
     */
    public void printAll(List<Block> blocks) {
        for (Block block : blocks) {
            out.println(format(block));
        }
    }

    /**
     * Format a single block.
     */
    public String format(Block block) {
        String status = block.isFree() ? "Unused" : "Process " + block.owner();
        String line = String.format("Addresses [%d:%d] %s", block.start(), block.end(), status);
        if (showSizes) {
            line += String.format(" (%d bytes)", block.size());
        }
        return line;
    }
}
