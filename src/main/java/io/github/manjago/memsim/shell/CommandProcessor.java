package io.github.manjago.memsim.shell;

import io.github.manjago.memsim.core.AllocationResult;
import io.github.manjago.memsim.core.MemoryAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Executes parsed commands against an allocator and reports the outcome.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    private final MemoryAllocator allocator;
    private final StatusPrinter statusPrinter;
    private final PrintStream out;

    public CommandProcessor(MemoryAllocator allocator, StatusPrinter statusPrinter, PrintStream out) {
        this.allocator = allocator;
        this.statusPrinter = statusPrinter;
        this.out = out;
    }

    /**
     * Execute one command.
     *
     * @return false if the command ends the session
     */
    public boolean execute(Command command) {
        if (command instanceof Command.Request rq) {
            request(rq);
        } else if (command instanceof Command.Release rl) {
            release(rl);
        } else if (command instanceof Command.Compact) {
            allocator.compact();
            out.println("Memory compacted");
        } else if (command instanceof Command.Status) {
            statusPrinter.printAll(allocator.status());
        } else if (command instanceof Command.Exit) {
            return false;
        } else if (command instanceof Command.Invalid invalid) {
            log.debug("Rejected input '{}': {}", invalid.input(), invalid.reason());
            out.println("Error: " + invalid.reason());
        } else if (command instanceof Command.Unknown unknown) {
            out.println("Unknown command: " + unknown.input());
        }
        // Command.Empty: nothing to do
        return true;
    }

    private void request(Command.Request rq) {
        AllocationResult result = allocator.allocate(rq.owner(), rq.size(), rq.strategy());
        switch (result) {
            case ALLOCATED -> out.printf("Successfully allocated %d bytes to %s%n", rq.size(), rq.owner());
            case INSUFFICIENT_MEMORY -> out.printf("Error: Cannot allocate %d bytes to %s%n", rq.size(), rq.owner());
            case DUPLICATE_OWNER -> out.printf("Error: Process %s already holds memory%n", rq.owner());
            case INVALID_SIZE -> out.printf("Error: Invalid size %d for %s%n", rq.size(), rq.owner());
        }
    }

    private void release(Command.Release rl) {
        if (allocator.release(rl.owner())) {
            out.println("Successfully released memory for " + rl.owner());
        } else {
            out.println("Error: Process " + rl.owner() + " not found");
        }
    }
}
