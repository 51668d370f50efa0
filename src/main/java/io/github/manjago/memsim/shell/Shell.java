package io.github.manjago.memsim.shell;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Read-dispatch loop: one command per line until {@code X} or end of input.
 */
public class Shell {

    private static final Logger log = LoggerFactory.getLogger(Shell.class);

    private final CommandParser parser;
    private final CommandProcessor processor;
    private final PrintStream out;
    private final @Nullable String prompt;
    private boolean echo = false;

    /**
     * @param prompt printed before each line is read, or null for no prompt
     */
    public Shell(CommandParser parser, CommandProcessor processor, PrintStream out, @Nullable String prompt) {
        this.parser = parser;
        this.processor = processor;
        this.out = out;
        this.prompt = prompt;
    }

    /**
     * Print every non-blank input line before its output (for scripts).
     */
    public Shell echo(boolean echo) {
        this.echo = echo;
        return this;
    }

    /**
     * Run until exit command or end of input.
     *
     * @param in command source
     * @return number of commands executed, exit included
     * @throws IOException if reading fails
     */
    public int run(BufferedReader in) throws IOException {
        int executed = 0;

        while (true) {
            if (prompt != null) {
                out.print(prompt);
                out.flush();
            }

            String line = in.readLine();
            if (line == null) {
                log.debug("End of input after {} commands", executed);
                break;
            }

            Command command = parser.parse(line);
            if (command instanceof Command.Empty) {
                continue;
            }
            if (echo) {
                out.println("> " + line.strip());
            }

            executed++;
            if (!processor.execute(command)) {
                break;
            }
        }

        return executed;
    }
}
