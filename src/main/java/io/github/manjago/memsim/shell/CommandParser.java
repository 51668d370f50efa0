package io.github.manjago.memsim.shell;

import io.github.manjago.memsim.core.PlacementStrategy;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parser for the allocator protocol.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * RQ &lt;owner&gt; &lt;size&gt; &lt;F|B|W&gt;   ; request memory (first/best/worst fit)
 * RL &lt;owner&gt;                   ; release all memory of owner
 * C                            ; compact
 * STAT                         ; print partition
 * X                            ; exit
 * </pre>
 *
 * Keywords and strategy letters are case-insensitive, owner labels are not.
 * Trailing tokens after a complete command are ignored.
 */
public class CommandParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Parse one input line. Never throws: malformed input becomes
     * {@link Command.Invalid} or {@link Command.Unknown}.
     */
    public Command parse(String line) {
        String trimmed = line == null ? "" : line.strip();
        if (trimmed.isEmpty()) {
            return new Command.Empty();
        }

        String[] tokens = WHITESPACE.split(trimmed);
        String keyword = tokens[0].toUpperCase(Locale.ROOT);

        return switch (keyword) {
            case "RQ" -> parseRequest(trimmed, tokens);
            case "RL" -> parseRelease(trimmed, tokens);
            case "C" -> new Command.Compact();
            case "STAT" -> new Command.Status();
            case "X" -> new Command.Exit();
            default -> new Command.Unknown(trimmed);
        };
    }

    private Command parseRequest(String input, String[] tokens) {
        if (tokens.length < 4) {
            return new Command.Invalid(input, "Usage: RQ <process> <size> <F|B|W>");
        }

        String owner = tokens[1];

        int size;
        try {
            size = Integer.parseInt(tokens[2]);
        } catch (NumberFormatException e) {
            return new Command.Invalid(input, "Invalid size: " + tokens[2]);
        }

        String code = tokens[3];
        PlacementStrategy strategy = code.length() == 1 ? PlacementStrategy.fromCode(code.charAt(0)) : null;
        if (strategy == null) {
            return new Command.Invalid(input, "Invalid allocation strategy: " + code);
        }

        return new Command.Request(owner, size, strategy);
    }

    private Command parseRelease(String input, String[] tokens) {
        if (tokens.length < 2) {
            return new Command.Invalid(input, "Usage: RL <process>");
        }
        return new Command.Release(tokens[1]);
    }
}
