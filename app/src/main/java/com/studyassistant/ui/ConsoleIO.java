package com.studyassistant.ui;

import com.studyassistant.exception.UserFacingError;
import com.studyassistant.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Terminal input and output for the screens.
 *
 * Parsing helpers throw {@link ValidationException} on bad input, so a
 * mistyped number is reported like any other invalid form value.
 */
@Component
public class ConsoleIO {

    private static final String RULE = "------------------------------------------------------------";

    private final BufferedReader in;
    private final PrintStream out;

    @Autowired
    public ConsoleIO() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    }

    public ConsoleIO(Reader in, PrintStream out) {
        this.in = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        this.out = out;
    }

    public void println() {
        out.println();
    }

    public void println(String text) {
        out.println(text);
    }

    public void print(String text) {
        out.print(text);
        out.flush();
    }

    public void printf(String format, Object... args) {
        out.printf(format, args);
        out.flush();
    }

    public void header(String title) {
        out.println();
        out.println(RULE);
        out.println("  " + title);
        out.println(RULE);
    }

    public void error(UserFacingError error) {
        out.println();
        out.println("!! " + error.getTitle() + ": " + error.getMessage());
    }

    /**
     * Print numbered menu entries and read the choice.
     *
     * @param options labels shown as 1..n; 0 is always "Back" (or the given label)
     * @param zeroLabel label for option 0
     * @return the chosen number
     */
    public int menu(List<String> options, String zeroLabel) {
        for (int i = 0; i < options.size(); i++) {
            out.printf("  %d) %s%n", i + 1, options.get(i));
        }
        out.printf("  0) %s%n", zeroLabel);
        return readInt("Choose", 0, options.size());
    }

    /**
     * Read one line, trimmed.
     *
     * @throws ConsoleExitException when the input stream is closed
     */
    public String readLine(String prompt) {
        print(prompt + ": ");
        String line = nextLine();
        return line.trim();
    }

    /**
     * Read a line without echoing it when a real console is attached.
     */
    public String readSecret(String prompt) {
        Console console = System.console();
        if (console != null && isSystemConsole()) {
            char[] chars = console.readPassword("%s: ", prompt);
            if (chars == null) {
                throw new ConsoleExitException("Input closed");
            }
            return new String(chars);
        }
        print(prompt + ": ");
        return nextLine();
    }

    /**
     * Read lines until an empty line.
     */
    public String readMultiline(String prompt) {
        out.println(prompt + " (finish with an empty line):");
        StringBuilder text = new StringBuilder();
        String line;
        while (!(line = nextLine()).isEmpty()) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(line);
        }
        return text.toString();
    }

    public int readInt(String prompt, int min, int max) {
        String raw = readLine(prompt);
        int value = parse(raw, "number", "a whole number", Integer::parseInt);
        if (value < min || value > max) {
            throw ValidationException.outOfRange("choice", value, min, max);
        }
        return value;
    }

    /**
     * Read a number; an empty line yields the default.
     */
    public int readIntOrDefault(String prompt, int defaultValue) {
        String raw = readLine(prompt + " [" + defaultValue + "]");
        if (raw.isEmpty()) {
            return defaultValue;
        }
        return parse(raw, "number", "a whole number", Integer::parseInt);
    }

    public Long readId(String prompt) {
        String raw = readLine(prompt);
        return parse(raw, "id", "a number from the list", Long::parseLong);
    }

    /**
     * Read an optional date in ISO format; an empty line yields null.
     */
    public LocalDate readOptionalDate(String prompt) {
        String raw = readLine(prompt + " (YYYY-MM-DD, empty for none)");
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidFormat("date", raw, "YYYY-MM-DD");
        }
    }

    /**
     * Edit a date: an empty line keeps {@code current}, "-" clears it.
     */
    public LocalDate readDate(String prompt, LocalDate current) {
        String shown = current == null ? "none" : current.toString();
        String raw = readLine(prompt + " [" + shown + "] (YYYY-MM-DD, - to clear)");
        if (raw.isEmpty()) {
            return current;
        }
        if (raw.equals("-")) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidFormat("date", raw, "YYYY-MM-DD");
        }
    }

    public boolean confirm(String question) {
        String answer = readLine(question + " (y/n)");
        return answer.equalsIgnoreCase("y") || answer.equalsIgnoreCase("yes");
    }

    /**
     * Whether the user has typed something that has not been read yet.
     */
    public boolean inputAvailable() {
        try {
            return in.ready();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read from the console", e);
        }
    }

    /**
     * Consume whatever line is pending, after {@link #inputAvailable()}.
     */
    public String takePendingLine() {
        return nextLine().trim();
    }

    private String nextLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                throw new ConsoleExitException("Input closed");
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read from the console", e);
        }
    }

    private boolean isSystemConsole() {
        return out == System.out;
    }

    private static <T> T parse(String raw, String field, String expected, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidFormat(field, raw, expected);
        }
    }
}
