package ai.attackframework.tools.bulkloader.confirm;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Objects;

/**
 * Blocking yes/no prompt on a text console.
 *
 * <p>Only a line that is exactly {@code "n"} or {@code "N"} declines; any other answer, including
 * an empty line or {@code "n"} with surrounding blanks, confirms. End of input declines. Reads block
 * without a timeout.</p>
 */
public final class ConsoleConfirmation implements ConfirmationPolicy {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmation(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Prompts on {@code System.out} and reads {@code System.in}. */
    public static ConsoleConfirmation systemConsole() {
        return new ConsoleConfirmation(
                new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())),
                System.out);
    }

    @Override
    public boolean confirm(String prompt) {
        out.print(prompt);
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation answer", e);
        }
        if (answer == null) {
            out.println();
            return false;
        }
        return !answer.toLowerCase(Locale.ROOT).equals("n");
    }
}
