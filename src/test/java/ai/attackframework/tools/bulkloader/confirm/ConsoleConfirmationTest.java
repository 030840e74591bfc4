package ai.attackframework.tools.bulkloader.confirm;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleConfirmationTest {

    private final ByteArrayOutputStream sink = new ByteArrayOutputStream();

    private ConsoleConfirmation console(String input) {
        return new ConsoleConfirmation(
                new BufferedReader(new StringReader(input)),
                new PrintStream(sink, true, StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @ValueSource(strings = {"n\n", "N\n", "n"})
    void n_declines(String input) {
        assertThat(console(input).confirm("Delete? ")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"y\n", "yes\n", "\n", "no\n", "whatever\n", " n\n", "n \n", "\tN\n"})
    void anythingElse_confirms(String input) {
        assertThat(console(input).confirm("Delete? ")).isTrue();
    }

    @Test
    void prompt_isWrittenWithoutNewline() {
        console("y\n").confirm("WARNING: Being asked to delete test, is this correct? (y/n) ");

        assertThat(sink.toString(StandardCharsets.UTF_8))
                .isEqualTo("WARNING: Being asked to delete test, is this correct? (y/n) ");
    }

    @Test
    void endOfInput_declines() {
        assertThat(console("").confirm("Delete? ")).isFalse();
    }

    @Test
    void fixedPolicies_ignoreThePrompt() {
        assertThat(ConfirmationPolicy.always().confirm("anything")).isTrue();
        assertThat(ConfirmationPolicy.never().confirm("anything")).isFalse();
    }
}
