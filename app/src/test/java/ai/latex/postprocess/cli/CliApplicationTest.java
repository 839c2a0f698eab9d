package ai.latex.postprocess.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.latex.postprocess.config.ConfigLoader;
import ai.latex.postprocess.io.DocumentReader;
import ai.latex.postprocess.io.DocumentWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void processesInputFileIntoOutputFile() throws Exception {
        Path input = tempDir.resolve("predictions.txt");
        Path output = tempDir.resolve("cleaned/predictions.txt");
        Files.write(input, List.of("\\left( x \\right]", "\\frac { a } { b }"), StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {
                "--input", input.toString(),
                "--output", output.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly("(x]", "\\frac{a}{b}");
        assertThat(stdout.size()).isZero();
    }

    @Test
    void streamsFromStandardInputToStandardOutput() {
        int exitCode = application("\\left\\langle x \\right\\rangle\n（a，b）\n").run(new String[] {
                "--stages", "reconcile",
                "--log-format", "json"
        });

        assertThat(exitCode).isZero();
        String expected = "\\left\\langle x \\right\\rangle" + System.lineSeparator()
                + "(a,b)" + System.lineSeparator();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(expected);
    }

    @Test
    void writesAlternativesSeparatedByTab() {
        int exitCode = application("\\operatorname {sin} x\n").run(new String[] {"--alternatives"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8))
                .isEqualTo("\\operatorname{sin}x\t\\sin x" + System.lineSeparator());
    }

    @Test
    void rejectsUnknownOption() {
        int exitCode = application("").run(new String[] {"--render"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void rejectsUnknownStage() {
        int exitCode = application("").run(new String[] {"--stages", "reconcile,render"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void reportsMissingInputFile() {
        int exitCode = application("").run(new String[] {
                "--input", tempDir.resolve("absent.txt").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
    }

    @Test
    void printsUsageOnHelp() {
        int exitCode = application("").run(new String[] {"--help"});

        assertThat(exitCode).isZero();
    }

    private CliApplication application(String standardInput) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new DocumentReader(),
                new DocumentWriter(),
                new ByteArrayInputStream(standardInput.getBytes(StandardCharsets.UTF_8)),
                stdout);
    }
}
