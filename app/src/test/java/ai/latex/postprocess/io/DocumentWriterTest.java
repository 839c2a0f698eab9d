package ai.latex.postprocess.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesLinesAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("out/nested/result.txt");

        writer.write(target, List.of("\\frac{a}{b}", "(x,y)"));

        String content = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(content).isEqualTo("\\frac{a}{b}" + System.lineSeparator() + "(x,y)" + System.lineSeparator());
    }

    @Test
    void writesToStreamWithoutClosingIt() {
        DocumentWriter writer = new DocumentWriter();
        ByteArrayOutputStream stream = new ByteArrayOutputStream();

        writer.write(stream, List.of("⟨x⟩"));
        writer.write(stream, List.of("y"));

        assertThat(stream.toString(StandardCharsets.UTF_8))
                .isEqualTo("⟨x⟩" + System.lineSeparator() + "y" + System.lineSeparator());
    }

    @Test
    void readsBackWhatWasWritten() {
        Path target = tempDir.resolve("roundtrip.txt");
        new DocumentWriter().write(target, List.of("\\left( x \\right)", "", "（x）"));

        assertThat(new DocumentReader().read(target)).containsExactly("\\left( x \\right)", "", "（x）");
    }

    @Test
    void readsStreamLineByLine() {
        byte[] bytes = "a\r\nb\n\nc".getBytes(StandardCharsets.UTF_8);

        assertThat(new DocumentReader().read(new ByteArrayInputStream(bytes))).containsExactly("a", "b", "", "c");
    }

    @Test
    void wrapsMissingFileInUncheckedException() {
        Path missing = tempDir.resolve("missing.txt");

        assertThatThrownBy(() -> new DocumentReader().read(missing))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.txt");
    }
}
