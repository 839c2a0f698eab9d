package ai.latex.postprocess.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads prediction documents holding one LaTeX string per line.
 */
public class DocumentReader {

    public List<String> read(Path source) {
        Objects.requireNonNull(source, "source");
        try {
            return Files.readAllLines(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read LaTeX document: " + source, ex);
        }
    }

    public List<String> read(InputStream source) {
        Objects.requireNonNull(source, "source");
        BufferedReader reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
        List<String> lines = new ArrayList<>();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read LaTeX from input stream", ex);
        }
        return lines;
    }
}
