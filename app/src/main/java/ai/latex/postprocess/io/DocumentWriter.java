package ai.latex.postprocess.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes post-processed LaTeX lines to a file or stream.
 */
public class DocumentWriter {

    public void write(Path target, List<String> lines) {
        if (target == null || lines == null) {
            throw new IllegalArgumentException("target and lines must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write LaTeX document: " + target, ex);
        }
    }

    /**
     * Writes to a stream owned by the caller; the stream is flushed but left open.
     */
    public void write(OutputStream target, List<String> lines) {
        if (target == null || lines == null) {
            throw new IllegalArgumentException("target and lines must be provided");
        }
        Writer writer = new OutputStreamWriter(target, StandardCharsets.UTF_8);
        try {
            for (String line : lines) {
                writer.write(line);
                writer.write(System.lineSeparator());
            }
            writer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write LaTeX to output stream", ex);
        }
    }
}
