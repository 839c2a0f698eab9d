package ai.latex.postprocess.cli;

import ai.latex.postprocess.config.LogFormat;
import ai.latex.postprocess.delimiter.BracketMatchingMode;
import ai.latex.postprocess.pipeline.Stage;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "latex-postprocessor", mixinStandardHelpOptions = true,
        description = "Repairs \\left/\\right pairs and tokenizer whitespace in model-generated LaTeX, one formula per line")
public class CliArguments {

    @CommandLine.Option(names = {"-i", "--input"}, description = "File with one LaTeX string per line (default: stdin)", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Destination file (default: stdout)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--stages", split = ",", converter = StageConverter.class,
            description = "Comma separated stages to run: reconcile, whitespace (default: both)", paramLabel = "STAGE")
    private List<Stage> stages;

    @CommandLine.Option(names = "--bracket-matching", converter = BracketMatchingModeConverter.class,
            description = "How \\left/\\right arguments are compared: strict or legacy")
    private BracketMatchingMode bracketMatchingMode;

    @CommandLine.Option(names = "--alternatives", description = "Append equivalent spellings (\\operatorname{sin} -> \\sin), tab separated")
    private boolean alternatives;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every rewritten line")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public List<Stage> stages() {
        return stages;
    }

    public BracketMatchingMode bracketMatchingMode() {
        return bracketMatchingMode;
    }

    public boolean alternatives() {
        return alternatives;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
