package ai.latex.postprocess.cli;

import ai.latex.postprocess.config.Config;
import ai.latex.postprocess.config.ConfigLoader;
import ai.latex.postprocess.config.SystemEnvironmentReader;
import ai.latex.postprocess.io.DocumentReader;
import ai.latex.postprocess.io.DocumentWriter;
import ai.latex.postprocess.logging.LoggingConfigurator;
import ai.latex.postprocess.pipeline.BatchOutcome;
import ai.latex.postprocess.pipeline.LatexBatchProcessor;
import ai.latex.postprocess.pipeline.LatexPostProcessor;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and post-processing pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_IO_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final InputStream standardInput;
    private final OutputStream standardOutput;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentReader(), new DocumentWriter(), System.in, System.out);
    }

    CliApplication(ConfigLoader configLoader, DocumentReader documentReader, DocumentWriter documentWriter,
                   InputStream standardInput, OutputStream standardOutput) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.documentReader = Objects.requireNonNull(documentReader, "documentReader");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.standardInput = Objects.requireNonNull(standardInput, "standardInput");
        this.standardOutput = Objects.requireNonNull(standardOutput, "standardOutput");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Running stages {} with {} bracket matching: input={} output={}",
                config.stages(), config.bracketMatchingMode(),
                config.input().map(Object::toString).orElse("<stdin>"),
                config.output().map(Object::toString).orElse("<stdout>"));

        LatexPostProcessor postProcessor = new LatexPostProcessor(config.bracketMatchingMode(), config.stages());
        LatexBatchProcessor batchProcessor = new LatexBatchProcessor(postProcessor, config.emitAlternatives());

        try {
            List<String> lines = config.input().isPresent()
                    ? documentReader.read(config.input().get())
                    : documentReader.read(standardInput);
            BatchOutcome outcome = batchProcessor.process(lines);
            if (config.output().isPresent()) {
                documentWriter.write(config.output().get(), outcome.lines());
            } else {
                documentWriter.write(standardOutput, outcome.lines());
            }
            LOGGER.info("Processed {} lines: {} changed, {} unmatched delimiter command(s) neutralized",
                    outcome.processedLines(), outcome.changedLines(), outcome.neutralizedDelimiters());
            if (!outcome.failedLines().isEmpty()) {
                LOGGER.warn("Lines passed through unchanged after failures: {}", outcome.failedLines());
            }
            return 0;
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex.getCause());
            return EXIT_IO_FAILURE;
        }
    }
}
