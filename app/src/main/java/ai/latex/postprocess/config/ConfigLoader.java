package ai.latex.postprocess.config;

import ai.latex.postprocess.cli.CliArguments;
import ai.latex.postprocess.delimiter.BracketMatchingMode;
import ai.latex.postprocess.pipeline.Stage;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_STAGES = "LATEX_STAGES";
    static final String ENV_BRACKET_MATCHING = "LATEX_BRACKET_MATCHING";
    static final String ENV_INPUT = "LATEX_INPUT";
    static final String ENV_OUTPUT = "LATEX_OUTPUT";
    static final String ENV_ALTERNATIVES = "LATEX_ALTERNATIVES";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "LATEX_VERBOSE";

    private static final Set<Stage> DEFAULT_STAGES = EnumSet.allOf(Stage.class);

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Set<Stage> stages = resolveStages(arguments);
        BracketMatchingMode matchingMode = resolveBracketMatching(arguments);
        Optional<Path> input = resolvePath(arguments.input(), ENV_INPUT);
        Optional<Path> output = resolvePath(arguments.output(), ENV_OUTPUT);
        boolean alternatives = arguments.alternatives() || resolveFlag(ENV_ALTERNATIVES);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE);
        return new Config(stages, matchingMode, input, output, alternatives, logFormat, verbose);
    }

    private Set<Stage> resolveStages(CliArguments arguments) {
        List<Stage> cliStages = arguments.stages();
        if (cliStages != null && !cliStages.isEmpty()) {
            return EnumSet.copyOf(cliStages);
        }
        return environmentReader.getNonBlank(ENV_STAGES)
                .map(ConfigLoader::parseStages)
                .orElse(DEFAULT_STAGES);
    }

    private BracketMatchingMode resolveBracketMatching(CliArguments arguments) {
        BracketMatchingMode cliMode = arguments.bracketMatchingMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.getNonBlank(ENV_BRACKET_MATCHING)
                .map(ConfigLoader::parseBracketMatching)
                .orElse(BracketMatchingMode.STRICT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.getNonBlank(envKey).map(Path::of);
    }

    private boolean resolveFlag(String envKey) {
        return environmentReader.getNonBlank(envKey)
                .map(value -> parseFlag(envKey, value))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(ConfigLoader::parseLogFormat)
                .orElse(LogFormat.TEXT);
    }

    private static Set<Stage> parseStages(String raw) {
        try {
            return Stage.parseList(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_STAGES + " is invalid: " + ex.getMessage(), ex);
        }
    }

    private static boolean parseFlag(String envKey, String raw) {
        String value = raw.trim();
        if (value.equalsIgnoreCase("true") || value.equals("1")) {
            return true;
        }
        if (value.equalsIgnoreCase("false") || value.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException(envKey + " is invalid: expected true, false, 1 or 0 but was '" + raw + "'");
    }

    private static LogFormat parseLogFormat(String raw) {
        try {
            return LogFormat.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_LOG_FORMAT + " is invalid: " + ex.getMessage(), ex);
        }
    }

    private static BracketMatchingMode parseBracketMatching(String raw) {
        try {
            return BracketMatchingMode.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_BRACKET_MATCHING + " is invalid: " + ex.getMessage(), ex);
        }
    }
}
