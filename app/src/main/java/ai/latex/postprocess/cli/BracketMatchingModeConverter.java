package ai.latex.postprocess.cli;

import ai.latex.postprocess.delimiter.BracketMatchingMode;
import picocli.CommandLine;

/**
 * Parses {@code --bracket-matching}; blank input falls back to strict matching.
 */
public class BracketMatchingModeConverter implements CommandLine.ITypeConverter<BracketMatchingMode> {

    @Override
    public BracketMatchingMode convert(String value) {
        return BracketMatchingMode.from(value);
    }
}
