package ai.latex.postprocess.cli;

import ai.latex.postprocess.pipeline.Stage;
import picocli.CommandLine;

public class StageConverter implements CommandLine.ITypeConverter<Stage> {

    @Override
    public Stage convert(String value) {
        return Stage.from(value);
    }
}
