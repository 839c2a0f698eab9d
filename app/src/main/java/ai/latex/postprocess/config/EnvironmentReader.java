package ai.latex.postprocess.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
