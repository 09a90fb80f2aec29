package io.github.hide212131.b3tree.runtime.build;

import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import java.nio.file.Path;
import java.util.Objects;

/** {@link BuildScript#onSetup(BuildEnvironment)} に渡すビルドの前提情報。 */
public record BuildEnvironment(Path workdir, Path outputDir, NodeDefinitionRegistry registry) {

    public BuildEnvironment {
        Objects.requireNonNull(workdir, "workdir");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(registry, "registry");
    }
}
