package io.github.hide212131.b3tree.runtime.build;

import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/** ビルド結果を YAML のレポートとして書き出す。 */
public final class BuildReportWriter {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public BuildReportWriter() {
    }

    public void write(BuildOrchestrator.BuildResult result, Path outputPath) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(outputPath, "outputPath");
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("status", result.hasErrors() ? BuildStatus.FAILURE.label() : BuildStatus.SUCCESS.label());
        List<Map<String, Object>> files = new ArrayList<>();
        for (BuildOrchestrator.FileOutcome outcome : result.files()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", outcome.path());
            entry.put("outcome", outcome.outcome().name().toLowerCase(Locale.ROOT));
            if (outcome.output() != null) {
                entry.put("output", outcome.output().toString());
            }
            if (outcome.errors() > 0) {
                entry.put("errors", outcome.errors());
            }
            files.add(entry);
        }
        root.put("files", files);
        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("severity", diagnostic.severity().name().toLowerCase(Locale.ROOT));
            entry.put("category", diagnostic.category().name().toLowerCase(Locale.ROOT));
            if (diagnostic.file() != null) {
                entry.put("file", diagnostic.file());
            }
            entry.put("message", diagnostic.message());
            diagnostics.add(entry);
        }
        if (!diagnostics.isEmpty()) {
            root.put("diagnostics", diagnostics);
        }
        writeYaml(outputPath, root);
    }

    private void writeYaml(Path outputPath, Map<String, Object> content) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        Yaml yaml = new Yaml(options);
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, yaml.dump(content), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("ビルドレポートの書き込みに失敗しました: " + outputPath, ex);
        }
    }
}
