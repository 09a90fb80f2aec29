package io.github.hide212131.b3tree.runtime.io;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code *.b3-workspace} の内容。ワークスペースのルートは記述子ファイルのあるディレクトリ。
 */
public record WorkspaceDescriptor(Path file, Settings settings) {

    public WorkspaceDescriptor {
        Objects.requireNonNull(file, "file");
        settings = settings == null ? Settings.DEFAULT : settings;
    }

    public Path workdir() {
        Path parent = file.toAbsolutePath().normalize().getParent();
        return parent == null ? Path.of(".").toAbsolutePath() : parent;
    }

    public static WorkspaceDescriptor read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new TreeFormatException(file, "ワークスペース記述子が見つかりません: " + file);
        }
        JsonNode json = JsonSupport.readFile(file);
        JsonNode settings = json.get("settings");
        if (settings == null || !settings.isObject()) {
            return new WorkspaceDescriptor(file, Settings.DEFAULT);
        }
        Boolean checkExpr = JsonSupport.bool(settings, "checkExpr");
        return new WorkspaceDescriptor(file, new Settings(
                checkExpr != null && checkExpr,
                JsonSupport.text(settings, "buildScript"),
                JsonSupport.text(settings, "logPath")));
    }

    /** {@code settings} セクション。すべて省略可。 */
    public record Settings(boolean checkExpr, String buildScript, String logPath) {

        public static final Settings DEFAULT = new Settings(false, null, null);

        public Optional<String> buildScriptOption() {
            return Optional.ofNullable(buildScript).filter(value -> !value.isBlank());
        }

        public Optional<String> logPathOption() {
            return Optional.ofNullable(logPath).filter(value -> !value.isBlank());
        }

        public Settings withCheckExpr(boolean value) {
            return new Settings(value, buildScript, logPath);
        }
    }
}
