package io.github.hide212131.b3tree.runtime.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.b3tree.runtime.WorkspaceFixtures;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceDescriptorTest {

    @Test
    @DisplayName("settings を読み、ワークスペースのルートは記述子のディレクトリとする")
    void readsSettings(@TempDir Path dir) {
        Path file = WorkspaceFixtures.write(dir, "game/demo.b3-workspace", """
                {"settings": {"checkExpr": true, "buildScript": "scripts/build.jar", "logPath": "logs/build.log"}}
                """);

        WorkspaceDescriptor descriptor = WorkspaceDescriptor.read(file);

        assertThat(descriptor.workdir()).isEqualTo(dir.resolve("game").toAbsolutePath().normalize());
        assertThat(descriptor.settings().checkExpr()).isTrue();
        assertThat(descriptor.settings().buildScriptOption()).contains("scripts/build.jar");
        assertThat(descriptor.settings().logPathOption()).contains("logs/build.log");
    }

    @Test
    @DisplayName("settings がなければ既定値を使う")
    void defaultsWithoutSettings(@TempDir Path dir) {
        Path file = WorkspaceFixtures.write(dir, "demo.b3-workspace", "{}");

        WorkspaceDescriptor.Settings settings = WorkspaceDescriptor.read(file).settings();

        assertThat(settings).isEqualTo(WorkspaceDescriptor.Settings.DEFAULT);
        assertThat(settings.buildScriptOption()).isEmpty();
        assertThat(settings.withCheckExpr(true).checkExpr()).isTrue();
    }

    @Test
    @DisplayName("記述子がなければ TreeFormatException を送出する")
    void missingDescriptor(@TempDir Path dir) {
        assertThatThrownBy(() -> WorkspaceDescriptor.read(dir.resolve("none.b3-workspace")))
                .isInstanceOf(TreeFormatException.class)
                .hasMessageContaining("ワークスペース記述子が見つかりません");
    }
}
