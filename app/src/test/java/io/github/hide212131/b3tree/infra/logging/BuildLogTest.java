package io.github.hide212131.b3tree.infra.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings({ "PMD.JUnitTestContainsTooManyAsserts", "PMD.GuardLogStatement" })
class BuildLogTest {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    BuildLogTest() {
        // default
    }

    @Test
    @DisplayName("phase/file/node を含む INFO を出力する")
    void logInfoWithContext() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BuildLog log = new BuildLog(newLogger(out, Level.ALL));

        log.info("build", "main.json", "3|Log", "build: out/main.json");

        String text = out.toString(StandardCharsets.UTF_8);
        assertThat(text).contains("[phase=build]").contains("[level=INFO]").contains("[file=main.json]")
                .contains("[node=3|Log]").contains("build: out/main.json");
    }

    @Test
    @DisplayName("空の項目は - で埋め、例外はクラス名とメッセージを付ける")
    void formatFillsBlanksAndAppendsError() {
        String line = BuildLog.format(Level.SEVERE, "setup", null, " ", "失敗しました",
                new IllegalStateException("boom"));

        assertThat(line).isEqualTo(
                "[phase=setup][level=SEVERE][file=-][node=-] 失敗しました error=IllegalStateException: boom");
    }

    @Test
    @DisplayName("ロガーのレベルが WARNING なら INFO を抑止し WARN/SEVERE は出力する")
    void suppressInfoBelowThreshold() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BuildLog log = new BuildLog(newLogger(out, Level.WARNING));

        log.info("build", null, null, "info-line");
        log.warn("reference", "a.json", null, "warn-line", null);
        log.error("io", "b.json", null, "error-line", null);

        String text = out.toString(StandardCharsets.UTF_8);
        assertThat(text).doesNotContain("info-line");
        assertThat(text).contains("warn-line").contains("error-line");
    }

    @Test
    @DisplayName("ファイル出力を追加し、外した後は書き込まない")
    void attachAndDetachFile(@TempDir Path dir) throws IOException {
        Path logFile = dir.resolve("logs/build.log");
        Logger logger = Logger.getLogger(BuildLog.ROOT_LOGGER + ".test");
        Handler handler = BuildLog.attachFile(logFile);
        try {
            new BuildLog(logger).warn("build", "main.json", null, "attached-line", null);
        } finally {
            BuildLog.detach(handler);
        }
        new BuildLog(logger).warn("build", "main.json", null, "detached-line", null);

        String text = Files.readString(logFile, StandardCharsets.UTF_8);
        assertThat(text).contains("attached-line").doesNotContain("detached-line");
    }

    private Logger newLogger(ByteArrayOutputStream out, Level level) {
        Logger log = Logger.getLogger("build-log-" + UUID.randomUUID());
        log.setUseParentHandlers(false);
        log.setLevel(level);
        Handler handler = new StreamHandler(out, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        handler.setLevel(Level.ALL);
        log.addHandler(handler);
        return log;
    }
}
