package io.github.hide212131.b3tree.infra.logging;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * ビルド・検証の経過を {@code [phase=..][level=..][file=..][node=..] message} 形式で出力する。
 */
@SuppressWarnings({ "PMD.GuardLogStatement", "PMD.AvoidDuplicateLiterals" })
public final class BuildLog {

    /** このツールのロガー階層の根。 */
    public static final String ROOT_LOGGER = "io.github.hide212131.b3tree";

    private static final int FORMAT_BUFFER_SIZE = 160;

    private final Logger logger;

    public BuildLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static BuildLog forClass(Class<?> type) {
        return new BuildLog(Logger.getLogger(type.getName()));
    }

    public void info(String phase, String file, String node, String message) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        logger.log(Level.INFO, format(Level.INFO, phase, file, node, message, null));
    }

    public void warn(String phase, String file, String node, String message, Throwable error) {
        if (!logger.isLoggable(Level.WARNING)) {
            return;
        }
        logger.log(Level.WARNING, format(Level.WARNING, phase, file, node, message, error), error);
    }

    public void error(String phase, String file, String node, String message, Throwable error) {
        if (!logger.isLoggable(Level.SEVERE)) {
            return;
        }
        logger.log(Level.SEVERE, format(Level.SEVERE, phase, file, node, message, error), error);
    }

    static String format(Level level, String phase, String file, String node, String message, Throwable error) {
        String header = String.format(Locale.ROOT, "[phase=%s][level=%s][file=%s][node=%s] %s",
                valueOrDash(phase), level.getName(), valueOrDash(file), valueOrDash(node),
                message == null ? "" : message);
        if (error == null) {
            return header;
        }
        StringBuilder sb = new StringBuilder(FORMAT_BUFFER_SIZE);
        sb.append(header)
                .append(" error=")
                .append(error.getClass().getSimpleName())
                .append(": ")
                .append(error.getMessage());
        return sb.toString();
    }

    /**
     * ルートロガーにファイル出力を追加する。呼び出し側が不要になった時点で {@link Handler#close()} する。
     */
    public static Handler attachFile(Path logFile) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileHandler handler = new FileHandler(logFile.toAbsolutePath().toString(), true);
        handler.setEncoding(StandardCharsets.UTF_8.name());
        handler.setFormatter(new SimpleFormatter());
        Logger.getLogger(ROOT_LOGGER).addHandler(handler);
        return handler;
    }

    public static void detach(Handler handler) {
        if (handler == null) {
            return;
        }
        Logger.getLogger(ROOT_LOGGER).removeHandler(handler);
        handler.close();
    }

    private static String valueOrDash(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim();
    }
}
