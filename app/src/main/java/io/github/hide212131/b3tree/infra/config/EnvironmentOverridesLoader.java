package io.github.hide212131.b3tree.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてワークスペース設定の上書き値を解決する。
 */
public final class EnvironmentOverridesLoader {

    static final String ENV_CHECK_EXPR = "B3_CHECK_EXPR";
    static final String ENV_LOG_FILE = "B3_LOG_FILE";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public EnvironmentOverridesLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    EnvironmentOverridesLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public EnvironmentOverrides load() {
        Optional<Boolean> checkExpr = trimToEmpty(resolveWithPriority(ENV_CHECK_EXPR))
                .map(EnvironmentOverridesLoader::parseBoolean);
        Optional<Path> logFile = trimToEmpty(resolveWithPriority(ENV_LOG_FILE)).map(Path::of);
        return new EnvironmentOverrides(checkExpr, logFile);
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static Optional<String> trimToEmpty(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    static boolean parseBoolean(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(ENV_CHECK_EXPR + " に真偽値として解釈できない値が指定されています: " + raw);
        };
    }

    /** 環境由来の上書き値。未指定の項目は空。 */
    public record EnvironmentOverrides(Optional<Boolean> checkExpr, Optional<Path> logFile) {

        public static final EnvironmentOverrides NONE = new EnvironmentOverrides(Optional.empty(), Optional.empty());

        public EnvironmentOverrides {
            checkExpr = checkExpr == null ? Optional.empty() : checkExpr;
            logFile = logFile == null ? Optional.empty() : logFile;
        }
    }
}
