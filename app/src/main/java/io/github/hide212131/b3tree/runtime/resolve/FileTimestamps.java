package io.github.hide212131.b3tree.runtime.resolve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ワークスペース相対パスごとの更新時刻 (ミリ秒)。
 * <p>
 * 一度参照した値は {@link #refresh()} まで保持するため、1 回の解決の間は同じ時刻を返す。
 */
public final class FileTimestamps {

    private final Path workdir;
    private final Map<String, Optional<Long>> snapshot = new HashMap<>();

    public FileTimestamps(Path workdir) {
        this.workdir = Objects.requireNonNull(workdir, "workdir");
    }

    public Path workdir() {
        return workdir;
    }

    public Optional<Long> get(String path) {
        return snapshot.computeIfAbsent(normalize(path), this::stat);
    }

    public boolean exists(String path) {
        return get(path).isPresent();
    }

    /** 保持している時刻を捨て、次回参照時にファイルシステムから読み直す。 */
    public void refresh() {
        snapshot.clear();
    }

    public Path resolve(String path) {
        return workdir.resolve(normalize(path));
    }

    /** 区切り文字を {@code /} に揃え、先頭の {@code ./} を除く。 */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private Optional<Long> stat(String path) {
        Path file = workdir.resolve(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(file).toMillis());
        } catch (IOException ex) {
            return Optional.empty();
        }
    }
}
