package io.github.hide212131.b3tree.runtime.diagnostic;

import java.util.Objects;

/**
 * 解決・検証・ビルドの途中で見つかった問題 1 件。
 *
 * @param file ワークスペース相対のファイルパス (特定できない場合は {@code null})
 */
public record Diagnostic(Severity severity, Category category, String file, String message) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(Category category, String file, String message) {
        return new Diagnostic(Severity.ERROR, category, file, message);
    }

    public static Diagnostic warning(Category category, String file, String message) {
        return new Diagnostic(Severity.WARNING, category, file, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return (file == null ? "" : file + ": ") + message;
    }

    public enum Severity {
        ERROR,
        WARNING
    }

    /** 問題の分類。 */
    public enum Category {
        /** ノード定義・引数・子の数などの構造上の誤り。 */
        STRUCTURE,
        /** 未定義の変数やノード、循環参照など参照の誤り。 */
        REFERENCE,
        /** ファイルの欠落や読み書きの失敗。 */
        IO,
        /** ワークスペース設定・ビルドスクリプトの誤り。 */
        CONFIGURATION
    }
}
