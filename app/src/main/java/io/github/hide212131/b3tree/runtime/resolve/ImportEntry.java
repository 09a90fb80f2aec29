package io.github.hide212131.b3tree.runtime.resolve;

import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.util.List;
import java.util.Objects;

/**
 * 1 ファイル分の変数宣言キャッシュ。{@code vars} は推移的な import を含み、名前順に並ぶ。
 *
 * @param modified 読み込み時点のファイル更新時刻
 */
public record ImportEntry(String path, List<VariableDeclaration> vars, List<Dependency> depends, long modified) {

    public ImportEntry {
        Objects.requireNonNull(path, "path");
        vars = vars == null ? List.of() : List.copyOf(vars);
        depends = depends == null ? List.of() : List.copyOf(depends);
    }

    /** 依存ファイルと、記録時点の更新時刻。 */
    public record Dependency(String path, long modified) {

        public Dependency {
            Objects.requireNonNull(path, "path");
        }
    }
}
