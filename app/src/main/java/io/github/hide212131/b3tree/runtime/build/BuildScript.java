package io.github.hide212131.b3tree.runtime.build;

import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * ビルド時の変換フック。すべて既定では何もしない (そのまま通す)。
 * <p>
 * {@code errors} に追加したメッセージはビルドエラーとして報告され、そのファイルは失敗扱いになる。
 */
public interface BuildScript {

    default void onSetup(BuildEnvironment environment) {
    }

    /** ツリー全体を変換する。空を返すとファイルごと出力しない。 */
    default Optional<TreeDocument> onProcessTree(TreeDocument tree, Path path, List<String> errors) {
        return Optional.of(tree);
    }

    /** 子から順に呼ばれる。空を返すとそのノードを削除する。 */
    default Optional<TreeNode> onProcessNode(TreeNode node, List<String> errors) {
        return Optional.of(node);
    }

    default void onWriteFile(Path path, TreeDocument tree) {
    }

    default void onComplete(BuildStatus status) {
    }
}
