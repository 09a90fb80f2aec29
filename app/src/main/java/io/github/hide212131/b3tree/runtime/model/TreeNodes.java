package io.github.hide212131.b3tree.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** ノード木の走査ユーティリティ。 */
public final class TreeNodes {

    private TreeNodes() {
    }

    /**
     * 深さ優先で前順走査する。{@code visitor} が {@code false} を返した場合は走査全体を打ち切る。
     */
    public static void dfs(TreeNode node, Predicate<TreeNode> visitor) {
        traverse(node, visitor);
    }

    private static boolean traverse(TreeNode node, Predicate<TreeNode> visitor) {
        if (!visitor.test(node)) {
            return false;
        }
        if (node.getChildren() != null) {
            for (TreeNode child : node.getChildren()) {
                if (!traverse(child, visitor)) {
                    return false;
                }
            }
        }
        return true;
    }

    /** 木に含まれるサブツリー参照パスを出現順に集める。 */
    public static List<String> collectSubtreePaths(TreeNode root) {
        List<String> paths = new ArrayList<>();
        dfs(root, node -> {
            if (node.isSubtreeReference()) {
                paths.add(node.getPath());
            }
            return true;
        });
        return paths;
    }

    public static int count(TreeNode root) {
        int[] counter = { 0 };
        dfs(root, node -> {
            counter[0]++;
            return true;
        });
        return counter[0];
    }
}
