package io.github.hide212131.b3tree.runtime.io;

import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * 保存用のノードを作る。空の項目と、定義が持たない args / input / output は落とす。
 * <p>
 * {@code includeSubtree} が偽のとき、ルート以外のサブツリー参照ノードは子を保存しない (参照パスだけを残す)。
 */
public final class FileDataConverter {

    private final NodeDefinitionRegistry registry;

    public FileDataConverter(NodeDefinitionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public TreeNode toFileData(TreeNode root, boolean includeSubtree) {
        return convert(root, includeSubtree, true);
    }

    private TreeNode convert(TreeNode source, boolean includeSubtree, boolean root) {
        TreeNode target = new TreeNode(source.getId(), source.getName());
        if (source.getDesc() != null && !source.getDesc().isEmpty()) {
            target.setDesc(source.getDesc());
        }
        NodeTypeDefinition definition = registry.get(source.getName());
        if (!definition.args().isEmpty() && source.getArgs() != null) {
            target.setArgs(new LinkedHashMap<>(source.getArgs()));
        }
        if (!definition.input().isEmpty() && source.getInput() != null) {
            target.setInput(new ArrayList<>(source.getInput()));
        }
        if (!definition.output().isEmpty() && source.getOutput() != null) {
            target.setOutput(new ArrayList<>(source.getOutput()));
        }
        if (Boolean.TRUE.equals(source.getDebug())) {
            target.setDebug(Boolean.TRUE);
        }
        if (source.isDisabled()) {
            target.setDisabled(Boolean.TRUE);
        }
        if (source.isSubtreeReference()) {
            target.setPath(source.getPath());
        }
        boolean keepChildren = includeSubtree || root || !source.isSubtreeReference();
        if (source.hasChildren() && keepChildren) {
            List<TreeNode> children = new ArrayList<>(source.getChildren().size());
            for (TreeNode child : source.getChildren()) {
                children.add(convert(child, includeSubtree, false));
            }
            target.setChildren(children);
        }
        return target;
    }
}
