package io.github.hide212131.b3tree.runtime.resolve;

import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostics;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.io.TreeReader;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.ArgumentSchema;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import io.github.hide212131.b3tree.runtime.status.StatusFlags;
import io.github.hide212131.b3tree.runtime.status.StatusPropagator;
import java.util.Map;
import java.util.Objects;

/**
 * サブツリー参照をその場に展開し、ノード ID を振り直す。
 * <p>
 * 深さ優先で {@code id = counter++} を割り当てる。参照先ファイルのルートは参照元ノードと同じ ID を受け継ぐ。
 * 子の処理が終わったノードから順に {@link StatusPropagator} で状態を計算する。
 */
public final class SubtreeResolver {

    private final NodeDefinitionRegistry registry;
    private final FileTimestamps timestamps;
    private final ResolveGuard guard;
    private final Diagnostics diagnostics;
    private final StatusPropagator propagator;

    public SubtreeResolver(
            NodeDefinitionRegistry registry, FileTimestamps timestamps, ResolveGuard guard, Diagnostics diagnostics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.propagator = new StatusPropagator(registry);
    }

    /**
     * ファイルのルートを ID 1 から解決する。{@code ownPath} は解決中として扱い、自身への参照を循環として報告する。
     *
     * @return 次に使える ID
     */
    public int resolveTree(TreeNode root, String ownPath) {
        boolean pushed = ownPath != null && guard.push(FileTimestamps.normalize(ownPath));
        try {
            return resolve(root, 1);
        } finally {
            if (pushed) {
                guard.pop(FileTimestamps.normalize(ownPath));
            }
        }
    }

    /**
     * {@code node} 以下を解決する。
     *
     * @return 次に使える ID
     */
    public int resolve(TreeNode node, int startId) {
        int id = startId;
        node.setId(Integer.toString(id++));
        backfillDefaults(node, registry.get(node.getName()));

        if (node.isSubtreeReference()) {
            String path = FileTimestamps.normalize(node.getPath());
            if (guard.contains(path)) {
                diagnostics.error(Diagnostic.Category.REFERENCE, guard.current(), "circular reference: " + path);
                node.setStatus(StatusFlags.EMPTY);
                return id;
            }
            guard.push(path);
            try {
                TreeNode subtree = TreeReader.read(timestamps.resolve(path)).getRoot();
                id = resolve(subtree, id - 1);
                node.setName(subtree.getName());
                node.setDesc(subtree.getDesc());
                node.setArgs(subtree.getArgs());
                node.setInput(subtree.getInput());
                node.setOutput(subtree.getOutput());
                node.setChildren(subtree.getChildren());
                node.setMtime(timestamps.get(path).orElse(null));
            } catch (TreeFormatException ex) {
                guard.pop(path);
                diagnostics.error(Diagnostic.Category.IO, guard.current(), "failed to resolve subtree: " + path);
                propagator.propagate(node);
                return id;
            }
            guard.pop(path);
        } else if (node.hasChildren()) {
            for (TreeNode child : node.getChildren()) {
                id = resolve(child, id);
            }
        }

        propagator.propagate(node);
        return id;
    }

    private static void backfillDefaults(TreeNode node, NodeTypeDefinition definition) {
        if (definition.args().isEmpty()) {
            return;
        }
        Map<String, Object> args = node.args();
        for (ArgumentSchema arg : definition.args()) {
            if (!args.containsKey(arg.name()) && arg.hasDefault()) {
                args.put(arg.name(), arg.defaultValue());
            }
        }
    }
}
