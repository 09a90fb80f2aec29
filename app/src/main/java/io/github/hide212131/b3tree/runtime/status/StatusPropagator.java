package io.github.hide212131.b3tree.runtime.status;

import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import java.util.List;
import java.util.Objects;

/**
 * ノード定義の {@code status} 宣言と子ノードの状態から、ノードが取りうる終了状態を求める。
 * <p>
 * 子ノードの状態が確定している前提で 1 ノード分だけ計算する。木全体への適用は
 * 解決処理が帰りがけ順に呼び出す。
 */
public final class StatusPropagator {

    private final NodeDefinitionRegistry registry;

    public StatusPropagator(NodeDefinitionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** ノードの状態を計算して書き込み、その値を返す。 */
    public StatusFlags propagate(TreeNode node) {
        NodeTypeDefinition definition = registry.get(node.getName());
        StatusFlags status = own(definition);
        if (node.getChildren() != null) {
            status = combine(definition, status, aggregate(node.getChildren()));
        }
        node.setStatus(status);
        return status;
    }

    /** 定義に列挙された素の success / failure / running をビットにする。 */
    public static StatusFlags own(NodeTypeDefinition definition) {
        StatusFlags status = StatusFlags.EMPTY;
        for (StatusRule rule : definition.status()) {
            switch (rule) {
                case SUCCESS -> status = status.with(StatusBit.SUCCESS);
                case FAILURE -> status = status.with(StatusBit.FAILURE);
                case RUNNING -> status = status.with(StatusBit.RUNNING);
                default -> {
                    // 合成規則は combine で扱う
                }
            }
        }
        return status;
    }

    /**
     * 子ノードの状態を集約する。無効化された子と状態が空の子は数えない。
     * 成功しえない子が 1 つでもあれば SUCCESS_NEVER_SEEN、失敗しえない子があれば FAILURE_NEVER_SEEN が立つ。
     */
    public static StatusFlags aggregate(List<TreeNode> children) {
        StatusFlags aggregated = StatusFlags.EMPTY;
        for (TreeNode child : children) {
            StatusFlags childStatus = child.getStatus();
            if (childStatus.isEmpty() || child.isDisabled()) {
                continue;
            }
            if (!childStatus.hasSuccess()) {
                aggregated = aggregated.markSuccessNeverSeen();
            }
            if (!childStatus.hasFailure()) {
                aggregated = aggregated.markFailureNeverSeen();
            }
            aggregated = aggregated.union(childStatus);
        }
        return aggregated;
    }

    /**
     * 自身の状態に子の集約結果を合成する。規則は宣言順に適用し、{@code &} 系は既に立ったビットも落としうる。
     * {@code status} を宣言していない定義は集約結果をそのまま (補助ビットごと) 取り込む。
     */
    public static StatusFlags combine(NodeTypeDefinition definition, StatusFlags own, StatusFlags children) {
        if (!definition.hasStatusRules()) {
            return own.union(children);
        }
        StatusFlags status = own;
        for (StatusRule rule : definition.status()) {
            switch (rule) {
                case NOT_SUCCESS -> status = status.withIf(StatusBit.SUCCESS, children.hasFailure());
                case NOT_FAILURE -> status = status.withIf(StatusBit.FAILURE, children.hasSuccess());
                case ANY_SUCCESS -> status = status.withIf(StatusBit.SUCCESS, children.hasSuccess());
                case ANY_FAILURE -> status = status.withIf(StatusBit.FAILURE, children.hasFailure());
                case ANY_RUNNING -> status = status.withIf(StatusBit.RUNNING, children.hasRunning());
                case ALL_SUCCESS -> status = children.successNeverSeen()
                        ? status.without(StatusBit.SUCCESS)
                        : status.withIf(StatusBit.SUCCESS, children.hasSuccess());
                case ALL_FAILURE -> status = children.failureNeverSeen()
                        ? status.without(StatusBit.FAILURE)
                        : status.withIf(StatusBit.FAILURE, children.hasFailure());
                default -> {
                    // 素の状態は own で反映済み
                }
            }
        }
        return status;
    }
}
