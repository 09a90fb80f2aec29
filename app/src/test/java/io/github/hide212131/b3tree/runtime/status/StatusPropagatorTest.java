package io.github.hide212131.b3tree.runtime.status;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.NodeCategory;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StatusPropagatorTest {

    private final NodeDefinitionRegistry registry = NodeDefinitionRegistry.of(List.of(
            definition("Sequence", "&success", "|failure", "|running"),
            definition("Selector", "|success", "&failure", "|running"),
            definition("Invert", "!success", "!failure", "|running"),
            definition("Passthrough"),
            definition("Log", "success"),
            definition("Wait", "success", "running"),
            definition("Fail", "failure"),
            new NodeTypeDefinition("Odd", NodeCategory.DECORATOR, "", 1, List.of(), List.of(), List.of(),
                    List.of(), List.of(), true)));

    private final StatusPropagator propagator = new StatusPropagator(registry);

    @Test
    @DisplayName("Sequence は全ての子が成功しうる場合のみ success を持ち、running を引き継ぐ")
    void sequenceOfLogAndWait() {
        TreeNode root = node("Sequence", node("Log"), node("Wait"));

        StatusFlags status = propagateAll(root);

        assertThat(status.outcomes()).containsExactlyInAnyOrder(StatusBit.SUCCESS, StatusBit.RUNNING);
    }

    @Test
    @DisplayName("成功しえない子がいると &success は success を落とし、|failure は failure を立てる")
    void allSuccessIsClearedBySingleFailingChild() {
        TreeNode root = node("Sequence", node("Log"), node("Fail"));

        StatusFlags status = propagateAll(root);

        assertThat(status.outcomes()).containsExactly(StatusBit.FAILURE);
    }

    @Test
    @DisplayName("Selector は全ての子が失敗しうる場合に failure を持つ")
    void selectorFailsOnlyWhenAllChildrenCanFail() {
        TreeNode allFail = node("Selector", node("Fail"), node("Fail"));
        TreeNode mixed = node("Selector", node("Fail"), node("Log"));

        assertThat(propagateAll(allFail).outcomes()).containsExactly(StatusBit.FAILURE);
        assertThat(propagateAll(mixed).outcomes()).containsExactly(StatusBit.SUCCESS);
    }

    @Test
    @DisplayName("Invert は子の success を failure に入れ替える")
    void invertSwapsOutcomes() {
        TreeNode root = node("Invert", node("Log"));

        assertThat(propagateAll(root).outcomes()).containsExactly(StatusBit.FAILURE);
    }

    @Test
    @DisplayName("status 宣言のない定義は子の集約結果を補助ビットごと取り込む")
    void definitionWithoutRulesTakesUnion() {
        TreeNode root = node("Passthrough", node("Wait"));

        StatusFlags status = propagateAll(root);

        assertThat(status.outcomes()).containsExactlyInAnyOrder(StatusBit.SUCCESS, StatusBit.RUNNING);
        assertThat(status.failureNeverSeen()).isTrue();
        assertThat(status.successNeverSeen()).isFalse();
    }

    @Test
    @DisplayName("status を宣言した定義は、有効な規則が残らなくても子の集約結果を取り込まない")
    void declaredStatusWithoutRulesDoesNotTakeUnion() {
        TreeNode root = node("Odd", node("Wait"));

        StatusFlags status = propagateAll(root);

        assertThat(status.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("無効化された子と状態が空の子は集約に数えない")
    void disabledChildrenAreIgnored() {
        TreeNode failing = node("Fail");
        failing.setDisabled(Boolean.TRUE);
        TreeNode root = node("Sequence", node("Log"), failing);

        assertThat(propagateAll(root).outcomes()).containsExactly(StatusBit.SUCCESS);
        assertThat(StatusPropagator.aggregate(List.of(new TreeNode("9", "Unknown")))).isEqualTo(StatusFlags.EMPTY);
    }

    @Test
    @DisplayName("子リストを持たない葉ノードは自身の宣言だけで決まる")
    void leafUsesOwnStatus() {
        TreeNode leaf = node("Wait");

        assertThat(propagator.propagate(leaf)).isEqualTo(StatusFlags.of(StatusBit.SUCCESS, StatusBit.RUNNING));
        assertThat(leaf.getStatus().toInt()).isEqualTo(0b101);
    }

    @Test
    @DisplayName("子が空の Sequence は終了状態を持たない")
    void emptyCompositeHasNoOutcome() {
        TreeNode root = new TreeNode("1", "Sequence");
        root.setChildren(new ArrayList<>());

        assertThat(propagator.propagate(root).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("未知の status 表記は解析できない")
    void parseRejectsUnknownToken() {
        assertThat(StatusRule.parse("&success")).contains(StatusRule.ALL_SUCCESS);
        assertThat(StatusRule.parse("?success")).isEmpty();
        assertThat(StatusRule.ALL_SUCCESS.isOwnStatus()).isFalse();
    }

    private StatusFlags propagateAll(TreeNode node) {
        if (node.getChildren() != null) {
            node.getChildren().forEach(this::propagateAll);
        }
        return propagator.propagate(node);
    }

    private static TreeNode node(String name, TreeNode... children) {
        TreeNode node = new TreeNode("", name);
        if (children.length > 0) {
            node.setChildren(new ArrayList<>(Arrays.asList(children)));
        }
        return node;
    }

    private static NodeTypeDefinition definition(String name, String... status) {
        List<StatusRule> rules = Arrays.stream(status).map(token -> StatusRule.parse(token).orElseThrow()).toList();
        return new NodeTypeDefinition(name, NodeCategory.ACTION, "", NodeTypeDefinition.UNBOUNDED, List.of(),
                List.of(), List.of(), rules, List.of());
    }
}
