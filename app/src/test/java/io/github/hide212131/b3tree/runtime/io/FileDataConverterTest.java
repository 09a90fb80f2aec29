package io.github.hide212131.b3tree.runtime.io;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.b3tree.runtime.WorkspaceFixtures;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionLoader;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDataConverterTest {

    private FileDataConverter converter;

    @BeforeEach
    void setUp(@TempDir Path dir) {
        WorkspaceFixtures.workspace(dir);
        NodeDefinitionRegistry registry = new NodeDefinitionLoader().load(dir).registry();
        converter = new FileDataConverter(registry);
    }

    @Test
    @DisplayName("定義にない入出力・引数と偽のフラグは保存しない")
    void dropsFieldsTheDefinitionDoesNotDeclare() {
        TreeNode node = new TreeNode("1", "Sequence");
        node.setDesc("");
        node.setArgs(Map.of("stray", 1));
        node.setInput(List.of("x"));
        node.setDebug(Boolean.FALSE);
        node.setDisabled(Boolean.TRUE);

        TreeNode saved = converter.toFileData(node, true);

        assertThat(saved.getDesc()).isNull();
        assertThat(saved.getArgs()).isNull();
        assertThat(saved.getInput()).isNull();
        assertThat(saved.getDebug()).isNull();
        assertThat(saved.getDisabled()).isTrue();
        assertThat(saved).isNotSameAs(node);
    }

    @Test
    @DisplayName("サブツリーを含めない場合、ルート以外の参照ノードは子を落とす")
    void subtreeChildrenAreOmittedUnlessRequested() {
        TreeNode reference = new TreeNode("2", "Selector");
        reference.setPath("sub.json");
        reference.addChild(new TreeNode("3", "Fail"));
        TreeNode root = new TreeNode("1", "Sequence");
        root.addChild(reference);

        TreeNode shallow = converter.toFileData(root, false);
        TreeNode deep = converter.toFileData(root, true);

        assertThat(shallow.getChildren().get(0).getPath()).isEqualTo("sub.json");
        assertThat(shallow.getChildren().get(0).getChildren()).isNull();
        assertThat(deep.getChildren().get(0).getChildren()).extracting(TreeNode::getName).containsExactly("Fail");
        assertThat(converter.toFileData(reference, false).getChildren()).hasSize(1);
    }

    @Test
    @DisplayName("定義にある引数と入出力はそのまま写す")
    void keepsDeclaredFields() {
        TreeNode node = new TreeNode("5", "GetHp");
        node.setInput(List.of("t"));
        node.setOutput(List.of("hp"));
        node.setDebug(Boolean.TRUE);

        TreeNode saved = converter.toFileData(node, true);

        assertThat(saved.getId()).isEqualTo("5");
        assertThat(saved.getInput()).containsExactly("t");
        assertThat(saved.getOutput()).containsExactly("hp");
        assertThat(saved.getDebug()).isTrue();
    }
}
