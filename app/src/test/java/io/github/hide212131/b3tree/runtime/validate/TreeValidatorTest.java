package io.github.hide212131.b3tree.runtime.validate;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.b3tree.runtime.TreeWorkspace;
import io.github.hide212131.b3tree.runtime.WorkspaceFixtures;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("PMD.JUnitTestContainsTooManyAsserts")
class TreeValidatorTest {

    private static final String VARS = """
            [{"name": "hp"}, {"name": "t"}, {"name": "a"}, {"name": "b"}, {"name": "c"}, {"name": "r"}]
            """;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        WorkspaceFixtures.workspace(dir);
    }

    @Test
    @DisplayName("正しいツリーは診断なしで通る")
    void validTreePasses() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "Log", "args": {"message": "hello"}},
                  {"name": "Pick", "args": {"mode": "b", "count": 3}},
                  {"name": "Check", "args": {"value": "hp > 0 && t.alive"}},
                  {"name": "GetHp", "input": ["t"], "output": ["hp"]}
                ]}
                """);

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.ok()).isTrue();
    }

    @Test
    @DisplayName("未定義ノードを報告しても兄弟ノードの検証は続ける")
    void undefinedNodeDoesNotStopSiblings() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "Unknown", "children": [{"name": "Log"}]},
                  {"name": "Pick", "args": {"mode": "z"}}
                ]}
                """);

        assertThat(result.ok()).isFalse();
        assertThat(messages(result)).containsExactly(
                "check 2|Unknown: undefined node: Unknown",
                "check 4|Pick: 'mode=\"z\"' is not a one of the option values");
        assertThat(result.diagnostics().get(0).category()).isEqualTo(Diagnostic.Category.REFERENCE);
    }

    @Test
    @DisplayName("省略可能な列挙引数は未指定と選択肢の値を受け付け、それ以外は拒否する")
    void optionalEnumArgument() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "Tone"},
                  {"name": "Tone", "args": {"tone": "a"}},
                  {"name": "Tone", "args": {"tone": "b"}},
                  {"name": "Tone", "args": {"tone": "c"}}
                ]}
                """);

        assertThat(result.ok()).isFalse();
        assertThat(messages(result)).containsExactly(
                "check 5|Tone: 'tone=\"c\"' is not a one of the option values");
    }

    @Test
    @DisplayName("子の数が定義と違えば報告する")
    void arityMismatch() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Invert", "children": [
                  {"name": "Log", "args": {"message": "x"}, "children": [{"name": "Fail"}]},
                  {"name": "Fail"}
                ]}
                """);

        assertThat(messages(result)).containsExactly(
                "check 1|Invert: expect 1 children, but got 2",
                "check 2|Log: expect 0 children, but got 1");
        assertThat(result.diagnostics()).allSatisfy(
                diagnostic -> assertThat(diagnostic.category()).isEqualTo(Diagnostic.Category.STRUCTURE));
    }

    @Test
    @DisplayName("引数は既定値を補い、定義にない引数を落として作り直す")
    void argumentsAreRebuilt() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Log", "args": {"extra": 1, "message": "hi"}}
                """);

        assertThat(result.ok()).isTrue();
        assertThat(result.tree().getRoot().getArgs()).containsExactly(
                Map.entry("message", "hi"), Map.entry("level", "info"));
        assertThat(result.tree().getRoot().getChildren()).isEmpty();
    }

    @Test
    @DisplayName("値型と一致しない引数を報告する")
    void argumentTypeMismatch() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "Wait", "args": {"time": "soon"}},
                  {"name": "Pick", "args": {"mode": "a", "count": 1.5}},
                  {"name": "Log", "args": {"message": ""}}
                ]}
                """);

        assertThat(messages(result)).containsExactly(
                "check 2|Wait: 'time=\"soon\"' is not a number",
                "check 3|Pick: 'count=1.5' is not a int",
                "check 4|Log: 'message=\"\"' is not a string");
    }

    @Test
    @DisplayName("入力は定義の長さまで埋め、余りは切り詰める")
    void slotsArePaddedAndTruncated() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "GetHp", "input": ["t", "a"], "output": ["hp"]},
                  {"name": "GetHp"}
                ]}
                """);

        TreeNode truncated = result.tree().getRoot().getChildren().get(0);
        TreeNode padded = result.tree().getRoot().getChildren().get(1);
        assertThat(truncated.getInput()).containsExactly("t");
        assertThat(padded.getInput()).containsExactly("");
        assertThat(padded.getOutput()).containsExactly("");
        assertThat(messages(result)).containsExactly(
                "check 3|GetHp: input field 'target' is required",
                "check 3|GetHp: output field 'hp' is required");
    }

    @Test
    @DisplayName("可変長の入力は定義より長くても残す")
    void variadicInputKeepsExtraValues() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Concat", "input": ["a", "b", "c"], "output": ["r"]}
                """);

        assertThat(result.ok()).isTrue();
        assertThat(result.tree().getRoot().getInput()).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("未定義の変数と変数名として不正な値を報告する")
    void undefinedAndInvalidVariables() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "GetHp", "input": ["ghost"], "output": ["1hp"]}
                """);

        assertThat(messages(result)).containsExactly(
                "check 1|GetHp: input variable 'ghost' is not defined",
                "check 1|GetHp: output variable '1hp' is not defined",
                "check 1|GetHp: output field '1hp' is not a valid variable name,"
                        + "should start with a letter or underscore");
    }

    @Test
    @DisplayName("式が参照する変数の定義と、有効時は構文を確認する")
    void expressionArguments() {
        TreeWorkspace.CheckResult result = check(VARS, """
                {"name": "Sequence", "children": [
                  {"name": "Check", "args": {"value": "mp > 0"}},
                  {"name": "Check", "args": {"value": "hp >"}},
                  {"name": "Check", "args": {"value": "t !== 'a'"}}
                ]}
                """);

        assertThat(messages(result)).containsExactly(
                "check 2|Check: expr variable 'value' is not defined",
                "check 3|Check: expr 'hp >' is not valid");
    }

    @Test
    @DisplayName("式の構文チェックは無効化できる")
    void expressionSyntaxCheckCanBeDisabled() {
        WorkspaceFixtures.write(dir, "main.json", WorkspaceFixtures.treeWithVars(VARS, "[]", """
                {"name": "Check", "args": {"value": "hp >"}}
                """));
        TreeWorkspace workspace = TreeWorkspace.open(dir);

        assertThat(workspace.check("main.json").ok()).isTrue();
    }

    @Test
    @DisplayName("グループ付きのノードはツリーでグループが有効な場合のみ使える")
    void nodeGroupMustBeEnabled() {
        TreeWorkspace.CheckResult disabled = check(VARS, """
                {"name": "Attack"}
                """);
        assertThat(messages(disabled)).containsExactly("check 1|Attack: node group 'combat' is not enabled");

        WorkspaceFixtures.write(dir, "grouped.json", """
                {"version": "1.8.5", "name": "grouped", "group": ["combat"], "root": {"name": "Attack"}}
                """);
        TreeWorkspace workspace = TreeWorkspace.open(dir);
        assertThat(workspace.check("grouped.json").ok()).isTrue();
    }

    @Test
    @DisplayName("簡易検査は診断を出さずに真偽だけ返す")
    void quickCheckIsSilent() {
        TreeWorkspace workspace = TreeWorkspace.open(dir);
        TreeNode missingInput = new TreeNode("1", "GetHp");
        TreeNode complete = new TreeNode("2", "GetHp");
        complete.setInput(List.of("t"));
        complete.setOutput(List.of("hp"));

        assertThat(workspace.quickCheck(missingInput)).isFalse();
        assertThat(workspace.quickCheck(complete)).isTrue();
        assertThat(workspace.diagnostics().all()).isEmpty();
    }

    private TreeWorkspace.CheckResult check(String vars, String root) {
        WorkspaceFixtures.write(dir, "main.json", WorkspaceFixtures.treeWithVars(vars, "[]", root));
        TreeWorkspace workspace = TreeWorkspace.open(dir);
        workspace.setCheckExpr(true);
        return workspace.check("main.json");
    }

    private static List<String> messages(TreeWorkspace.CheckResult result) {
        return result.diagnostics().stream().map(Diagnostic::message).toList();
    }
}
