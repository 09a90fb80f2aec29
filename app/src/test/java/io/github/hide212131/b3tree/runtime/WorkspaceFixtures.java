package io.github.hide212131.b3tree.runtime;

import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionLoader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/** テスト用ワークスペースを組み立てる。 */
public final class WorkspaceFixtures {

    /** テストで使うノード定義一式。 */
    public static final String NODE_CONFIG = """
            [
              {"name": "Sequence", "type": "Composite", "children": -1,
               "status": ["&success", "|failure", "|running"]},
              {"name": "Selector", "type": "Composite", "children": -1,
               "status": ["|success", "&failure", "|running"]},
              {"name": "Parallel", "type": "Composite", "children": -1,
               "status": ["success", "|running"]},
              {"name": "Invert", "type": "Decorator", "children": 1,
               "status": ["!success", "!failure", "|running"]},
              {"name": "AlwaysSuccess", "type": "Decorator", "children": 1,
               "status": ["success", "|running"]},
              {"name": "Passthrough", "type": "Decorator", "children": 1},
              {"name": "Log", "type": "Action", "children": 0, "status": ["success"],
               "input": ["message?"],
               "args": [
                 {"name": "message", "type": "code_var", "value_type": "string"},
                 {"name": "level", "type": "code_var", "value_type": "string", "default": "info",
                  "options": [
                    {"name": "info", "value": "info"},
                    {"name": "warn", "value": "warn"},
                    {"name": "error", "value": "error"}
                  ]}
               ]},
              {"name": "Wait", "type": "Action", "children": 0, "status": ["success", "running"],
               "args": [{"name": "time", "type": "float"}]},
              {"name": "Fail", "type": "Action", "children": 0, "status": ["failure"]},
              {"name": "Check", "type": "Condition", "children": 0, "status": ["success", "failure"],
               "args": [{"name": "value", "type": "code_var", "value_type": "expr"}]},
              {"name": "Pick", "type": "Action", "children": 0, "status": ["success"],
               "args": [
                 {"name": "mode", "type": "const_var", "value_type": "string",
                  "options": [
                    {"name": "A", "value": "a"},
                    {"name": "B", "value": "b"},
                    {"name": "C", "value": "c"}
                  ]},
                 {"name": "count", "type": "int?"}
               ]},
              {"name": "Tone", "type": "Action", "children": 0, "status": ["success"],
               "args": [
                 {"name": "tone", "type": "const_var", "value_type": "string?",
                  "options": [{"name": "A", "value": "a"}, {"name": "B", "value": "b"}]}
               ]},
              {"name": "GetHp", "type": "Action", "children": 0, "status": ["success"],
               "input": ["target"], "output": ["hp"]},
              {"name": "Concat", "type": "Action", "children": 0, "status": ["success"],
               "input": ["first", "rest..."], "output": ["result"]},
              {"name": "Attack", "type": "Action", "children": 0, "status": ["success", "failure"],
               "group": ["combat"]}
            ]
            """;

    private WorkspaceFixtures() {
    }

    /** ノード定義と空の記述子を持つワークスペースを作る。 */
    public static Path workspace(Path dir) {
        write(dir, NodeDefinitionLoader.AGGREGATE_FILE, NODE_CONFIG);
        write(dir, "demo.b3-workspace", "{\"settings\": {}}");
        return dir;
    }

    /** {@code relative} にテキストを書き出し、そのパスを返す。 */
    public static Path write(Path dir, String relative, String content) {
        Path file = dir.resolve(relative);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return file;
    }

    /** ルートノード 1 件だけを持つツリー JSON を作る。 */
    public static String tree(String rootJson) {
        return "{\"version\": \"1.8.5\", \"name\": \"t\", \"root\": " + rootJson + "}";
    }

    /** 変数宣言と import を持つツリー JSON を作る。 */
    public static String treeWithVars(String varsJson, String importsJson, String rootJson) {
        return "{\"version\": \"1.8.5\", \"name\": \"t\", \"vars\": " + varsJson + ", \"import\": " + importsJson
                + ", \"root\": " + rootJson + "}";
    }

    /** 更新時刻を {@code millis} に設定する。 */
    public static void touch(Path file, long millis) {
        try {
            Files.setLastModifiedTime(file, FileTime.fromMillis(millis));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
