package io.github.hide212131.b3tree.runtime.io;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ツリー JSON を {@link TreeDocument} に読み込む。
 * <p>
 * 欠けた項目は既定値で補い、旧形式 ({@code declvar}、配列形式の {@code args}、数値の {@code id}) も受け付ける。
 */
public final class TreeReader {

    private TreeReader() {
    }

    public static TreeDocument read(Path path) {
        JsonNode json = JsonSupport.readFile(path);
        if (!json.isObject()) {
            throw new TreeFormatException(path, "ツリーのルートが JSON オブジェクトではありません: " + path);
        }
        return parse(json);
    }

    public static TreeDocument parse(JsonNode json) {
        TreeDocument tree = new TreeDocument();
        tree.setVersion(JsonSupport.text(json, "version", TreeDocument.FORMAT_VERSION));
        tree.setName(JsonSupport.text(json, "name", ""));
        tree.setPrefix(JsonSupport.text(json, "prefix", ""));
        tree.setDesc(JsonSupport.text(json, "desc"));
        tree.setExport(JsonSupport.bool(json, "export"));
        tree.setGroup(JsonSupport.stringList(json, "group"));
        tree.setImports(JsonSupport.stringList(json, "import"));
        JsonNode vars = json.has("vars") ? json.get("vars") : json.get("declvar");
        List<VariableDeclaration> declarations = new ArrayList<>();
        if (vars != null && vars.isArray()) {
            for (JsonNode element : vars) {
                if (element.isObject()) {
                    declarations.add(JsonSupport.variable(element));
                }
            }
        }
        tree.setVars(declarations);
        JsonNode root = json.get("root");
        tree.setRoot(root != null && root.isObject() ? readNode(root) : new TreeNode());
        return tree;
    }

    public static TreeNode readNode(JsonNode json) {
        TreeNode node = new TreeNode(JsonSupport.text(json, "id", ""), JsonSupport.text(json, "name", ""));
        node.setDesc(JsonSupport.text(json, "desc"));
        node.setArgs(readArgs(json.get("args")));
        if (json.has("input")) {
            node.setInput(JsonSupport.stringList(json, "input"));
        }
        if (json.has("output")) {
            node.setOutput(JsonSupport.stringList(json, "output"));
        }
        node.setPath(JsonSupport.text(json, "path"));
        node.setDebug(JsonSupport.bool(json, "debug"));
        node.setDisabled(JsonSupport.bool(json, "disabled"));
        JsonNode children = json.get("children");
        if (children != null && children.isArray()) {
            List<TreeNode> list = new ArrayList<>(children.size());
            for (JsonNode child : children) {
                if (child.isObject()) {
                    list.add(readNode(child));
                }
            }
            node.setChildren(list);
        }
        return node;
    }

    private static Map<String, Object> readArgs(JsonNode args) {
        if (args == null || args.isNull()) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        if (args.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = args.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                result.put(entry.getKey(), JsonSupport.toJava(entry.getValue()));
            }
        } else if (args.isArray()) {
            // 旧形式: [{name, type, value}]
            for (JsonNode element : args) {
                String name = JsonSupport.text(element, "name");
                if (name != null) {
                    result.put(name, JsonSupport.toJava(element.get("value")));
                }
            }
        }
        return result;
    }
}
