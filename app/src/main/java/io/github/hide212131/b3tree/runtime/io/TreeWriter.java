package io.github.hide212131.b3tree.runtime.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.b3tree.runtime.model.OptionDecl;
import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** {@link TreeDocument} を整形済み JSON として書き出す。 */
public final class TreeWriter {

    private TreeWriter() {
    }

    public static void write(Path path, TreeDocument tree) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJsonString(tree));
    }

    public static String toJsonString(TreeDocument tree) {
        try {
            return JsonSupport.MAPPER.writeValueAsString(toJson(tree));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("ツリーの JSON 変換に失敗しました: " + tree.getName(), ex);
        }
    }

    public static ObjectNode toJson(TreeDocument tree) {
        ObjectNode json = JsonSupport.MAPPER.createObjectNode();
        json.put("version", tree.getVersion());
        json.put("name", tree.getName());
        if (tree.getDesc() != null) {
            json.put("desc", tree.getDesc());
        }
        json.put("prefix", tree.getPrefix());
        if (tree.getExport() != null) {
            json.put("export", tree.getExport());
        }
        json.set("group", strings(tree.getGroup()));
        json.set("import", strings(tree.getImports()));
        ArrayNode vars = json.putArray("vars");
        for (VariableDeclaration declaration : tree.getVars()) {
            vars.add(variable(declaration));
        }
        json.set("root", node(tree.getRoot()));
        return json;
    }

    public static ObjectNode node(TreeNode node) {
        ObjectNode json = JsonSupport.MAPPER.createObjectNode();
        json.put("id", node.getId());
        json.put("name", node.getName());
        if (node.getDesc() != null) {
            json.put("desc", node.getDesc());
        }
        if (node.getArgs() != null) {
            ObjectNode args = json.putObject("args");
            for (Map.Entry<String, Object> entry : node.getArgs().entrySet()) {
                args.set(entry.getKey(), JsonSupport.toJson(entry.getValue()));
            }
        }
        if (node.getInput() != null) {
            json.set("input", strings(node.getInput()));
        }
        if (node.getOutput() != null) {
            json.set("output", strings(node.getOutput()));
        }
        if (node.getDebug() != null) {
            json.put("debug", node.getDebug());
        }
        if (node.getDisabled() != null) {
            json.put("disabled", node.getDisabled());
        }
        if (node.getPath() != null) {
            json.put("path", node.getPath());
        }
        if (node.getChildren() != null) {
            ArrayNode children = json.putArray("children");
            for (TreeNode child : node.getChildren()) {
                children.add(node(child));
            }
        }
        return json;
    }

    private static ObjectNode variable(VariableDeclaration declaration) {
        ObjectNode json = JsonSupport.MAPPER.createObjectNode();
        json.put("name", declaration.name());
        json.put("desc", declaration.desc() == null ? "" : declaration.desc());
        json.put("type", declaration.kind().wireName());
        json.put("value_type", declaration.valueType().raw());
        if (declaration.value() != null) {
            json.set("value", JsonSupport.toJson(declaration.value()));
        }
        if (declaration.defaultValue() != null) {
            json.set("default", JsonSupport.toJson(declaration.defaultValue()));
        }
        if (declaration.optional()) {
            json.put("optional", true);
        }
        if (!declaration.options().isEmpty()) {
            ArrayNode options = json.putArray("options");
            for (OptionDecl option : declaration.options()) {
                ObjectNode element = options.addObject();
                element.put("name", option.name());
                element.set("value", JsonSupport.toJson(option.value()));
                if (option.desc() != null) {
                    element.put("desc", option.desc());
                }
            }
        }
        return json;
    }

    private static ArrayNode strings(List<String> values) {
        ArrayNode array = JsonSupport.MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }
}
