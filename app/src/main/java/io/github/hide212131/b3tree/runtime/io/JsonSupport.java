package io.github.hide212131.b3tree.runtime.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hide212131.b3tree.runtime.model.OptionDecl;
import io.github.hide212131.b3tree.runtime.model.ValueType;
import io.github.hide212131.b3tree.runtime.model.VarKind;
import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** JSON 読み書きで共有する {@link ObjectMapper} と、ツリー走査用の小さなヘルパ。 */
public final class JsonSupport {

    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonSupport() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** ファイル全体を JSON として読む。失敗時は {@link TreeFormatException}。 */
    public static JsonNode readFile(Path path) {
        try {
            return MAPPER.readTree(Files.readString(path));
        } catch (IOException ex) {
            throw new TreeFormatException(path, "JSON の読み込みに失敗しました: " + path, ex);
        }
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    public static String text(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }

    public static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asBoolean();
    }

    public static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return result;
        }
        for (JsonNode element : value) {
            result.add(element.isNull() ? "" : element.asText());
        }
        return result;
    }

    /** JSON 値を Map / List / String / Number / Boolean に変換する。{@code null} はそのまま返す。 */
    public static Object toJava(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(value, Object.class);
    }

    public static JsonNode toJson(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static List<OptionDecl> options(JsonNode node) {
        JsonNode value = node.get("options");
        List<OptionDecl> options = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return options;
        }
        for (JsonNode element : value) {
            if (!element.isObject()) {
                continue;
            }
            Object optionValue = toJava(element.get("value"));
            String name = text(element, "name", String.valueOf(optionValue));
            options.add(new OptionDecl(name, optionValue, text(element, "desc")));
        }
        return options;
    }

    /** 変数宣言 1 件を読む。{@code type} 省略時は object_var、{@code value_type} 省略時は string。 */
    public static VariableDeclaration variable(JsonNode node) {
        String valueType = text(node, "value_type");
        JsonNode optional = node.get("optional");
        return new VariableDeclaration(
                text(node, "name", ""),
                text(node, "desc", ""),
                VarKind.parse(text(node, "type"), VarKind.OBJECT_VAR),
                valueType == null || valueType.isBlank() ? ValueType.STRING : ValueType.parse(valueType),
                toJava(node.get("value")),
                toJava(node.get("default")),
                optional != null && optional.asBoolean(),
                options(node));
    }
}
