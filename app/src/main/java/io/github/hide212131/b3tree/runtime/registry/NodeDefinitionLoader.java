package io.github.hide212131.b3tree.runtime.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hide212131.b3tree.runtime.io.JsonSupport;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.model.ValueType;
import io.github.hide212131.b3tree.runtime.model.VarKind;
import io.github.hide212131.b3tree.runtime.status.StatusRule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ワークスペース直下からノード定義を読み込む。
 * <p>
 * {@code nodes/*.json} (1 ファイル 1 定義) が有効な定義を 1 件以上含む場合はそちらを優先し、
 * それ以外は {@code node-config.b3-setting} (定義の配列) を使う。不正な定義は警告として記録して読み飛ばす。
 */
public final class NodeDefinitionLoader {

    public static final String AGGREGATE_FILE = "node-config.b3-setting";
    public static final String DEFINITION_DIR = "nodes";

    public LoadResult load(Path workdir) {
        Objects.requireNonNull(workdir, "workdir");
        List<String> warnings = new ArrayList<>();
        Map<String, NodeTypeDefinition> fromDirectory = loadDirectory(workdir.resolve(DEFINITION_DIR), warnings);
        if (!fromDirectory.isEmpty()) {
            return new LoadResult(new NodeDefinitionRegistry(fromDirectory), List.copyOf(warnings));
        }
        Map<String, NodeTypeDefinition> fromAggregate = loadAggregate(workdir.resolve(AGGREGATE_FILE), warnings);
        return new LoadResult(new NodeDefinitionRegistry(fromAggregate), List.copyOf(warnings));
    }

    private Map<String, NodeTypeDefinition> loadDirectory(Path directory, List<String> warnings) {
        Map<String, NodeTypeDefinition> definitions = new LinkedHashMap<>();
        if (!Files.isDirectory(directory)) {
            return definitions;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            warnings.add("ノード定義ディレクトリを読めません: " + directory + " (" + ex.getMessage() + ")");
            return definitions;
        }
        for (Path file : files) {
            try {
                JsonNode json = JsonSupport.readFile(file);
                if (!json.isObject()) {
                    warnings.add("ノード定義が JSON オブジェクトではありません: " + file);
                    continue;
                }
                parse(json, file, warnings).ifPresent(definition -> register(definitions, definition, file, warnings));
            } catch (TreeFormatException ex) {
                warnings.add("ノード定義を読めません: " + file + " (" + ex.getCause().getMessage() + ")");
            }
        }
        return definitions;
    }

    private Map<String, NodeTypeDefinition> loadAggregate(Path file, List<String> warnings) {
        Map<String, NodeTypeDefinition> definitions = new LinkedHashMap<>();
        if (!Files.isRegularFile(file)) {
            warnings.add("ノード定義が見つかりません: " + file);
            return definitions;
        }
        JsonNode json;
        try {
            json = JsonSupport.readFile(file);
        } catch (TreeFormatException ex) {
            warnings.add("ノード定義を読めません: " + file + " (" + ex.getCause().getMessage() + ")");
            return definitions;
        }
        if (!json.isArray()) {
            warnings.add("ノード定義ファイルが JSON 配列ではありません: " + file);
            return definitions;
        }
        for (JsonNode element : json) {
            if (!element.isObject()) {
                warnings.add("オブジェクトでないノード定義を無視しました: " + file);
                continue;
            }
            parse(element, file, warnings).ifPresent(definition -> register(definitions, definition, file, warnings));
        }
        return definitions;
    }

    private static void register(
            Map<String, NodeTypeDefinition> definitions, NodeTypeDefinition definition, Path file, List<String> warnings) {
        if (definitions.containsKey(definition.name())) {
            warnings.add("ノード定義 '" + definition.name() + "' が重複しています。後の定義で上書きします: " + file);
        }
        definitions.put(definition.name(), definition);
    }

    static Optional<NodeTypeDefinition> parse(JsonNode json, Path file, List<String> warnings) {
        String name = JsonSupport.text(json, "name");
        String type = JsonSupport.text(json, "type");
        if (name == null || name.isBlank()) {
            warnings.add("name のないノード定義を無視しました: " + file);
            return Optional.empty();
        }
        if (type == null || type.isBlank()) {
            warnings.add("ノード定義 '" + name + "' に type がないため無視しました: " + file);
            return Optional.empty();
        }
        JsonNode children = json.get("children");
        int childCount = children != null && children.isNumber() ? children.asInt() : NodeTypeDefinition.UNBOUNDED;
        List<String> status = JsonSupport.stringList(json, "status");
        return Optional.of(new NodeTypeDefinition(
                name,
                NodeCategory.parse(type),
                JsonSupport.text(json, "desc", ""),
                childCount < 0 ? NodeTypeDefinition.UNBOUNDED : childCount,
                arguments(json.get("args"), name, warnings),
                SlotSchema.parseAll(slotNames(json.get("input"))),
                SlotSchema.parseAll(slotNames(json.get("output"))),
                statusRules(status, name, warnings),
                JsonSupport.stringList(json, "group"),
                !status.isEmpty()));
    }

    private static List<String> slotNames(JsonNode slots) {
        List<String> names = new ArrayList<>();
        if (slots == null || !slots.isArray()) {
            return names;
        }
        for (JsonNode slot : slots) {
            // 変数宣言形式 ({name, ...}) でも書ける
            names.add(slot.isObject() ? JsonSupport.text(slot, "name", "") : slot.asText());
        }
        return names;
    }

    /**
     * 引数定義を読む。{@code value_type} があれば {@code type} は変数種別、
     * なければ {@code type} を値型 ({@code "int?"} など) として読む。
     */
    private static List<ArgumentSchema> arguments(JsonNode args, String owner, List<String> warnings) {
        List<ArgumentSchema> result = new ArrayList<>();
        if (args == null || !args.isArray()) {
            return result;
        }
        for (JsonNode arg : args) {
            String argName = JsonSupport.text(arg, "name");
            if (argName == null || argName.isBlank()) {
                warnings.add("ノード定義 '" + owner + "' の name のない引数を無視しました");
                continue;
            }
            String type = JsonSupport.text(arg, "type");
            String valueType = JsonSupport.text(arg, "value_type");
            VarKind kind;
            ValueType parsedType;
            if (valueType != null) {
                kind = VarKind.parse(type, VarKind.CONST_VAR);
                parsedType = ValueType.parse(valueType);
            } else if (VarKind.parse(type, null) != null) {
                kind = VarKind.parse(type, VarKind.CONST_VAR);
                parsedType = ValueType.STRING;
            } else {
                kind = VarKind.CONST_VAR;
                parsedType = ValueType.parse(type);
            }
            result.add(new ArgumentSchema(
                    argName,
                    JsonSupport.text(arg, "desc", ""),
                    kind,
                    parsedType,
                    JsonSupport.toJava(arg.get("default")),
                    arg.has("options") ? JsonSupport.options(arg) : List.of(),
                    JsonSupport.text(arg, "oneof")));
        }
        return result;
    }

    private static List<StatusRule> statusRules(List<String> raws, String owner, List<String> warnings) {
        List<StatusRule> rules = new ArrayList<>();
        for (String raw : raws) {
            Optional<StatusRule> rule = StatusRule.parse(raw);
            if (rule.isPresent()) {
                rules.add(rule.get());
            } else {
                warnings.add("ノード定義 '" + owner + "' の未知の status '" + raw + "' を無視しました");
            }
        }
        return rules;
    }

    public record LoadResult(NodeDefinitionRegistry registry, List<String> warnings) {}
}
