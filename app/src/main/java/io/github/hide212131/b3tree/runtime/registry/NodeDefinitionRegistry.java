package io.github.hide212131.b3tree.runtime.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * ノード定義の参照テーブル。未登録の名前は例外ではなく {@link NodeTypeDefinition#UNKNOWN} を返す。
 */
public final class NodeDefinitionRegistry {

    private final Map<String, NodeTypeDefinition> definitions;
    private final SortedSet<String> groups;

    public NodeDefinitionRegistry() {
        this(Map.of());
    }

    public NodeDefinitionRegistry(Map<String, NodeTypeDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        SortedSet<String> collected = new TreeSet<>();
        for (NodeTypeDefinition definition : definitions.values()) {
            collected.addAll(definition.group());
        }
        this.groups = Collections.unmodifiableSortedSet(collected);
    }

    public static NodeDefinitionRegistry of(Collection<NodeTypeDefinition> definitions) {
        Map<String, NodeTypeDefinition> map = new LinkedHashMap<>();
        for (NodeTypeDefinition definition : definitions) {
            map.put(definition.name(), definition);
        }
        return new NodeDefinitionRegistry(map);
    }

    public NodeTypeDefinition get(String name) {
        if (name == null) {
            return NodeTypeDefinition.UNKNOWN;
        }
        return definitions.getOrDefault(name, NodeTypeDefinition.UNKNOWN);
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    public Map<String, NodeTypeDefinition> definitions() {
        return definitions;
    }

    /** 定義で宣言されている全グループ名 (昇順)。 */
    public SortedSet<String> groups() {
        return groups;
    }

    public int size() {
        return definitions.size();
    }
}
