package io.github.hide212131.b3tree.runtime.resolve;

import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/** 検証時に参照する、有効なノードグループと定義済み変数。 */
public final class VariableScope {

    private Set<String> groups = Collections.emptySet();
    private Map<String, VariableDeclaration> vars = Collections.emptyMap();

    /**
     * グループ集合と変数集合を置き換える。名前の並びが前回と同じなら何もしない。
     *
     * @return どちらかが変わった場合 {@code true}
     */
    public boolean update(Collection<String> nextGroups, Collection<VariableDeclaration> nextVars) {
        boolean changed = false;
        TreeSet<String> sortedGroups = new TreeSet<>(nextGroups);
        if (!new ArrayList<>(sortedGroups).equals(new ArrayList<>(new TreeSet<>(groups)))) {
            groups = Collections.unmodifiableSet(sortedGroups);
            changed = true;
        }
        List<VariableDeclaration> sortedVars = new ArrayList<>(nextVars);
        sortedVars.sort((a, b) -> a.name().compareTo(b.name()));
        List<String> nextNames = sortedVars.stream().map(VariableDeclaration::name).toList();
        List<String> lastNames = new ArrayList<>(new TreeSet<>(vars.keySet()));
        if (!nextNames.equals(lastNames)) {
            Map<String, VariableDeclaration> rebuilt = new LinkedHashMap<>();
            for (VariableDeclaration declaration : sortedVars) {
                rebuilt.putIfAbsent(declaration.name(), declaration);
            }
            vars = Collections.unmodifiableMap(rebuilt);
            changed = true;
        }
        return changed;
    }

    public boolean isGroupEnabled(String group) {
        return groups.contains(group);
    }

    public boolean isDefined(String name) {
        return vars.containsKey(name);
    }

    public Optional<VariableDeclaration> find(String name) {
        return Optional.ofNullable(vars.get(name));
    }

    public Set<String> groups() {
        return groups;
    }

    public Map<String, VariableDeclaration> vars() {
        return vars;
    }
}
