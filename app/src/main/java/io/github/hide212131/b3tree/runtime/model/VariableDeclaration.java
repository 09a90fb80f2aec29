package io.github.hide212131.b3tree.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * ツリーが公開する変数の宣言。マージ後の集合内で {@code name} は一意となる。
 */
public record VariableDeclaration(
        String name,
        String desc,
        VarKind kind,
        ValueType valueType,
        Object value,
        Object defaultValue,
        boolean optional,
        List<OptionDecl> options) {

    public VariableDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(valueType, "valueType");
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static VariableDeclaration of(String name, String desc) {
        return new VariableDeclaration(name, desc, VarKind.OBJECT_VAR, ValueType.STRING, null, null, false, List.of());
    }
}
