package io.github.hide212131.b3tree.runtime.registry;

import io.github.hide212131.b3tree.runtime.model.OptionDecl;
import io.github.hide212131.b3tree.runtime.model.ValueType;
import io.github.hide212131.b3tree.runtime.model.VarKind;
import java.util.List;
import java.util.Objects;

/**
 * ノード定義における引数 1 件の定義。
 *
 * @param oneof 同時に指定できない入力スロット名の接頭辞 (未指定なら {@code null})
 */
public record ArgumentSchema(
        String name,
        String desc,
        VarKind kind,
        ValueType valueType,
        Object defaultValue,
        List<OptionDecl> options,
        String oneof) {

    public ArgumentSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(valueType, "valueType");
        options = options == null ? List.of() : List.copyOf(options);
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
