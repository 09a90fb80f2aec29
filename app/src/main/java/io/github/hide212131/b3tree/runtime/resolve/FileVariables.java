package io.github.hide212131.b3tree.runtime.resolve;

import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.util.List;

/**
 * ツリー 1 件から見える変数。{@code merged} は自身・import・サブツリーの順に名前で重複を除いたもの。
 */
public record FileVariables(
        List<ImportEntry> imports,
        List<ImportEntry> subtrees,
        List<VariableDeclaration> locals,
        List<VariableDeclaration> merged) {

    public FileVariables {
        imports = List.copyOf(imports);
        subtrees = List.copyOf(subtrees);
        locals = List.copyOf(locals);
        merged = List.copyOf(merged);
    }
}
