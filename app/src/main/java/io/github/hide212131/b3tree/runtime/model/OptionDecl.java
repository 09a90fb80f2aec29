package io.github.hide212131.b3tree.runtime.model;

import java.util.Objects;

/** 列挙型の引数が取りうる選択肢。 */
public record OptionDecl(String name, Object value, String desc) {

    public OptionDecl {
        Objects.requireNonNull(name, "name");
    }
}
