package io.github.hide212131.b3tree.runtime.model;

import java.util.Locale;

/** 引数・変数値の供給元の種別。 */
public enum VarKind {
    CONST_VAR("const_var"),
    OBJECT_VAR("object_var"),
    CFG_VAR("cfg_var"),
    CODE_VAR("code_var"),
    JSON_VAR("json_var");

    private final String wireName;

    VarKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * JSON 上の表記から種別を解決する。未指定や未知の値は {@code fallback} を返す。
     */
    public static VarKind parse(String raw, VarKind fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VarKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return fallback;
    }
}
