package io.github.hide212131.b3tree.runtime.model;

import java.util.Locale;
import java.util.Objects;

/**
 * {@code int}, {@code float?}, {@code string[]}, {@code expr[]?} のような値型表記を分解したもの。
 */
public record ValueType(String raw, BaseType base, boolean array, boolean optional) {

    public static final ValueType STRING = parse("string");

    public ValueType {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(base, "base");
    }

    public static ValueType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ValueType("", BaseType.UNKNOWN, false, false);
        }
        String trimmed = raw.trim();
        return new ValueType(trimmed, BaseType.fromPrefix(trimmed), trimmed.contains("[]"), trimmed.contains("?"));
    }

    public boolean isExpression() {
        return base == BaseType.EXPR;
    }

    /** 値型の基底。{@code code} は {@code expr} の別名として扱う。 */
    public enum BaseType {
        BOOL,
        INT,
        FLOAT,
        STRING,
        JSON,
        EXPR,
        UNKNOWN;

        static BaseType fromPrefix(String raw) {
            String lower = raw.toLowerCase(Locale.ROOT);
            if (lower.startsWith("bool")) {
                return BOOL;
            }
            if (lower.startsWith("int")) {
                return INT;
            }
            if (lower.startsWith("float")) {
                return FLOAT;
            }
            if (lower.startsWith("string")) {
                return STRING;
            }
            if (lower.startsWith("json")) {
                return JSON;
            }
            if (lower.startsWith("expr") || lower.startsWith("code")) {
                return EXPR;
            }
            return UNKNOWN;
        }
    }
}
