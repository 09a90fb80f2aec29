package io.github.hide212131.b3tree.runtime.registry;

import java.util.Locale;

/** ノード定義の分類。 */
public enum NodeCategory {
    ACTION("Action"),
    COMPOSITE("Composite"),
    DECORATOR("Decorator"),
    CONDITION("Condition"),
    OTHER("Other");

    private final String label;

    NodeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 大文字小文字を区別せず前方一致で分類する。{@code "ActionXXX"} は {@link #ACTION}、該当なしは {@link #OTHER}。
     */
    public static NodeCategory parse(String raw) {
        if (raw == null) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("action")) {
            return ACTION;
        }
        if (normalized.startsWith("composite")) {
            return COMPOSITE;
        }
        if (normalized.startsWith("decorator")) {
            return DECORATOR;
        }
        if (normalized.startsWith("condition")) {
            return CONDITION;
        }
        return OTHER;
    }
}
