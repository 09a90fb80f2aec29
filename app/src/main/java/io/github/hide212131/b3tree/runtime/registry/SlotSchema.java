package io.github.hide212131.b3tree.runtime.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 入出力スロットの定義。{@code "target?"} は省略可、末尾要素の {@code "args..."} は可変長を表す。
 */
public record SlotSchema(String raw, String name, boolean optional, boolean variadic) {

    public SlotSchema {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(name, "name");
    }

    /** スロット定義の並びを解析する。可変長指定は最後の要素に付いた場合のみ有効。 */
    public static List<SlotSchema> parseAll(List<String> raws) {
        List<SlotSchema> slots = new ArrayList<>(raws.size());
        for (int i = 0; i < raws.size(); i++) {
            String raw = raws.get(i) == null ? "" : raws.get(i).trim();
            boolean last = i == raws.size() - 1;
            boolean variadic = last && raw.endsWith("...");
            String name = raw.replace("...", "").replace("?", "");
            slots.add(new SlotSchema(raw, name, raw.contains("?"), variadic));
        }
        return List.copyOf(slots);
    }
}
