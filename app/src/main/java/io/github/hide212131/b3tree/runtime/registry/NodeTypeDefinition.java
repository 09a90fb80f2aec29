package io.github.hide212131.b3tree.runtime.registry;

import io.github.hide212131.b3tree.runtime.status.StatusRule;
import java.util.List;
import java.util.Objects;

/**
 * ノード種別の定義。読み込み後は不変。
 *
 * @param children 許容する子ノード数。{@link #UNBOUNDED} は無制限
 * @param statusDeclared 定義に空でない status 宣言があったか。未知の項目だけで {@code status} が空でも真になる
 */
public record NodeTypeDefinition(
        String name,
        NodeCategory category,
        String desc,
        int children,
        List<ArgumentSchema> args,
        List<SlotSchema> input,
        List<SlotSchema> output,
        List<StatusRule> status,
        List<String> group,
        boolean statusDeclared) {

    public static final int UNBOUNDED = -1;

    /** 未登録の名前に対して返す番兵定義。 */
    public static final NodeTypeDefinition UNKNOWN = new NodeTypeDefinition("unknown", NodeCategory.ACTION, "", 0,
            List.of(), List.of(), List.of(), List.of(), List.of());

    public NodeTypeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        desc = desc == null ? "" : desc;
        args = args == null ? List.of() : List.copyOf(args);
        input = input == null ? List.of() : List.copyOf(input);
        output = output == null ? List.of() : List.copyOf(output);
        status = status == null ? List.of() : List.copyOf(status);
        group = group == null ? List.of() : List.copyOf(group);
    }

    public NodeTypeDefinition(String name, NodeCategory category, String desc, int children,
            List<ArgumentSchema> args, List<SlotSchema> input, List<SlotSchema> output, List<StatusRule> status,
            List<String> group) {
        this(name, category, desc, children, args, input, output, status, group, status != null && !status.isEmpty());
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    public boolean hasFixedArity() {
        return children != UNBOUNDED;
    }

    public boolean hasStatusRules() {
        return statusDeclared;
    }
}
