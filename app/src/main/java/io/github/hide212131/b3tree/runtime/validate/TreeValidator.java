package io.github.hide212131.b3tree.runtime.validate;

import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostics;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.registry.ArgumentSchema;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import io.github.hide212131.b3tree.runtime.registry.SlotSchema;
import io.github.hide212131.b3tree.runtime.resolve.VariableScope;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ノードを定義と変数スコープに照らして検証する。
 * <p>
 * 最初の誤りで止めず、見つかったものをすべて {@code check <id>|<name>: <message>} 形式で報告する。
 * 入出力リストの長さ合わせと引数マップの再構築のため、ノードを書き換える。
 */
public final class TreeValidator {

    private final NodeDefinitionRegistry registry;
    private final VariableScope scope;
    private final ExpressionChecker expressions;
    private final Diagnostics diagnostics;
    private final boolean checkExpr;

    public TreeValidator(NodeDefinitionRegistry registry, VariableScope scope, ExpressionChecker expressions,
            Diagnostics diagnostics, boolean checkExpr) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.expressions = Objects.requireNonNull(expressions, "expressions");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.checkExpr = checkExpr;
    }

    /**
     * ノードと子孫を検証する。
     *
     * @param file 診断に記録するファイル (ワークスペース相対)
     * @return 誤りがなければ {@code true}
     */
    public boolean validate(TreeNode node, String file) {
        if (node == null) {
            return false;
        }
        NodeTypeDefinition definition = registry.get(node.getName());
        Consumer<String> structure = sink(node, file, Diagnostic.Category.STRUCTURE);
        Consumer<String> reference = sink(node, file, Diagnostic.Category.REFERENCE);
        if (definition.isUnknown()) {
            reference.accept("undefined node: " + node.getName());
            return false;
        }

        boolean ok = true;
        if (!definition.group().isEmpty() && definition.group().stream().noneMatch(scope::isGroupEnabled)) {
            reference.accept("node group '" + String.join(",", definition.group()) + "' is not enabled");
            ok = false;
        }
        ok &= checkReferences(node.getInput(), "input", reference);
        ok &= checkReferences(node.getOutput(), "output", reference);
        ok &= checkExpressions(node, definition, reference);

        if (definition.hasFixedArity()) {
            int count = node.getChildren() == null ? 0 : node.getChildren().size();
            if (count != definition.children()) {
                structure.accept("expect " + definition.children() + " children, but got " + count);
                ok = false;
            }
        }

        SlotCheck input = normalizeSlots(node.getInput(), definition.input(), "input", structure);
        node.setInput(input.values());
        SlotCheck output = normalizeSlots(node.getOutput(), definition.output(), "output", structure);
        node.setOutput(output.values());
        ok &= input.ok() && output.ok();

        if (!definition.args().isEmpty()) {
            ok &= checkArguments(node, definition, structure);
        }

        if (node.getChildren() != null) {
            for (TreeNode child : node.getChildren()) {
                if (!validate(child, file)) {
                    ok = false;
                }
            }
        } else {
            node.setChildren(new ArrayList<>());
        }
        return ok;
    }

    /**
     * 入出力の必須指定・子の数・引数だけを確認する簡易検査。診断は出さず、子も辿らない。
     */
    public boolean quickCheck(TreeNode node) {
        NodeTypeDefinition definition = registry.get(node.getName());
        Consumer<String> silent = message -> { };
        for (int i = 0; i < definition.input().size(); i++) {
            if (!isSatisfied(definition.input(), node.getInput(), i)) {
                return false;
            }
        }
        for (int i = 0; i < definition.output().size(); i++) {
            if (!isSatisfied(definition.output(), node.getOutput(), i)) {
                return false;
            }
        }
        if (definition.hasFixedArity()
                && (node.getChildren() == null ? 0 : node.getChildren().size()) != definition.children()) {
            return false;
        }
        for (ArgumentSchema arg : definition.args()) {
            if (!ArgumentChecker.checkArgument(node, definition, arg, silent)) {
                return false;
            }
        }
        return true;
    }

    private Consumer<String> sink(TreeNode node, String file, Diagnostic.Category category) {
        return message -> diagnostics.error(category, file, "check " + node + ": " + message);
    }

    private boolean checkReferences(List<String> names, String kind, Consumer<String> errors) {
        if (names == null) {
            return true;
        }
        boolean ok = true;
        for (String name : names) {
            if (name != null && !name.isEmpty() && !scope.isDefined(name)) {
                errors.accept(kind + " variable '" + name + "' is not defined");
                ok = false;
            }
        }
        return ok;
    }

    private boolean checkExpressions(TreeNode node, NodeTypeDefinition definition, Consumer<String> errors) {
        if (node.getArgs() == null) {
            return true;
        }
        boolean ok = true;
        for (ArgumentSchema arg : definition.args()) {
            if (!arg.valueType().isExpression()) {
                continue;
            }
            List<String> texts = expressionTexts(node.getArgs().get(arg.name()));
            for (String text : texts) {
                for (String name : expressions.identifiers(text)) {
                    if (!scope.isDefined(name)) {
                        errors.accept("expr variable '" + arg.name() + "' is not defined");
                        ok = false;
                    }
                }
            }
            if (checkExpr) {
                for (String text : texts) {
                    if (!expressions.dryRun(text)) {
                        errors.accept("expr '" + text + "' is not valid");
                        ok = false;
                    }
                }
            }
        }
        return ok;
    }

    private static List<String> expressionTexts(Object value) {
        List<String> texts = new ArrayList<>();
        if (value instanceof String text && !text.isEmpty()) {
            texts.add(text);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof String text) {
                    texts.add(text);
                }
            }
        }
        return texts;
    }

    /**
     * 定義の長さまで {@code ""} で埋め、可変長でなければ定義の長さに切り詰める。
     */
    private static SlotCheck normalizeSlots(List<String> values, List<SlotSchema> slots, String kind,
            Consumer<String> errors) {
        List<String> result = values == null ? null : new ArrayList<>(values);
        boolean ok = true;
        boolean variadic = false;
        for (int i = 0; i < slots.size(); i++) {
            if (result == null) {
                result = new ArrayList<>();
            }
            while (result.size() <= i) {
                result.add("");
            }
            if (result.get(i) == null) {
                result.set(i, "");
            }
            String value = result.get(i);
            if (!value.isEmpty() && !ExpressionChecker.isValidVariableName(value)) {
                errors.accept(kind + " field '" + value + "' is not a valid variable name,"
                        + "should start with a letter or underscore");
                ok = false;
            }
            if (!isSatisfied(slots, result, i)) {
                errors.accept(kind + " field '" + slots.get(i).raw() + "' is required");
                ok = false;
            }
            if (i == slots.size() - 1 && slots.get(i).variadic()) {
                variadic = true;
            }
        }
        if (result != null && !variadic) {
            result = new ArrayList<>(result.subList(0, Math.min(result.size(), slots.size())));
        }
        return new SlotCheck(result, ok);
    }

    private static boolean isSatisfied(List<SlotSchema> slots, List<String> values, int index) {
        SlotSchema slot = slots.get(index);
        boolean present = values != null && index < values.size() && values.get(index) != null
                && !values.get(index).isEmpty();
        return slot.optional() || slot.variadic() || present;
    }

    /** 既定値を補ったうえで引数を検査し、定義にあって値を持つ引数だけのマップに作り直す。 */
    private static boolean checkArguments(TreeNode node, NodeTypeDefinition definition, Consumer<String> errors) {
        boolean ok = true;
        Map<String, Object> rebuilt = new LinkedHashMap<>();
        for (ArgumentSchema arg : definition.args()) {
            Map<String, Object> args = node.getArgs();
            if (args != null && !args.containsKey(arg.name()) && arg.hasDefault()) {
                args.put(arg.name(), arg.defaultValue());
            }
            Object value = args == null ? null : args.get(arg.name());
            if (value != null) {
                rebuilt.put(arg.name(), value);
            }
            if (!ArgumentChecker.checkArgument(node, definition, arg, errors)) {
                ok = false;
            }
        }
        node.setArgs(rebuilt);
        return ok;
    }

    private record SlotCheck(List<String> values, boolean ok) {
    }
}
