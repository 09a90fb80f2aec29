package io.github.hide212131.b3tree.runtime.validate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hide212131.b3tree.runtime.io.JsonSupport;
import io.github.hide212131.b3tree.runtime.model.OptionDecl;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.model.ValueType;
import io.github.hide212131.b3tree.runtime.registry.ArgumentSchema;
import io.github.hide212131.b3tree.runtime.registry.NodeTypeDefinition;
import io.github.hide212131.b3tree.runtime.registry.SlotSchema;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/** 引数値を定義の値型・選択肢・排他指定に照らして検査する。 */
final class ArgumentChecker {

    private ArgumentChecker() {
    }

    /** 引数 1 件を検査する。配列型は要素ごとに検査する。 */
    static boolean checkArgument(TreeNode node, NodeTypeDefinition definition, ArgumentSchema arg,
            Consumer<String> errors) {
        boolean ok = true;
        Object value = node.getArgs() == null ? null : node.getArgs().get(arg.name());
        ValueType type = arg.valueType();
        if (type.array()) {
            if (!(value instanceof List<?> list) || list.isEmpty()) {
                if (!type.optional()) {
                    errors.accept("'" + arg.name() + "=" + json(value) + "' is not an array or empty array");
                    ok = false;
                }
            } else {
                for (Object element : list) {
                    if (!checkValue(arg, element, errors)) {
                        ok = false;
                    }
                }
            }
        } else if (!checkValue(arg, value, errors)) {
            ok = false;
        }
        if (arg.oneof() != null && !checkOneof(node, definition, arg, value, errors)) {
            ok = false;
        }
        return ok;
    }

    @SuppressWarnings("PMD.CognitiveComplexity")
    static boolean checkValue(ArgumentSchema arg, Object value, Consumer<String> errors) {
        ValueType type = arg.valueType();
        boolean optional = type.optional();
        String shown = "'" + arg.name() + "=" + json(value) + "'";
        boolean ok = switch (type.base()) {
            case FLOAT -> report(value instanceof Number || value == null && optional, errors,
                    shown + " is not a number");
            case INT -> report(isInteger(value) || value == null && optional, errors, shown + " is not a int");
            case STRING -> report(isNonEmptyString(value) || isBlankValue(value) && optional, errors,
                    shown + " is not a string");
            case EXPR -> report(isNonEmptyString(value) || isBlankValue(value) && optional, errors,
                    shown + " is not an expr string");
            case JSON -> report(!isBlankValue(value) || optional, errors, shown + " is not an invalid object");
            case BOOL -> report(value instanceof Boolean || value == null, errors, shown + " is not a boolean");
            case UNKNOWN -> report(false, errors, "unknown arg type '" + type.raw() + "'");
        };
        if (arg.hasOptions()) {
            boolean found = arg.options().stream().anyMatch(option -> sameValue(option, value));
            if (!report(found || value == null && optional, errors,
                    shown + " is not a one of the option values")) {
                ok = false;
            }
        }
        return ok;
    }

    /** 引数と、{@code oneof} が指す入力スロットのどちらか一方だけが設定されていること。 */
    private static boolean checkOneof(TreeNode node, NodeTypeDefinition definition, ArgumentSchema arg, Object value,
            Consumer<String> errors) {
        int index = -1;
        List<SlotSchema> slots = definition.input();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).raw().startsWith(arg.oneof())) {
                index = i;
                break;
            }
        }
        List<String> input = node.getInput();
        String inputValue = index >= 0 && input != null && index < input.size() && input.get(index) != null
                ? input.get(index)
                : "";
        Object argValue = value;
        if (arg.valueType().array() && argValue instanceof List<?> list && list.isEmpty()) {
            argValue = null;
        }
        boolean argSet = argValue != null && !"".equals(argValue);
        boolean inputSet = !inputValue.isEmpty();
        return report(argSet != inputSet, errors,
                "only one is allowed for between argument '" + arg.name() + "' and input '" + inputValue + "'");
    }

    private static boolean report(boolean ok, Consumer<String> errors, String message) {
        if (!ok) {
            errors.accept(message);
        }
        return ok;
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.floor(d);
        }
        return false;
    }

    private static boolean isNonEmptyString(Object value) {
        return value instanceof String text && !text.isEmpty();
    }

    private static boolean isBlankValue(Object value) {
        return value == null || "".equals(value);
    }

    private static boolean sameValue(OptionDecl option, Object value) {
        Object expected = option.value();
        if (expected instanceof Number a && value instanceof Number b) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        return Objects.equals(expected, value);
    }

    static String json(Object value) {
        try {
            return JsonSupport.mapper().writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }
}
