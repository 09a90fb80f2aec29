package io.github.hide212131.b3tree.runtime.validate;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 式引数の変数抽出と構文チェック。
 * <p>
 * 変数抽出は字句レベルの近似で、{@code [A-Za-z0-9_.]} 以外で分割し、{@code .} より前を識別子として扱う。
 */
public final class ExpressionChecker {

    /** 変数名として使えない語。 */
    public static final Set<String> KEYWORDS = Set.of("true", "false", "null", "undefined", "NaN", "Infinity");

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_$][a-zA-Z_$0-9]*$");
    private static final Pattern SEPARATOR = Pattern.compile("[^a-zA-Z0-9_.]");

    private final Map<String, List<String>> parsed = new HashMap<>();

    public static boolean isValidVariableName(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
    }

    /** 式が参照する変数名を出現順に返す。結果は式文字列ごとに保持する。 */
    public List<String> identifiers(String expression) {
        return parsed.computeIfAbsent(expression, ExpressionChecker::extract);
    }

    private static List<String> extract(String expression) {
        List<String> result = new ArrayList<>();
        for (String token : SEPARATOR.split(expression, -1)) {
            int dot = token.indexOf('.');
            String head = dot >= 0 ? token.substring(0, dot) : token;
            if (isValidVariableName(head)) {
                result.add(head);
            }
        }
        return List.copyOf(result);
    }

    /**
     * 式として構文解析できるかを確かめる。評価はしない。
     * {@code ===} / {@code !==} と単一引用符の文字列は解析前に置き換える。
     */
    public boolean dryRun(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        try {
            StaticJavaParser.parseExpression(normalize(expression));
            return true;
        } catch (ParseProblemException ex) {
            return false;
        }
    }

    static String normalize(String expression) {
        String replaced = expression.replace("===", "==").replace("!==", "!=");
        StringBuilder sb = new StringBuilder(replaced.length());
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < replaced.length(); i++) {
            char c = replaced.charAt(i);
            if (c == '\\' && i + 1 < replaced.length()) {
                sb.append(c).append(replaced.charAt(++i));
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
                sb.append('"');
            } else if (c == '"' && inSingle) {
                sb.append("\\\"");
            } else {
                if (c == '"') {
                    inDouble = !inDouble;
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
