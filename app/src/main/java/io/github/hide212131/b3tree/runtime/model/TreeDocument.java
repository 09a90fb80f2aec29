package io.github.hide212131.b3tree.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 1 ファイル分のビヘイビアツリー。 */
public final class TreeDocument {

    /** 本ツールが書き出すツリー形式のバージョン。 */
    public static final String FORMAT_VERSION = "1.8.5";

    private String version = FORMAT_VERSION;
    private String name = "";
    private String prefix = "";
    private String desc;
    private Boolean export;
    private List<String> group = new ArrayList<>();
    private List<String> imports = new ArrayList<>();
    private List<VariableDeclaration> vars = new ArrayList<>();
    private TreeNode root = new TreeNode();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String getDesc() {
        return desc;
    }

    public void setDesc(String desc) {
        this.desc = desc;
    }

    /** {@link #FORMAT_VERSION} より新しい形式で保存されたツリーかどうか。数値として読めない版は新しいとみなさない。 */
    public boolean isNewerFormat() {
        return compareVersions(version, FORMAT_VERSION) > 0;
    }

    static int compareVersions(String left, String right) {
        if (left == null || right == null) {
            return 0;
        }
        String[] a = left.trim().split("\\.");
        String[] b = right.trim().split("\\.");
        try {
            for (int i = 0; i < Math.max(a.length, b.length); i++) {
                int x = i < a.length ? Integer.parseInt(a[i]) : 0;
                int y = i < b.length ? Integer.parseInt(b[i]) : 0;
                if (x != y) {
                    return Integer.compare(x, y);
                }
            }
        } catch (NumberFormatException ex) {
            return 0;
        }
        return 0;
    }

    public Boolean getExport() {
        return export;
    }

    public void setExport(Boolean export) {
        this.export = export;
    }

    /** {@code export} が明示的に {@code false} の場合のみ書き出し対象外とする。 */
    public boolean isExportable() {
        return !Boolean.FALSE.equals(export);
    }

    public List<String> getGroup() {
        return group;
    }

    public void setGroup(List<String> group) {
        this.group = group == null ? new ArrayList<>() : new ArrayList<>(group);
    }

    public List<String> getImports() {
        return imports;
    }

    public void setImports(List<String> imports) {
        this.imports = imports == null ? new ArrayList<>() : new ArrayList<>(imports);
    }

    public List<VariableDeclaration> getVars() {
        return vars;
    }

    public void setVars(List<VariableDeclaration> vars) {
        this.vars = vars == null ? new ArrayList<>() : new ArrayList<>(vars);
    }

    public TreeNode getRoot() {
        return root;
    }

    public void setRoot(TreeNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }
}
