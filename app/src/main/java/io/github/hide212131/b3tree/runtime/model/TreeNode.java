package io.github.hide212131.b3tree.runtime.model;

import io.github.hide212131.b3tree.runtime.status.StatusFlags;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ツリー内のノード 1 件。解決・検証の各パスで直接書き換えられる。
 * <p>
 * {@code mtime} と {@code status} は解決時に付与される派生値で、ファイルには保存しない。
 */
@SuppressWarnings("PMD.TooManyFields")
public final class TreeNode {

    private String id;
    private String name;
    private String desc;
    private Map<String, Object> args;
    private List<String> input;
    private List<String> output;
    private List<TreeNode> children;
    private String path;
    private Boolean debug;
    private Boolean disabled;

    private Long mtime;
    private StatusFlags status = StatusFlags.EMPTY;

    public TreeNode() {
        this("", "");
    }

    public TreeNode(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDesc() {
        return desc;
    }

    public void setDesc(String desc) {
        this.desc = desc;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public void setArgs(Map<String, Object> args) {
        this.args = args;
    }

    /** 引数マップを返す。未設定なら空のマップを作成して保持する。 */
    public Map<String, Object> args() {
        if (args == null) {
            args = new LinkedHashMap<>();
        }
        return args;
    }

    public List<String> getInput() {
        return input;
    }

    public void setInput(List<String> input) {
        this.input = input;
    }

    public List<String> getOutput() {
        return output;
    }

    public void setOutput(List<String> output) {
        this.output = output;
    }

    public List<TreeNode> getChildren() {
        return children;
    }

    public void setChildren(List<TreeNode> children) {
        this.children = children;
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public TreeNode addChild(TreeNode child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
        return this;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    /** 外部ファイルのサブツリーを参照するノードかどうか。 */
    public boolean isSubtreeReference() {
        return path != null && !path.isBlank();
    }

    public Boolean getDebug() {
        return debug;
    }

    public void setDebug(Boolean debug) {
        this.debug = debug;
    }

    public Boolean getDisabled() {
        return disabled;
    }

    public void setDisabled(Boolean disabled) {
        this.disabled = disabled;
    }

    public boolean isDisabled() {
        return Boolean.TRUE.equals(disabled);
    }

    public Long getMtime() {
        return mtime;
    }

    public void setMtime(Long mtime) {
        this.mtime = mtime;
    }

    public StatusFlags getStatus() {
        return status;
    }

    public void setStatus(StatusFlags status) {
        this.status = status == null ? StatusFlags.EMPTY : status;
    }

    @Override
    public String toString() {
        return id + "|" + name;
    }
}
