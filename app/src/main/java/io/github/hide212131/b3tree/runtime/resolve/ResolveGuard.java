package io.github.hide212131.b3tree.runtime.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 解決中のファイルパスの集合。循環参照の検出に使い、トップレベルの呼び出しごとに空にする。
 */
public final class ResolveGuard {

    private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

    /** パスを積む。既に解決中であれば何もせず {@code false} を返す。 */
    public boolean push(String path) {
        return inProgress.add(path);
    }

    public void pop(String path) {
        inProgress.remove(path);
    }

    public boolean contains(String path) {
        return inProgress.contains(path);
    }

    /** 最後に積まれたパス。空なら {@code null}。 */
    public String current() {
        String last = null;
        for (String path : inProgress) {
            last = path;
        }
        return last;
    }

    public List<String> snapshot() {
        return new ArrayList<>(inProgress);
    }

    public boolean isEmpty() {
        return inProgress.isEmpty();
    }

    public void clear() {
        inProgress.clear();
    }
}
