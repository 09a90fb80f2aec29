package io.github.hide212131.b3tree.runtime.status;

/**
 * 到達可能な終了状態と、子の集約時に使う補助ビット。
 * <p>
 * ビット位置はエディタが保持してきた数値表現と一致させている。
 */
public enum StatusBit {
    RUNNING(0),
    FAILURE(1),
    SUCCESS(2),
    FAILURE_NEVER_SEEN(4),
    SUCCESS_NEVER_SEEN(5);

    private final int position;

    StatusBit(int position) {
        this.position = position;
    }

    int mask() {
        return 1 << position;
    }
}
