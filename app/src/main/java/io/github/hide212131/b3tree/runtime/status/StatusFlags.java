package io.github.hide212131.b3tree.runtime.status;

import java.util.EnumSet;
import java.util.Set;

/** ノードごとの到達可能状態を表す不変のビット集合。 */
public final class StatusFlags {

    public static final StatusFlags EMPTY = new StatusFlags(0);

    private final int bits;

    private StatusFlags(int bits) {
        this.bits = bits;
    }

    public static StatusFlags of(StatusBit... flags) {
        int bits = 0;
        for (StatusBit flag : flags) {
            bits |= flag.mask();
        }
        return new StatusFlags(bits);
    }

    public static StatusFlags fromInt(int bits) {
        return bits == 0 ? EMPTY : new StatusFlags(bits);
    }

    public int toInt() {
        return bits;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public boolean has(StatusBit flag) {
        return (bits & flag.mask()) != 0;
    }

    public boolean hasSuccess() {
        return has(StatusBit.SUCCESS);
    }

    public boolean hasFailure() {
        return has(StatusBit.FAILURE);
    }

    public boolean hasRunning() {
        return has(StatusBit.RUNNING);
    }

    public boolean successNeverSeen() {
        return has(StatusBit.SUCCESS_NEVER_SEEN);
    }

    public boolean failureNeverSeen() {
        return has(StatusBit.FAILURE_NEVER_SEEN);
    }

    public StatusFlags with(StatusBit flag) {
        return new StatusFlags(bits | flag.mask());
    }

    public StatusFlags without(StatusBit flag) {
        return fromInt(bits & ~flag.mask());
    }

    /** {@code condition} が真のときだけ {@code flag} を立てる。 */
    public StatusFlags withIf(StatusBit flag, boolean condition) {
        return condition ? with(flag) : this;
    }

    public StatusFlags markSuccessNeverSeen() {
        return with(StatusBit.SUCCESS_NEVER_SEEN);
    }

    public StatusFlags markFailureNeverSeen() {
        return with(StatusBit.FAILURE_NEVER_SEEN);
    }

    public StatusFlags union(StatusFlags other) {
        return fromInt(bits | other.bits);
    }

    /** 終了状態 (success / failure / running) のみを列挙する。 */
    public Set<StatusBit> outcomes() {
        Set<StatusBit> result = EnumSet.noneOf(StatusBit.class);
        for (StatusBit flag : new StatusBit[] { StatusBit.SUCCESS, StatusBit.FAILURE, StatusBit.RUNNING }) {
            if (has(flag)) {
                result.add(flag);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StatusFlags flags && flags.bits == bits;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    @Override
    public String toString() {
        EnumSet<StatusBit> set = EnumSet.noneOf(StatusBit.class);
        for (StatusBit flag : StatusBit.values()) {
            if (has(flag)) {
                set.add(flag);
            }
        }
        return "StatusFlags" + set;
    }
}
