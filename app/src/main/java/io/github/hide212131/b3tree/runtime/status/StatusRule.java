package io.github.hide212131.b3tree.runtime.status;

import java.util.Optional;

/**
 * ノード定義の {@code status} 配列に書ける要素。
 * <p>
 * 素の {@code success}/{@code failure}/{@code running} はノード自身が返しうる状態、
 * 記号付きの要素は子の集約結果との合成規則を表す。
 */
public enum StatusRule {
    SUCCESS("success"),
    FAILURE("failure"),
    RUNNING("running"),
    NOT_SUCCESS("!success"),
    NOT_FAILURE("!failure"),
    ANY_SUCCESS("|success"),
    ANY_FAILURE("|failure"),
    ANY_RUNNING("|running"),
    ALL_SUCCESS("&success"),
    ALL_FAILURE("&failure");

    private final String token;

    StatusRule(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isOwnStatus() {
        return this == SUCCESS || this == FAILURE || this == RUNNING;
    }

    public static Optional<StatusRule> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (StatusRule rule : values()) {
            if (rule.token.equals(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
