package io.github.hide212131.b3tree.runtime.build;

/** ビルド全体の結果。{@link BuildScript#onComplete(BuildStatus)} に渡す。 */
public enum BuildStatus {
    SUCCESS("success"),
    FAILURE("failure");

    private final String label;

    BuildStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
