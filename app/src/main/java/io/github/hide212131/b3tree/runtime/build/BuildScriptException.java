package io.github.hide212131.b3tree.runtime.build;

/** ビルドスクリプトを読み込めない場合に送出する。 */
public class BuildScriptException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BuildScriptException(String message) {
        super(message);
    }

    public BuildScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
