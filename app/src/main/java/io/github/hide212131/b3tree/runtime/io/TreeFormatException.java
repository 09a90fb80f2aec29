package io.github.hide212131.b3tree.runtime.io;

import java.nio.file.Path;

/** ツリー・ノード定義・ワークスペース記述子の JSON を解釈できない場合に送出する。 */
public class TreeFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path source;

    public TreeFormatException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public TreeFormatException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
