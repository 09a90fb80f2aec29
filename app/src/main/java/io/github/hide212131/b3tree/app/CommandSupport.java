package io.github.hide212131.b3tree.app;

import io.github.hide212131.b3tree.infra.config.EnvironmentOverridesLoader.EnvironmentOverrides;
import io.github.hide212131.b3tree.infra.logging.BuildLog;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.io.WorkspaceDescriptor;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Handler;

/** build / check で共有する設定解決と出力。 */
final class CommandSupport {

    private CommandSupport() {
    }

    /** CLI 指定、環境変数、ワークスペース設定の順にログファイルを決める。相対の設定値はワークスペース基準。 */
    static Optional<Path> resolveLogFile(Path cliValue, EnvironmentOverrides overrides, WorkspaceDescriptor descriptor) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        if (overrides.logFile().isPresent()) {
            return overrides.logFile();
        }
        return descriptor.settings().logPathOption().map(descriptor.workdir()::resolve);
    }

    /** CLI 指定、環境変数の順に式チェックの上書き値を決める。どちらもなければワークスペース設定に従う。 */
    static Optional<Boolean> resolveCheckExpr(Boolean cliValue, EnvironmentOverrides overrides) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return overrides.checkExpr();
    }

    static Handler attachLogFile(Optional<Path> logFile) {
        if (logFile.isEmpty()) {
            return null;
        }
        try {
            return BuildLog.attachFile(logFile.get());
        } catch (IOException ex) {
            throw new IllegalStateException("ログファイルの初期化に失敗しました: " + logFile.get(), ex);
        }
    }

    static void printDiagnostics(PrintWriter out, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            out.println((diagnostic.isError() ? "error: " : "warning: ") + diagnostic);
        }
    }
}
