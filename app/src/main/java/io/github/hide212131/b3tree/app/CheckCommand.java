package io.github.hide212131.b3tree.app;

import io.github.hide212131.b3tree.infra.config.EnvironmentOverridesLoader;
import io.github.hide212131.b3tree.infra.config.EnvironmentOverridesLoader.EnvironmentOverrides;
import io.github.hide212131.b3tree.infra.logging.BuildLog;
import io.github.hide212131.b3tree.runtime.TreeWorkspace;
import io.github.hide212131.b3tree.runtime.TreeWorkspace.CheckResult;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.io.WorkspaceDescriptor;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * ツリーの検証コマンド (check). ファイルは書き出さない。
 */
@Command(name = "check", description = "ツリーを解決して検証し、見つかった問題を表示します。", mixinStandardHelpOptions = true)
public final class CheckCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--project", required = true, paramLabel = "FILE", description = "ワークスペース記述子 (*.b3-workspace) のパス")
    private Path projectFile;

    @Option(names = "--check-expr", paramLabel = "BOOL", arity = "0..1", fallbackValue = "true",
            description = "式の構文チェックを行うか（未指定時は B3_CHECK_EXPR、ワークスペース設定の順に参照します。）")
    private Boolean checkExpr;

    @Option(names = "--log-file", paramLabel = "FILE", description = "ログの保存先ファイル（任意）")
    private Path logFile;

    @Parameters(paramLabel = "TREE", arity = "0..*", description = "検証するツリー (ワークスペース相対)。省略時はすべて")
    private List<String> trees = new ArrayList<>();

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public CheckCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        EnvironmentOverrides overrides;
        WorkspaceDescriptor descriptor;
        try {
            overrides = new EnvironmentOverridesLoader().load();
            descriptor = WorkspaceDescriptor.read(projectFile);
        } catch (IllegalArgumentException | TreeFormatException ex) {
            err.println(ex.getMessage());
            err.flush();
            return B3TreeCliApp.EXIT_CONFIGURATION_ERROR;
        }
        Handler handler;
        try {
            handler = CommandSupport.attachLogFile(CommandSupport.resolveLogFile(logFile, overrides, descriptor));
        } catch (IllegalStateException ex) {
            err.println(ex.getMessage());
            err.flush();
            return B3TreeCliApp.EXIT_CONFIGURATION_ERROR;
        }
        try {
            TreeWorkspace workspace = TreeWorkspace.open(descriptor.workdir());
            workspace.setCheckExpr(CommandSupport.resolveCheckExpr(checkExpr, overrides)
                    .orElse(descriptor.settings().checkExpr()));
            List<String> targets = new ArrayList<>(trees);
            if (targets.isEmpty()) {
                workspace.treeFiles(null).forEach(file -> targets.add(workspace.relativize(file)));
            }
            boolean ok = true;
            for (String target : targets) {
                ok &= checkOne(workspace, target, out);
            }
            out.println(ok ? "問題は見つかりませんでした" : "問題が見つかりました");
            out.flush();
            return ok ? CommandLine.ExitCode.OK : B3TreeCliApp.EXIT_VALIDATION_ERROR;
        } finally {
            BuildLog.detach(handler);
        }
    }

    private static boolean checkOne(TreeWorkspace workspace, String target, PrintWriter out) {
        try {
            CheckResult result = workspace.check(target);
            out.println((result.ok() ? "ok: " : "ng: ") + target);
            CommandSupport.printDiagnostics(out, result.diagnostics());
            return result.ok();
        } catch (TreeFormatException ex) {
            out.println("ng: " + target);
            CommandSupport.printDiagnostics(out,
                    List.of(Diagnostic.error(Diagnostic.Category.IO, target, "failed to read tree: " + target)));
            return false;
        }
    }
}
