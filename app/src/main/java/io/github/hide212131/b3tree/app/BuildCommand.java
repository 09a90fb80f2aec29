package io.github.hide212131.b3tree.app;

import io.github.hide212131.b3tree.infra.config.EnvironmentOverridesLoader;
import io.github.hide212131.b3tree.infra.config.EnvironmentOverridesLoader.EnvironmentOverrides;
import io.github.hide212131.b3tree.infra.logging.BuildLog;
import io.github.hide212131.b3tree.runtime.build.BuildOrchestrator;
import io.github.hide212131.b3tree.runtime.build.BuildOrchestrator.BuildRequest;
import io.github.hide212131.b3tree.runtime.build.BuildOrchestrator.BuildResult;
import io.github.hide212131.b3tree.runtime.build.BuildOrchestrator.FileOutcome;
import io.github.hide212131.b3tree.runtime.build.BuildReportWriter;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.io.WorkspaceDescriptor;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * ワークスペースのビルドコマンド (build).
 */
@Command(name = "build", description = "ワークスペース内のツリーを解決・検証し、出力ディレクトリへ書き出します。",
        mixinStandardHelpOptions = true)
@SuppressWarnings("checkstyle:LineLength")
public final class BuildCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    // CHECKSTYLE:OFF: LineLength
    @Option(names = "--project", required = true, paramLabel = "FILE", description = "ワークスペース記述子 (*.b3-workspace) のパス")
    private Path projectFile;

    @Option(names = "--output", required = true, paramLabel = "DIR", description = "ビルド結果の出力先ディレクトリ")
    private Path outputDir;

    @Option(names = "--check-expr", paramLabel = "BOOL", arity = "0..1", fallbackValue = "true", description = "式の構文チェックを行うか（未指定時は B3_CHECK_EXPR、ワークスペース設定の順に参照します。）")
    private Boolean checkExpr;

    @Option(names = "--log-file", paramLabel = "FILE", description = "ログの保存先ファイル（未指定時は B3_LOG_FILE、settings.logPath の順に参照します。）")
    private Path logFile;

    @Option(names = "--report", paramLabel = "FILE", description = "ビルドレポート (YAML) の出力先（任意）")
    private Path reportFile;
    // CHECKSTYLE:ON

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public BuildCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        BuildLog log = BuildLog.forClass(BuildCommand.class);
        EnvironmentOverrides overrides;
        WorkspaceDescriptor descriptor;
        try {
            overrides = new EnvironmentOverridesLoader().load();
            descriptor = WorkspaceDescriptor.read(projectFile);
        } catch (IllegalArgumentException | TreeFormatException ex) {
            log.error("config", null, null, "設定の読み込みに失敗しました", ex);
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
            BuildResult result = new BuildOrchestrator().run(
                    new BuildRequest(projectFile, outputDir, CommandSupport.resolveCheckExpr(checkExpr, overrides)));
            for (FileOutcome outcome : result.files()) {
                out.println(outcome.outcome().name().toLowerCase(Locale.ROOT) + ": " + outcome.path());
            }
            CommandSupport.printDiagnostics(out, result.diagnostics());
            if (reportFile != null) {
                new BuildReportWriter().write(result, reportFile);
            }
            out.println(result.hasErrors() ? "ビルドでエラーが見つかりました" : "ビルドが完了しました");
            out.flush();
            return result.hasErrors() ? B3TreeCliApp.EXIT_VALIDATION_ERROR : CommandLine.ExitCode.OK;
        } catch (TreeFormatException ex) {
            err.println(ex.getMessage());
            err.flush();
            return B3TreeCliApp.EXIT_CONFIGURATION_ERROR;
        } finally {
            BuildLog.detach(handler);
        }
    }
}
