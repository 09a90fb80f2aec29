package io.github.hide212131.b3tree.runtime.build;

import io.github.hide212131.b3tree.infra.logging.BuildLog;
import io.github.hide212131.b3tree.runtime.TreeWorkspace;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostics;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.io.TreeWriter;
import io.github.hide212131.b3tree.runtime.io.WorkspaceDescriptor;
import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ワークスペース内の全ツリーを解決・変換・検証し、出力ディレクトリへ書き出す。
 * <p>
 * ファイル単位で失敗を閉じ込め、1 ファイルの誤りで全体を止めない。読めないツリーは報告して読み飛ばすが、
 * 全体の成否には数えない。
 */
@SuppressWarnings("PMD.GuardLogStatement")
public final class BuildOrchestrator {

    private static final BuildLog LOG = BuildLog.forClass(BuildOrchestrator.class);
    private static final String PHASE = "build";

    private final BuildScriptLoader scriptLoader;

    public BuildOrchestrator() {
        this(new BuildScriptLoader());
    }

    public BuildOrchestrator(BuildScriptLoader scriptLoader) {
        this.scriptLoader = Objects.requireNonNull(scriptLoader, "scriptLoader");
    }

    /**
     * @return 誤りがあった場合 {@code true}
     */
    public boolean build(Path projectFile, Path outputDir) {
        return run(new BuildRequest(projectFile, outputDir, Optional.empty())).hasErrors();
    }

    /**
     * ビルドを実行する。ワークスペース記述子を読めない場合は {@link TreeFormatException} を送出する。
     */
    public BuildResult run(BuildRequest request) {
        WorkspaceDescriptor descriptor = WorkspaceDescriptor.read(request.projectFile());
        Path workdir = descriptor.workdir();
        Path outputDir = request.outputDir().toAbsolutePath().normalize();
        Diagnostics diagnostics = new Diagnostics();
        TreeWorkspace workspace = TreeWorkspace.open(workdir, diagnostics);
        workspace.setCheckExpr(request.checkExpr().orElse(descriptor.settings().checkExpr()));

        boolean hasErrors = false;
        BuildScriptLoader.Loaded loaded = null;
        Optional<String> scriptReference = descriptor.settings().buildScriptOption();
        if (scriptReference.isPresent()) {
            try {
                loaded = scriptLoader.load(scriptReference.get(), workdir);
                LOG.info(PHASE, null, null, "ビルドスクリプトを読み込みました: " + scriptReference.get());
            } catch (BuildScriptException ex) {
                diagnostics.error(Diagnostic.Category.CONFIGURATION, null,
                        "'" + scriptReference.get() + "' is not a valid build script: " + ex.getMessage());
                hasErrors = true;
            }
        }
        BuildScript script = loaded == null ? new BuildScript() { } : loaded.script();

        List<FileOutcome> outcomes = new ArrayList<>();
        try {
            try {
                script.onSetup(new BuildEnvironment(workdir, outputDir, workspace.registry()));
            } catch (RuntimeException ex) {
                diagnostics.error(Diagnostic.Category.CONFIGURATION, null, "build script setup failed: " + ex);
                hasErrors = true;
            }
            workspace.beginPass();
            for (Path file : workspace.treeFiles(outputDir)) {
                FileOutcome outcome = buildFile(workspace, script, file, outputDir);
                outcomes.add(outcome);
                if (outcome.outcome().isError()) {
                    hasErrors = true;
                }
            }
            BuildStatus status = hasErrors ? BuildStatus.FAILURE : BuildStatus.SUCCESS;
            try {
                script.onComplete(status);
            } catch (RuntimeException ex) {
                diagnostics.error(Diagnostic.Category.CONFIGURATION, null, "build script completion failed: " + ex);
                hasErrors = true;
            }
            LOG.info(PHASE, null, null, "ビルドが終了しました: " + status.label());
        } finally {
            close(loaded, diagnostics);
        }
        return new BuildResult(outcomes, diagnostics.all(), hasErrors);
    }

    private FileOutcome buildFile(TreeWorkspace workspace, BuildScript script, Path file, Path outputDir) {
        Diagnostics diagnostics = workspace.diagnostics();
        String path = workspace.relativize(file);
        int mark = diagnostics.size();
        TreeDocument tree;
        try {
            tree = workspace.createBuildData(path);
        } catch (TreeFormatException ex) {
            diagnostics.error(Diagnostic.Category.IO, path, "failed to read tree: " + path);
            return new FileOutcome(path, Outcome.UNREADABLE, null, 1);
        }

        List<String> errors = new ArrayList<>();
        Optional<TreeDocument> processed = processBatch(tree, file, script, errors);
        if (processed.isEmpty()) {
            errors.forEach(message -> diagnostics.error(Diagnostic.Category.CONFIGURATION, path, message));
            LOG.info(PHASE, path, null, "build script removed tree");
            return new FileOutcome(path, errors.isEmpty() ? Outcome.REMOVED : Outcome.FAILED, null, errors.size());
        }
        tree = processed.get();
        Path output = outputDir.resolve(path);
        if (!tree.isExportable()) {
            LOG.info(PHASE, path, null, "skip: " + output);
            return new FileOutcome(path, Outcome.SKIPPED, null, 0);
        }
        LOG.info(PHASE, path, null, "build: " + output);
        errors.forEach(message -> diagnostics.error(Diagnostic.Category.CONFIGURATION, path, message));

        workspace.refreshVariables(tree);
        boolean valid = workspace.validate(tree.getRoot(), path);

        try {
            script.onWriteFile(output, tree);
        } catch (RuntimeException ex) {
            diagnostics.error(Diagnostic.Category.CONFIGURATION, path, "build script failed on write: " + ex);
        }
        try {
            TreeWriter.write(output, tree);
        } catch (IOException ex) {
            diagnostics.error(Diagnostic.Category.IO, path, "failed to write: " + output + " (" + ex.getMessage() + ")");
        }

        int errorCount = (int) diagnostics.since(mark).stream().filter(Diagnostic::isError).count();
        boolean failed = !valid || errorCount > 0;
        return new FileOutcome(path, failed ? Outcome.FAILED : Outcome.WRITTEN, output, errorCount);
    }

    /**
     * フックを適用する。{@code onProcessTree} のあと、{@code onProcessNode} を子から順に呼ぶ。
     * フックが例外を送出した場合は {@code errors} に記録し、そこまでの結果で続ける。
     */
    static Optional<TreeDocument> processBatch(TreeDocument tree, Path path, BuildScript script, List<String> errors) {
        Optional<TreeDocument> processed;
        try {
            processed = script.onProcessTree(tree, path, errors);
        } catch (RuntimeException ex) {
            errors.add("build script failed on tree " + path.getFileName() + ": " + ex);
            return Optional.of(tree);
        }
        if (processed == null || processed.isEmpty()) {
            return Optional.empty();
        }
        TreeDocument result = processed.get();
        result.setRoot(processNode(result.getRoot(), script, errors).orElseGet(TreeNode::new));
        return Optional.of(result);
    }

    private static Optional<TreeNode> processNode(TreeNode node, BuildScript script, List<String> errors) {
        if (node.getChildren() != null) {
            List<TreeNode> children = new ArrayList<>();
            for (TreeNode child : node.getChildren()) {
                processNode(child, script, errors).ifPresent(children::add);
            }
            node.setChildren(children);
        }
        try {
            Optional<TreeNode> result = script.onProcessNode(node, errors);
            return result == null ? Optional.empty() : result;
        } catch (RuntimeException ex) {
            errors.add("build script failed on node " + node + ": " + ex);
            return Optional.of(node);
        }
    }

    private static void close(BuildScriptLoader.Loaded loaded, Diagnostics diagnostics) {
        if (loaded == null) {
            return;
        }
        try {
            loaded.close();
        } catch (IOException ex) {
            diagnostics.warn(Diagnostic.Category.CONFIGURATION, null, "failed to close build script: " + ex);
        }
    }

    /**
     * @param checkExpr 指定した場合はワークスペース設定の {@code checkExpr} を上書きする
     */
    public record BuildRequest(Path projectFile, Path outputDir, Optional<Boolean> checkExpr) {

        public BuildRequest {
            Objects.requireNonNull(projectFile, "projectFile");
            Objects.requireNonNull(outputDir, "outputDir");
            checkExpr = checkExpr == null ? Optional.empty() : checkExpr;
        }
    }

    public enum Outcome {
        WRITTEN,
        FAILED,
        SKIPPED,
        REMOVED,
        UNREADABLE;

        /** ビルド全体を失敗にする結果かどうか。 */
        public boolean isError() {
            return this == FAILED || this == UNREADABLE;
        }
    }

    /** ファイル 1 件の結果。{@code output} は書き出した場合のみ。 */
    public record FileOutcome(String path, Outcome outcome, Path output, int errors) {
    }

    public record BuildResult(List<FileOutcome> files, List<Diagnostic> diagnostics, boolean hasErrors) {

        public BuildResult {
            files = List.copyOf(files);
            diagnostics = List.copyOf(diagnostics);
        }

        public Optional<FileOutcome> file(String path) {
            return files.stream().filter(outcome -> outcome.path().equals(path)).findFirst();
        }
    }
}
