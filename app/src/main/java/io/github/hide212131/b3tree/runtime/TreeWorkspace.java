package io.github.hide212131.b3tree.runtime;

import io.github.hide212131.b3tree.infra.logging.BuildLog;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostics;
import io.github.hide212131.b3tree.runtime.io.FileDataConverter;
import io.github.hide212131.b3tree.runtime.io.TreeReader;
import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.model.TreeNodes;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionLoader;
import io.github.hide212131.b3tree.runtime.registry.NodeDefinitionRegistry;
import io.github.hide212131.b3tree.runtime.resolve.FileTimestamps;
import io.github.hide212131.b3tree.runtime.resolve.FileVariables;
import io.github.hide212131.b3tree.runtime.resolve.ResolveGuard;
import io.github.hide212131.b3tree.runtime.resolve.SubtreeResolver;
import io.github.hide212131.b3tree.runtime.resolve.VariableResolver;
import io.github.hide212131.b3tree.runtime.resolve.VariableScope;
import io.github.hide212131.b3tree.runtime.validate.ExpressionChecker;
import io.github.hide212131.b3tree.runtime.validate.TreeValidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 1 プロジェクト分の解決・検証コンテキスト。
 * <p>
 * ノード定義、ファイル更新時刻、解決中パス、変数キャッシュ、現在の変数スコープを保持する。
 * 単一スレッドでの利用を前提とし、同じインスタンスへの呼び出しは呼び出し側で直列化する。
 */
public final class TreeWorkspace {

    private static final BuildLog LOG = BuildLog.forClass(TreeWorkspace.class);

    private final Path workdir;
    private final NodeDefinitionRegistry registry;
    private final List<String> definitionWarnings;
    private final Diagnostics diagnostics;
    private final FileTimestamps timestamps;
    private final ResolveGuard guard = new ResolveGuard();
    private final SubtreeResolver subtrees;
    private final VariableResolver variables;
    private final VariableScope scope = new VariableScope();
    private final ExpressionChecker expressions = new ExpressionChecker();
    private final FileDataConverter fileData;
    private boolean checkExpr;

    public TreeWorkspace(Path workdir, NodeDefinitionRegistry registry, List<String> definitionWarnings,
            Diagnostics diagnostics) {
        this.workdir = Objects.requireNonNull(workdir, "workdir").toAbsolutePath().normalize();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.definitionWarnings = List.copyOf(definitionWarnings);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.timestamps = new FileTimestamps(this.workdir);
        this.subtrees = new SubtreeResolver(registry, timestamps, guard, diagnostics);
        this.variables = new VariableResolver(timestamps, guard, diagnostics);
        this.fileData = new FileDataConverter(registry);
    }

    /** ワークスペース直下のノード定義を読み込んで開く。定義の警告はログに出す。 */
    public static TreeWorkspace open(Path workdir) {
        return open(workdir, new Diagnostics());
    }

    public static TreeWorkspace open(Path workdir, Diagnostics diagnostics) {
        NodeDefinitionLoader.LoadResult loaded = new NodeDefinitionLoader().load(workdir);
        for (String warning : loaded.warnings()) {
            LOG.warn("setup", null, null, warning, null);
        }
        LOG.info("setup", null, null, "ノード定義を読み込みました: " + loaded.registry().size() + " 件");
        return new TreeWorkspace(workdir, loaded.registry(), loaded.warnings(), diagnostics);
    }

    /** トップレベル呼び出しの開始時に、解決中パスを空にし更新時刻を読み直す。 */
    public void beginPass() {
        guard.clear();
        timestamps.refresh();
    }

    public TreeDocument read(String treeFile) {
        TreeDocument tree = TreeReader.read(timestamps.resolve(treeFile));
        if (tree.isNewerFormat()) {
            diagnostics.warn(Diagnostic.Category.STRUCTURE, treeFile,
                    "tree version " + tree.getVersion() + " is newer than supported " + TreeDocument.FORMAT_VERSION);
        }
        return tree;
    }

    /** ツリーを読み込み、サブツリー展開と ID 採番、状態計算を行う。 */
    public TreeDocument resolve(String treeFile) {
        beginPass();
        TreeDocument tree = read(treeFile);
        resolveRoot(tree.getRoot(), treeFile);
        return tree;
    }

    /** 読み込み済みのルートを解決する。{@code ownPath} 自身への参照は循環として扱う。 */
    public int resolveRoot(TreeNode root, String ownPath) {
        return subtrees.resolveTree(root, ownPath);
    }

    /**
     * ビルド用のツリーを作る。解決後に ID へ接頭辞を付け、名前をファイル名に揃え、保存形式に変換する。
     */
    public TreeDocument createBuildData(String treeFile) {
        TreeDocument tree = read(treeFile);
        resolveRoot(tree.getRoot(), treeFile);
        String prefix = tree.getPrefix();
        TreeNodes.dfs(tree.getRoot(), node -> {
            node.setId(prefix + node.getId());
            return true;
        });
        tree.setName(baseName(treeFile));
        tree.setRoot(fileData.toFileData(tree.getRoot(), true));
        return tree;
    }

    /** 変数宣言を集め、スコープを更新する。 */
    public FileVariables refreshVariables(TreeDocument tree) {
        FileVariables resolved = variables.resolve(tree, tree.getRoot());
        scope.update(tree.getGroup(), resolved.merged());
        return resolved;
    }

    public boolean validate(TreeNode root, String file) {
        return new TreeValidator(registry, scope, expressions, diagnostics, checkExpr).validate(root, file);
    }

    public boolean quickCheck(TreeNode node) {
        return new TreeValidator(registry, scope, expressions, diagnostics, checkExpr).quickCheck(node);
    }

    /** 解決・変数更新・検証をまとめて行う。 */
    public CheckResult check(String treeFile) {
        int mark = diagnostics.size();
        TreeDocument tree = resolve(treeFile);
        FileVariables vars = refreshVariables(tree);
        boolean ok = validate(tree.getRoot(), treeFile);
        List<Diagnostic> found = diagnostics.since(mark);
        ok &= found.stream().noneMatch(Diagnostic::isError);
        return new CheckResult(treeFile, tree, vars, ok, found);
    }

    /**
     * ワークスペース配下のツリーファイル ({@code *.json}) を名前順に返す。ノード定義ディレクトリと
     * {@code excluded} 配下は含めない。
     */
    public List<Path> treeFiles(Path excluded) {
        Path definitions = workdir.resolve(NodeDefinitionLoader.DEFINITION_DIR);
        Path skipped = excluded == null ? null : excluded.toAbsolutePath().normalize();
        try (Stream<Path> stream = Files.walk(workdir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .map(path -> path.toAbsolutePath().normalize())
                    .filter(path -> !path.startsWith(definitions))
                    .filter(path -> skipped == null || !path.startsWith(skipped))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("ワークスペースを走査できません: " + workdir, ex);
        }
    }

    public String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(workdir)) {
            return FileTimestamps.normalize(file.toString());
        }
        return FileTimestamps.normalize(workdir.relativize(absolute).toString());
    }

    static String baseName(String path) {
        String normalized = FileTimestamps.normalize(path);
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public Path workdir() {
        return workdir;
    }

    public NodeDefinitionRegistry registry() {
        return registry;
    }

    public List<String> definitionWarnings() {
        return definitionWarnings;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public VariableScope scope() {
        return scope;
    }

    public VariableResolver variables() {
        return variables;
    }

    public FileTimestamps timestamps() {
        return timestamps;
    }

    public ResolveGuard guard() {
        return guard;
    }

    public boolean isCheckExpr() {
        return checkExpr;
    }

    public void setCheckExpr(boolean checkExpr) {
        this.checkExpr = checkExpr;
    }

    /** {@link #check(String)} の結果。 */
    public record CheckResult(
            String file, TreeDocument tree, FileVariables variables, boolean ok, List<Diagnostic> diagnostics) {

        public CheckResult {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
