package io.github.hide212131.b3tree.runtime.resolve;

import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostic;
import io.github.hide212131.b3tree.runtime.diagnostic.Diagnostics;
import io.github.hide212131.b3tree.runtime.io.TreeFormatException;
import io.github.hide212131.b3tree.runtime.io.TreeReader;
import io.github.hide212131.b3tree.runtime.model.TreeDocument;
import io.github.hide212131.b3tree.runtime.model.TreeNode;
import io.github.hide212131.b3tree.runtime.model.TreeNodes;
import io.github.hide212131.b3tree.runtime.model.VariableDeclaration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * import ファイルとサブツリーファイルが宣言する変数を集め、ファイル単位でキャッシュする。
 * <p>
 * キャッシュは自身の更新時刻か、記録した依存ファイルのいずれかの更新時刻が新しくなった場合に作り直す。
 * 消えた依存ファイルはそれだけでは再計算の理由にしない。
 */
public final class VariableResolver {

    private static final Logger LOGGER = Logger.getLogger(VariableResolver.class.getName());

    private final FileTimestamps timestamps;
    private final ResolveGuard guard;
    private final Diagnostics diagnostics;
    private final Map<String, ImportEntry> cache = new HashMap<>();

    public VariableResolver(FileTimestamps timestamps, ResolveGuard guard, Diagnostics diagnostics) {
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** {@code resolvedRoot} はサブツリー展開済みのルート。展開後に残る参照パスからサブツリー変数を集める。 */
    public FileVariables resolve(TreeDocument tree, TreeNode resolvedRoot) {
        List<ImportEntry> imports = loadAll(tree.getImports());
        List<ImportEntry> subtrees = loadAll(TreeNodes.collectSubtreePaths(resolvedRoot));

        Map<String, VariableDeclaration> merged = new LinkedHashMap<>();
        addFirstWins(merged, tree.getVars());
        imports.forEach(entry -> addFirstWins(merged, entry.vars()));
        subtrees.forEach(entry -> addFirstWins(merged, entry.vars()));
        List<VariableDeclaration> sorted = new ArrayList<>(merged.values());
        sorted.sort(Comparator.comparing(VariableDeclaration::name));
        return new FileVariables(imports, subtrees, tree.getVars(), sorted);
    }

    /** キャッシュ済みのエントリ。鮮度は確認しない。 */
    public Optional<ImportEntry> cached(String path) {
        return Optional.ofNullable(cache.get(FileTimestamps.normalize(path)));
    }

    public void invalidateAll() {
        cache.clear();
    }

    private List<ImportEntry> loadAll(Collection<String> paths) {
        List<ImportEntry> entries = new ArrayList<>();
        for (String path : new LinkedHashSet<>(paths)) {
            String normalized = FileTimestamps.normalize(path);
            if (guard.contains(normalized)) {
                continue;
            }
            load(normalized).ifPresent(entries::add);
        }
        return entries;
    }

    /** 鮮度が保たれていればキャッシュを、そうでなければ読み直したエントリを返す。 */
    Optional<ImportEntry> load(String path) {
        return loadTracked(path).map(Loaded::entry);
    }

    /**
     * 読み込み中の祖先を理由に飛ばした import があるエントリは変数が欠けているため、キャッシュしない。
     * 飛ばしたパスは呼び出し元へ伝え、その祖先自身まで戻ったところで解消する。
     */
    private Optional<Loaded> loadTracked(String path) {
        Optional<Long> modified = timestamps.get(path);
        if (modified.isEmpty()) {
            diagnostics.warn(Diagnostic.Category.IO, guard.current(), "file not found: " + path);
            return Optional.empty();
        }
        ImportEntry cachedEntry = cache.get(path);
        if (cachedEntry != null && !isStale(cachedEntry, modified.get())) {
            return Optional.of(new Loaded(cachedEntry, Set.of()));
        }

        Set<String> depends = new LinkedHashSet<>();
        Set<String> skipped = new HashSet<>();
        List<VariableDeclaration> vars = new ArrayList<>();
        guard.push(path);
        try {
            TreeDocument document = TreeReader.read(timestamps.resolve(path));
            vars.addAll(document.getVars());
            for (String raw : document.getImports()) {
                String imported = FileTimestamps.normalize(raw);
                depends.add(imported);
                if (guard.contains(imported)) {
                    skipped.add(imported);
                    continue;
                }
                loadTracked(imported).ifPresent(loaded -> {
                    vars.addAll(loaded.entry().vars());
                    loaded.entry().depends().forEach(dependency -> depends.add(dependency.path()));
                    skipped.addAll(loaded.skipped());
                });
            }
            LOGGER.log(Level.FINE, "load var: {0}", path);
        } catch (TreeFormatException ex) {
            diagnostics.error(Diagnostic.Category.STRUCTURE, path, "parsing error: " + path);
        } finally {
            guard.pop(path);
        }
        skipped.remove(path);

        Map<String, VariableDeclaration> unique = new LinkedHashMap<>();
        addFirstWins(unique, vars);
        List<VariableDeclaration> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(VariableDeclaration::name));
        List<ImportEntry.Dependency> dependencies = new ArrayList<>();
        for (String dependency : depends) {
            dependencies.add(new ImportEntry.Dependency(dependency, timestamps.get(dependency).orElse(0L)));
        }
        ImportEntry entry = new ImportEntry(path, sorted, dependencies, modified.get());
        if (skipped.isEmpty()) {
            cache.put(path, entry);
        } else {
            cache.remove(path);
            LOGGER.log(Level.FINE, "partial var: {0} skipped {1}", new Object[] {path, skipped});
        }
        return Optional.of(new Loaded(entry, Set.copyOf(skipped)));
    }

    private boolean isStale(ImportEntry entry, long modified) {
        if (modified > entry.modified()) {
            return true;
        }
        for (ImportEntry.Dependency dependency : entry.depends()) {
            Optional<Long> current = timestamps.get(dependency.path());
            if (current.isPresent() && current.get() > dependency.modified()) {
                return true;
            }
        }
        return false;
    }

    private record Loaded(ImportEntry entry, Set<String> skipped) {
    }

    private static void addFirstWins(Map<String, VariableDeclaration> target, List<VariableDeclaration> vars) {
        for (VariableDeclaration declaration : vars) {
            target.putIfAbsent(declaration.name(), declaration);
        }
    }
}
