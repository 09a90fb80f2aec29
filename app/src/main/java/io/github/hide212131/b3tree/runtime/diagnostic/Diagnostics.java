package io.github.hide212131.b3tree.runtime.diagnostic;

import io.github.hide212131.b3tree.infra.logging.BuildLog;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** 診断の収集先。記録と同時にビルドログへ出力する。 */
public final class Diagnostics {

    private final BuildLog log;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics() {
        this(BuildLog.forClass(Diagnostics.class));
    }

    public Diagnostics(BuildLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public void report(Diagnostic diagnostic) {
        entries.add(diagnostic);
        String phase = diagnostic.category().name().toLowerCase(Locale.ROOT);
        if (diagnostic.isError()) {
            log.error(phase, diagnostic.file(), null, diagnostic.message(), null);
        } else {
            log.warn(phase, diagnostic.file(), null, diagnostic.message(), null);
        }
    }

    public void error(Diagnostic.Category category, String file, String message) {
        report(Diagnostic.error(category, file, message));
    }

    public void warn(Diagnostic.Category category, String file, String message) {
        report(Diagnostic.warning(category, file, message));
    }

    public List<Diagnostic> all() {
        return List.copyOf(entries);
    }

    /** {@code fromIndex} 以降に記録された診断。ファイル単位の切り出しに使う。 */
    public List<Diagnostic> since(int fromIndex) {
        return List.copyOf(entries.subList(Math.min(fromIndex, entries.size()), entries.size()));
    }

    public List<Diagnostic> errors() {
        return entries.stream().filter(Diagnostic::isError).toList();
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(Diagnostic::isError);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
