package io.github.hide212131.b3tree.runtime.build;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * {@code settings.buildScript} からビルドスクリプトを作る。
 * <p>
 * {@code .jar} で終わる値はワークスペース相対の jar とみなし、{@code META-INF/services} の登録から
 * {@link BuildScript} 実装を探す。それ以外はクラスパス上の完全修飾クラス名として読み込む。
 */
public final class BuildScriptLoader {

    private final ClassLoader parent;

    public BuildScriptLoader() {
        this(BuildScriptLoader.class.getClassLoader());
    }

    public BuildScriptLoader(ClassLoader parent) {
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    public Loaded load(String reference, Path workdir) {
        Objects.requireNonNull(reference, "reference");
        if (reference.endsWith(".jar")) {
            return fromJar(workdir.resolve(reference));
        }
        return new Loaded(fromClassName(reference, parent), null);
    }

    private Loaded fromJar(Path jar) {
        if (!Files.isRegularFile(jar)) {
            throw new BuildScriptException("ビルドスクリプトの jar が見つかりません: " + jar);
        }
        URLClassLoader loader;
        try {
            loader = new URLClassLoader(new URL[] { jar.toUri().toURL() }, parent);
        } catch (MalformedURLException ex) {
            throw new BuildScriptException("ビルドスクリプトの jar を開けません: " + jar, ex);
        }
        try {
            BuildScript script = ServiceLoader.load(BuildScript.class, loader).findFirst()
                    .orElseThrow(() -> new BuildScriptException("jar に BuildScript の実装が登録されていません: " + jar));
            return new Loaded(script, loader);
        } catch (BuildScriptException ex) {
            closeQuietly(loader, ex);
            throw ex;
        } catch (RuntimeException | ServiceConfigurationError ex) {
            BuildScriptException failure = new BuildScriptException("ビルドスクリプトの初期化に失敗しました: " + jar, ex);
            closeQuietly(loader, failure);
            throw failure;
        }
    }

    private static BuildScript fromClassName(String className, ClassLoader loader) {
        try {
            Class<?> type = Class.forName(className, true, loader);
            if (!BuildScript.class.isAssignableFrom(type)) {
                throw new BuildScriptException(className + " は BuildScript を実装していません");
            }
            return (BuildScript) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException ex) {
            throw new BuildScriptException("ビルドスクリプトのクラスが見つかりません: " + className, ex);
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException
                | InvocationTargetException ex) {
            throw new BuildScriptException("ビルドスクリプトを生成できません: " + className, ex);
        }
    }

    private static void closeQuietly(URLClassLoader loader, RuntimeException primary) {
        try {
            loader.close();
        } catch (IOException ex) {
            primary.addSuppressed(ex);
        }
    }

    /**
     * 読み込んだスクリプトと、jar 由来の場合はそのクラスローダ。ビルド後に {@link #close()} する。
     */
    public record Loaded(BuildScript script, URLClassLoader loader) implements AutoCloseable {

        @Override
        public void close() throws IOException {
            if (loader != null) {
                loader.close();
            }
        }
    }
}
