package io.github.hide212131.b3tree.app;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** b3tree CLI のルートコマンド。 */
@Command(name = "b3tree", description = "ビヘイビアツリーの検証とビルドを行う CLI。", mixinStandardHelpOptions = true,
        subcommands = { BuildCommand.class, CheckCommand.class })
public final class B3TreeCliApp {

    /** 検証エラーがあった場合の終了コード。 */
    static final int EXIT_VALIDATION_ERROR = 1;
    /** ワークスペース記述子の欠落やオプション誤りなど、設定の誤りの終了コード。 */
    static final int EXIT_CONFIGURATION_ERROR = 2;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public B3TreeCliApp() {
        // for picocli
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new B3TreeCliApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = new CommandLine(new B3TreeCliApp());
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }
}
