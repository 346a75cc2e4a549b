package com.lumalang.cli;

import com.lumalang.compiler.formatter.DumpConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LumaLang CLI 入口点（picocli）：解析源码并输出 AST 或 Token 流
 */
@Command(name = "luma", version = "LumaLang v0.1.0",
         mixinStandardHelpOptions = true,
         description = "解析 LumaLang 源码并输出语法树")
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "-e", description = "直接解析给定的源码文本")
    String source;

    @Option(names = "--tokens", description = "输出 Token 流而不是 AST")
    boolean tokens;

    @Option(names = "--locations", description = "在每个 AST 节点后附加源码位置")
    boolean locations;

    @Option(names = "--indent-size", defaultValue = "2", description = "每层缩进空格数（默认 2）")
    int indentSize;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(arity = "0..1", description = "源码文件")
    String file;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (indentSize < 0) {
            err.println("错误: --indent-size 不能为负数");
            return 2;
        }
        DumpConfig config = new DumpConfig();
        config.setIndentSize(indentSize);
        config.setShowLocations(locations);

        DumpRunner runner = new DumpRunner(config, out, err);
        if (source != null) {
            return runner.dumpSource(source, "<expr>", tokens);
        }
        if (file != null) {
            return runner.dumpFile(file, tokens);
        }

        err.println("错误: 需要源码文件或 -e 参数");
        spec.commandLine().usage(err);
        return 2;
    }

    static void enableVerboseLogging() {
        Logger logger = Logger.getLogger("com.lumalang");
        logger.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，使用 native.encoding 获取操作系统原生编码
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 获取控制台实际使用的字符编码名（native.encoding 属性，Java 17+）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
