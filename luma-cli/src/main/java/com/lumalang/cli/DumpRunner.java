package com.lumalang.cli;

import com.lumalang.compiler.ast.decl.Program;
import com.lumalang.compiler.formatter.AstDumper;
import com.lumalang.compiler.formatter.DumpConfig;
import com.lumalang.compiler.formatter.TokenDumper;
import com.lumalang.compiler.lexer.LexException;
import com.lumalang.compiler.lexer.Lexer;
import com.lumalang.compiler.parser.ParseException;
import com.lumalang.compiler.parser.Parser;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取源码、运行前端并输出结果。返回进程退出码：0 成功，1 失败。
 */
public class DumpRunner {

    private static final Logger LOG = Logger.getLogger(DumpRunner.class.getName());

    private final DumpConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public DumpRunner(DumpConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 解析文件并输出
     */
    public int dumpFile(String filePath, boolean tokensOnly) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取文件失败: " + filePath, e);
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return 1;
        }
        LOG.fine("读取 " + filePath + " (" + source.length() + " 字符)");
        return dumpSource(source, path.getFileName().toString(), tokensOnly);
    }

    /**
     * 解析源码文本并输出
     */
    public int dumpSource(String source, String fileName, boolean tokensOnly) {
        try {
            Lexer lexer = new Lexer(source, fileName);
            if (tokensOnly) {
                out.print(new TokenDumper().dump(lexer.scanTokens()));
            } else {
                Program program = new Parser(lexer, fileName).parse();
                LOG.fine("解析完成: " + program.getFunctions().size() + " 个函数");
                out.print(new AstDumper().dump(program, config));
            }
            out.flush();
            return 0;
        } catch (LexException | ParseException e) {
            LOG.log(Level.FINE, "解析失败: " + fileName, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
