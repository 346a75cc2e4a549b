package com.lumalang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CLI 集成测试
 */
class MainTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path writeSource(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("文件输入")
    class FileTests {

        @Test
        @DisplayName("合法源码输出 AST，退出码 0")
        void testValidFile() throws IOException {
            Path file = writeSource("ok.luma", "fn f(x: Int) -> Int { return x; }\n");

            assertThat(run(file.toString())).isEqualTo(0);
            assertThat(out.toString())
                    .startsWith("Program\n")
                    .contains("  Function f -> Int\n")
                    .contains("    Param: x: Int\n")
                    .contains("        Var(x)\n");
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("词法错误输出带 ^ 的诊断，退出码 1")
        void testLexError() throws IOException {
            Path file = writeSource("bad.luma", "fn f() -> String {\n  return \"oops;\n}\n");

            assertThat(run(file.toString())).isEqualTo(1);
            assertThat(err.toString())
                    .contains("[bad.luma:2:10] Lexer error: Unterminated string")
                    .contains("  return \"oops;")
                    .contains("         ^");
            assertThat(out.toString()).isEmpty();
        }

        @Test
        @DisplayName("语法错误输出期望的 token，退出码 1")
        void testParseError() throws IOException {
            Path file = writeSource("bad.luma", "fn f() -> Int { return 1;");

            assertThat(run(file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("Expected `}`").contains("found end of input");
        }

        @Test
        @DisplayName("文件不存在，退出码 1")
        void testMissingFile() {
            assertThat(run(tempDir.resolve("nope.luma").toString())).isEqualTo(1);
            assertThat(err.toString()).contains("文件不存在");
        }
    }

    @Nested
    @DisplayName("选项")
    class OptionTests {

        @Test
        @DisplayName("-e 直接解析源码")
        void testInlineSource() {
            assertThat(run("-e", "fn f() -> Int { 1 + 2 }")).isEqualTo(0);
            assertThat(out.toString()).contains("Binary(+)");
        }

        @Test
        @DisplayName("--tokens 输出 Token 流")
        void testTokens() {
            assertThat(run("--tokens", "-e", "let x")).isEqualTo(0);
            assertThat(out.toString()).isEqualTo("1:1 KW_LET 'let'\n1:5 IDENTIFIER 'x'\n1:6 EOF ''\n");
        }

        @Test
        @DisplayName("--tokens 仍然报告词法错误")
        void testTokensLexError() {
            assertThat(run("--tokens", "-e", "let @")).isEqualTo(1);
            assertThat(err.toString()).contains("[<expr>:1:5] Lexer error: Unexpected character: '@'");
        }

        @Test
        @DisplayName("--locations 与 --indent-size")
        void testDumpOptions() {
            assertThat(run("--locations", "--indent-size=4", "-e", "fn f() -> Int { 1 }")).isEqualTo(0);
            assertThat(out.toString())
                    .contains("Program @1:1\n")
                    .contains("    Function f -> Int @1:1\n");
        }

        @Test
        @DisplayName("负缩进是用法错误")
        void testNegativeIndent() {
            assertThat(run("--indent-size=-1", "-e", "fn f() -> Int { 1 }")).isEqualTo(2);
            assertThat(err.toString()).contains("--indent-size");
        }

        @Test
        @DisplayName("缺少输入时打印用法")
        void testNoInput() {
            assertThat(run()).isEqualTo(2);
            assertThat(err.toString()).contains("Usage: luma");
        }

        @Test
        @DisplayName("--version")
        void testVersion() {
            assertThat(run("--version")).isEqualTo(0);
            assertThat(out.toString()).contains("LumaLang v0.1.0");
        }
    }
}
