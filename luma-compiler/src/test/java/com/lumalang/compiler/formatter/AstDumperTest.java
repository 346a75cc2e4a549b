package com.lumalang.compiler.formatter;

import com.lumalang.compiler.ast.decl.Program;
import com.lumalang.compiler.lexer.Lexer;
import com.lumalang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AstDumper / TokenDumper 测试
 */
class AstDumperTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private String dump(String source) {
        return new AstDumper().dump(parse(source));
    }

    @Nested
    @DisplayName("AST 转储")
    class AstDumpTests {

        @Test
        @DisplayName("函数与参数")
        void testFunction() {
            String expected = String.join("\n",
                    "Program",
                    "  Function f -> Int",
                    "    Param: x: Int",
                    "    Block",
                    "      Return",
                    "        Var(x)",
                    "");
            assertThat(dump("fn f(x: Int) -> Int { return x; }")).isEqualTo(expected);
        }

        @Test
        @DisplayName("let / if / else / 调用")
        void testStatements() {
            String source = "fn main() -> Void {\n"
                    + "  let a: Int = 1;\n"
                    + "  if a < 2 { print(a, \"hi\") } else { return Void }\n"
                    + "}";
            String expected = String.join("\n",
                    "Program",
                    "  Function main -> Void",
                    "    Block",
                    "      Let(a: Int)",
                    "        Int(1)",
                    "      If",
                    "        Binary(<)",
                    "          Var(a)",
                    "          Int(2)",
                    "      Then:",
                    "        Call(print)",
                    "          Var(a)",
                    "          String(hi)",
                    "      Else:",
                    "        Return",
                    "          Void",
                    "");
            assertThat(dump(source)).isEqualTo(expected);
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            String out = dump("fn f() -> Void { 1.5; 'c'; true; let s: String }");
            assertThat(out)
                    .contains("      Float(1.5)\n")
                    .contains("      Char('c')\n")
                    .contains("      Bool(true)\n")
                    .contains("      Let(s: String)\n");
        }

        @Test
        @DisplayName("左结合的减法嵌套在左侧")
        void testNestedBinary() {
            String out = new AstDumper().dump(
                    new Parser(new Lexer("1 - 2 - 3")).parseStandaloneExpression(), new DumpConfig());
            assertThat(out).isEqualTo(String.join("\n",
                    "Binary(-)",
                    "  Binary(-)",
                    "    Int(1)",
                    "    Int(2)",
                    "  Int(3)",
                    ""));
        }

        @Test
        @DisplayName("自定义缩进宽度")
        void testIndentSize() {
            DumpConfig config = new DumpConfig();
            config.setIndentSize(4);
            String out = new AstDumper().dump(parse("fn f() -> Int { 1 }"), config);
            assertThat(out).isEqualTo(String.join("\n",
                    "Program",
                    "    Function f -> Int",
                    "        Block",
                    "            Int(1)",
                    ""));
        }

        @Test
        @DisplayName("附带源码位置")
        void testShowLocations() {
            DumpConfig config = new DumpConfig();
            config.setShowLocations(true);
            String out = new AstDumper().dump(parse("fn f() -> Int {\n  a + 1\n}"), config);
            assertThat(out)
                    .startsWith("Program @1:1\n")
                    .contains("Function f -> Int @1:1\n")
                    .contains("Binary(+) @2:5\n")
                    .contains("Int(1) @2:7\n");
        }

        @Test
        @DisplayName("空程序")
        void testEmptyProgram() {
            assertThat(dump("")).isEqualTo("Program\n");
        }

        @Test
        @DisplayName("负缩进被拒绝")
        void testNegativeIndent() {
            assertThatThrownBy(() -> new DumpConfig().setIndentSize(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("-1");
        }
    }

    @Test
    @DisplayName("缩进不会低于零层")
    void testDedentFloor() {
        DumpContext ctx = new DumpContext(new DumpConfig());
        ctx.indent();
        ctx.dedent();
        ctx.dedent();
        assertThat(ctx.getIndentLevel()).isZero();
        ctx.line("x", null);
        assertThat(ctx.getOutput()).isEqualTo("x\n");
    }

    @Nested
    @DisplayName("Token 转储")
    class TokenDumpTests {

        @Test
        @DisplayName("每个 token 一行，包含 EOF")
        void testTokenDump() {
            String out = new TokenDumper().dump(new Lexer("let x\n\t\"s\"").scanTokens());
            assertThat(out).isEqualTo(String.join("\n",
                    "1:1 KW_LET 'let'",
                    "1:5 IDENTIFIER 'x'",
                    "2:5 STRING_LITERAL '\"s\"'",
                    "2:8 EOF ''",
                    ""));
        }
    }
}
