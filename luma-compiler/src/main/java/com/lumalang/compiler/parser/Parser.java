package com.lumalang.compiler.parser;

import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.decl.FunDecl;
import com.lumalang.compiler.ast.decl.Program;
import com.lumalang.compiler.ast.expr.Expression;
import com.lumalang.compiler.ast.stmt.Block;
import com.lumalang.compiler.ast.stmt.Statement;
import com.lumalang.compiler.ast.type.VarType;
import com.lumalang.compiler.lexer.Lexer;
import com.lumalang.compiler.lexer.Token;
import com.lumalang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.lumalang.compiler.lexer.TokenType.*;

/**
 * LumaLang 语法分析器（递归下降）
 *
 * <p>只持有一个当前 token，按需从 {@link Lexer} 拉取。任何语法错误立即抛出
 * {@link ParseException}，不返回部分 AST。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错 "Expected description"
     */
    Token expect(TokenType type, String description) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException("Expected " + description, current, description);
    }

    /**
     * 创建当前 token 的源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序：连续的函数声明直到 EOF
     */
    public Program parse() {
        SourceLocation loc = location();
        List<FunDecl> functions = new ArrayList<FunDecl>();
        while (!isAtEnd()) {
            functions.add(declParser.parseFunDecl());
        }
        return new Program(loc, functions);
    }

    /**
     * 解析单个独立表达式（其后必须是 EOF），用于调试与测试
     */
    public Expression parseStandaloneExpression() {
        Expression expr = parseExpression();
        expect(EOF, "end of input");
        return expr;
    }

    // ============ 类型解析委托 ============

    VarType parseType(String description) { return typeParser.parseType(description); }

    // ============ 语句解析委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    // ============ 表达式解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
}
