package com.lumalang.compiler.parser;

import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.expr.Expression;
import com.lumalang.compiler.ast.stmt.*;
import com.lumalang.compiler.ast.type.VarType;

import java.util.ArrayList;
import java.util.List;

import static com.lumalang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 语句：let / if / return / 表达式。紧挨 '}' 的最后一条语句可以省略 ';'
     */
    Statement parseStatement() {
        SourceLocation loc = parser.location();
        Statement stmt;

        if (parser.match(KW_LET)) {
            stmt = parseLetStmt(loc);
        } else if (parser.match(KW_IF)) {
            stmt = parseIfStmt(loc);
        } else if (parser.match(KW_RETURN)) {
            stmt = parseReturnStmt(loc);
        } else {
            stmt = new ExpressionStmt(loc, parser.parseExpression());
        }

        if (!parser.check(RBRACE)) {
            parser.expect(SEMICOLON, "`;` after statement");
        }
        return stmt;
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "`{`");

        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }

        parser.expect(RBRACE, "`}`");
        return new Block(loc, statements);
    }

    // let name: Type [= expr]
    private LetStmt parseLetStmt(SourceLocation loc) {
        String name = parser.expect(IDENTIFIER, "variable name").getLexeme();
        parser.expect(COLON, "`:`");
        VarType type = parser.parseType("type name");

        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseExpression();
        }
        return new LetStmt(loc, name, type, initializer);
    }

    // if cond { ... } [else { ... }]，条件不加括号，表达式文法中没有 '{'
    private IfStmt parseIfStmt(SourceLocation loc) {
        Expression condition = parser.parseExpression();
        Block thenBranch = parser.parseBlock();

        Block elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parser.parseBlock();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private ReturnStmt parseReturnStmt(SourceLocation loc) {
        Expression value = parser.parseExpression();
        return new ReturnStmt(loc, value);
    }
}
