package com.lumalang.compiler.parser;

import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.expr.*;
import com.lumalang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.lumalang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级由低到高：相等性 → 比较 → 加减 → 乘除 → 基本表达式，全部左结合。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseEqualityExpr();
    }

    // 相等性 = == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.checkAny(ASSIGN, EQ, NE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseComparisonExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case ASSIGN: binOp = BinaryExpr.BinaryOp.EQUAL; break;
                case EQ: binOp = BinaryExpr.BinaryOp.EQ; break;
                case NE: binOp = BinaryExpr.BinaryOp.NE; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.checkAny(LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAdditiveExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected operator", op);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == PLUS ?
                    BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 乘除 * /
    private Expression parseMultiplicativeExpr() {
        Expression left = parsePrimaryExpr();

        while (parser.checkAny(MUL, DIV)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parsePrimaryExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == MUL ?
                    BinaryExpr.BinaryOp.MUL : BinaryExpr.BinaryOp.DIV;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();

        if (parser.match(INT_LITERAL)) {
            return Literal.ofInt(loc, (Long) parser.previous.getLiteral());
        }
        if (parser.match(FLOAT_LITERAL)) {
            return Literal.ofFloat(loc, (Double) parser.previous.getLiteral());
        }
        if (parser.match(STRING_LITERAL)) {
            return Literal.ofString(loc, (String) parser.previous.getLiteral());
        }
        if (parser.check(CHAR_LITERAL)) {
            Token tok = parser.advance();
            if (tok.getLiteral() == null) {
                throw new ParseException("Empty char literal", tok);
            }
            return Literal.ofChar(loc, (Character) tok.getLiteral());
        }
        if (parser.match(BOOL_LITERAL)) {
            return Literal.ofBool(loc, (Boolean) parser.previous.getLiteral());
        }

        // 标识符：变量或函数调用
        if (parser.check(IDENTIFIER)) {
            return parseCallOrVariable();
        }

        // 括号表达式
        if (parser.match(LPAREN)) {
            Expression expr = parseExpression();
            parser.expect(RPAREN, "`)`");
            return expr;
        }

        // 类型名 Void 在表达式位置表示空值
        if (parser.match(KW_VOID)) {
            return Literal.ofVoid(loc);
        }

        throw new ParseException("Unexpected token in expression", parser.current);
    }

    private Expression parseCallOrVariable() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();

        if (parser.match(LPAREN)) {
            List<Expression> args = new ArrayList<Expression>();
            if (!parser.check(RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "`)`");
            return new CallExpr(loc, name, args);
        }

        return new Variable(loc, name);
    }
}
