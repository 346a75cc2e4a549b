package com.lumalang.compiler.ast.expr;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),

        // 相等性（单个 = 也按比较处理，不是赋值）
        EQUAL("="),
        EQ("=="),
        NE("!="),

        // 比较
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">=");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
