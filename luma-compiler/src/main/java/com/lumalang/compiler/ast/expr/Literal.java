package com.lumalang.compiler.ast.expr;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>值类型由 {@link LiteralKind} 决定：INT → Long, FLOAT → Double, STRING → String,
 * CHAR → Character, BOOL → Boolean, VOID → null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofInt(SourceLocation location, long value) {
        return new Literal(location, value, LiteralKind.INT);
    }

    public static Literal ofFloat(SourceLocation location, double value) {
        return new Literal(location, value, LiteralKind.FLOAT);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public static Literal ofChar(SourceLocation location, char value) {
        return new Literal(location, value, LiteralKind.CHAR);
    }

    public static Literal ofBool(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOL);
    }

    public static Literal ofVoid(SourceLocation location) {
        return new Literal(location, null, LiteralKind.VOID);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public long getIntValue() {
        return (Long) value;
    }

    public double getFloatValue() {
        return (Double) value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        CHAR,
        BOOL,
        VOID;

        /** 是否为数值字面量类型 */
        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}
