package com.lumalang.compiler.ast.expr;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;

/**
 * 变量引用表达式
 */
public class Variable extends Expression {
    private final String name;

    public Variable(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
