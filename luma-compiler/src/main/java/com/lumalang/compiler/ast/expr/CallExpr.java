package com.lumalang.compiler.ast.expr;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用表达式：callee(arg, ...)
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public String getCallee() {
        return callee;
    }

    /** 实参，按源码顺序 */
    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
