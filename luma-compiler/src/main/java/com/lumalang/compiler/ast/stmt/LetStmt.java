package com.lumalang.compiler.ast.stmt;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.expr.Expression;
import com.lumalang.compiler.ast.type.VarType;

import java.util.Objects;

/**
 * 变量声明：let name: Type [= init]
 */
public class LetStmt extends Statement {
    private final String name;
    private final VarType type;
    private final Expression initializer;  // 可选

    public LetStmt(SourceLocation location, String name, VarType type, Expression initializer) {
        super(location);
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public VarType getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
