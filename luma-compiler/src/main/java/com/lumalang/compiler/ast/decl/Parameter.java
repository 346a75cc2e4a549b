package com.lumalang.compiler.ast.decl;

import com.lumalang.compiler.ast.AstNode;
import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.type.VarType;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final VarType type;

    public Parameter(SourceLocation location, String name, VarType type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public VarType getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
