package com.lumalang.compiler.ast.decl;

import com.lumalang.compiler.ast.AstNode;
import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.stmt.Block;
import com.lumalang.compiler.ast.type.VarType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数声明：fn name(params) -> Type { ... }
 */
public class FunDecl extends AstNode {
    private final String name;
    private final List<Parameter> params;
    private final VarType returnType;
    private final Block body;

    public FunDecl(SourceLocation location, String name, List<Parameter> params,
                   VarType returnType, Block body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<Parameter>(params));
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public VarType getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
