package com.lumalang.compiler.ast.decl;

import com.lumalang.compiler.ast.AstNode;
import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元），函数按源码顺序排列
 */
public class Program extends AstNode {
    private final List<FunDecl> functions;

    public Program(SourceLocation location, List<FunDecl> functions) {
        super(location);
        this.functions = Collections.unmodifiableList(new ArrayList<FunDecl>(functions));
    }

    public List<FunDecl> getFunctions() {
        return functions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
