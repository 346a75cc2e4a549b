package com.lumalang.compiler.ast.expr;

import com.lumalang.compiler.ast.AstNode;
import com.lumalang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
