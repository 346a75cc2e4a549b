package com.lumalang.compiler.ast.stmt;

import com.lumalang.compiler.ast.AstNode;
import com.lumalang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
