package com.lumalang.compiler.ast.stmt;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.expr.Expression;

/**
 * If 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final Block elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch, Block elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
