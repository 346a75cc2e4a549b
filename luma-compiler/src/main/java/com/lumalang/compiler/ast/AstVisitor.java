package com.lumalang.compiler.ast;

import com.lumalang.compiler.ast.decl.*;
import com.lumalang.compiler.ast.expr.*;
import com.lumalang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点对应一个方法，节点集合是封闭的。所有方法提供默认实现（返回 null），
 * 实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitFunDecl(FunDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitVariable(Variable node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }
}
