package com.lumalang.compiler.formatter;

import com.lumalang.compiler.ast.AstVisitor;
import com.lumalang.compiler.ast.decl.FunDecl;
import com.lumalang.compiler.ast.decl.Parameter;
import com.lumalang.compiler.ast.decl.Program;
import com.lumalang.compiler.ast.expr.*;
import com.lumalang.compiler.ast.stmt.*;

/**
 * AST 转储器
 *
 * <p>深度优先遍历，每个节点一行，子节点多缩进一层。</p>
 */
public class AstDumper implements AstVisitor<Void, DumpContext> {

    /**
     * 转储程序
     */
    public String dump(Program program, DumpConfig config) {
        DumpContext ctx = new DumpContext(config);
        visitProgram(program, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置转储
     */
    public String dump(Program program) {
        return dump(program, new DumpConfig());
    }

    /**
     * 转储单个表达式
     */
    public String dump(Expression expression, DumpConfig config) {
        DumpContext ctx = new DumpContext(config);
        expression.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, DumpContext ctx) {
        ctx.line("Program", node.getLocation());
        ctx.indent();
        for (FunDecl fun : node.getFunctions()) {
            fun.accept(this, ctx);
        }
        ctx.dedent();
        return null;
    }

    @Override
    public Void visitFunDecl(FunDecl node, DumpContext ctx) {
        ctx.line("Function " + node.getName() + " -> " + node.getReturnType(), node.getLocation());
        ctx.indent();
        for (Parameter param : node.getParams()) {
            param.accept(this, ctx);
        }
        node.getBody().accept(this, ctx);
        ctx.dedent();
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, DumpContext ctx) {
        ctx.line("Param: " + node.getName() + ": " + node.getType(), node.getLocation());
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, DumpContext ctx) {
        ctx.line("Block", node.getLocation());
        dumpStatements(node, ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, DumpContext ctx) {
        node.getExpression().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, DumpContext ctx) {
        ctx.line("If", node.getLocation());
        ctx.indent();
        node.getCondition().accept(this, ctx);
        ctx.dedent();

        ctx.line("Then:", node.getThenBranch().getLocation());
        dumpStatements(node.getThenBranch(), ctx);

        if (node.hasElse()) {
            ctx.line("Else:", node.getElseBranch().getLocation());
            dumpStatements(node.getElseBranch(), ctx);
        }
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, DumpContext ctx) {
        ctx.line("Let(" + node.getName() + ": " + node.getType() + ")", node.getLocation());
        if (node.hasInitializer()) {
            ctx.indent();
            node.getInitializer().accept(this, ctx);
            ctx.dedent();
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, DumpContext ctx) {
        ctx.line("Return", node.getLocation());
        ctx.indent();
        node.getValue().accept(this, ctx);
        ctx.dedent();
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, DumpContext ctx) {
        String text;
        switch (node.getKind()) {
            case INT: text = "Int(" + node.getValue() + ")"; break;
            case FLOAT: text = "Float(" + node.getValue() + ")"; break;
            case STRING: text = "String(" + node.getValue() + ")"; break;
            case CHAR: text = "Char('" + node.getValue() + "')"; break;
            case BOOL: text = "Bool(" + node.getValue() + ")"; break;
            case VOID: text = "Void"; break;
            default: throw new IllegalStateException("Unknown literal kind: " + node.getKind());
        }
        ctx.line(text, node.getLocation());
        return null;
    }

    @Override
    public Void visitVariable(Variable node, DumpContext ctx) {
        ctx.line("Var(" + node.getName() + ")", node.getLocation());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, DumpContext ctx) {
        ctx.line("Binary(" + node.getOperator().toSourceString() + ")", node.getLocation());
        ctx.indent();
        node.getLeft().accept(this, ctx);
        node.getRight().accept(this, ctx);
        ctx.dedent();
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, DumpContext ctx) {
        ctx.line("Call(" + node.getCallee() + ")", node.getLocation());
        ctx.indent();
        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }
        ctx.dedent();
        return null;
    }

    // ============ 辅助方法 ============

    private void dumpStatements(Block block, DumpContext ctx) {
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
        }
        ctx.dedent();
    }
}
