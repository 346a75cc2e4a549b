package com.lumalang.compiler.ast;

import com.lumalang.compiler.ast.decl.FunDecl;
import com.lumalang.compiler.ast.decl.Program;
import com.lumalang.compiler.ast.expr.*;
import com.lumalang.compiler.ast.stmt.Block;
import com.lumalang.compiler.ast.stmt.ReturnStmt;
import com.lumalang.compiler.ast.stmt.Statement;
import com.lumalang.compiler.ast.type.VarType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AST 节点与访问者测试
 */
class AstNodeTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    @Test
    @DisplayName("构造后修改原列表不影响节点")
    void testDefensiveCopy() {
        List<Expression> args = new ArrayList<Expression>();
        args.add(Literal.ofInt(LOC, 1));
        CallExpr call = new CallExpr(LOC, "f", args);

        args.add(Literal.ofInt(LOC, 2));
        assertEquals(1, call.getArgs().size());
        assertThrows(UnsupportedOperationException.class, () -> call.getArgs().add(args.get(1)));
    }

    @Test
    @DisplayName("二元表达式的子节点不能为 null")
    void testBinaryRequiresOperands() {
        assertThrows(NullPointerException.class,
                () -> new BinaryExpr(LOC, null, BinaryExpr.BinaryOp.ADD, Literal.ofInt(LOC, 1)));
    }

    @Test
    @DisplayName("类型名解析")
    void testVarType() {
        assertEquals(VarType.FLOAT, VarType.fromName("Float"));
        assertEquals("Void", VarType.VOID.toString());
        assertEquals("Bool", VarType.BOOL.getTypeName());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> VarType.fromName("int"));
        assertEquals("Unknown type: int", e.getMessage());
    }

    @Test
    @DisplayName("访问者按节点类型分派，未覆盖的方法返回 null")
    void testVisitorDispatch() {
        Expression sum = new BinaryExpr(LOC, Literal.ofInt(LOC, 2), BinaryExpr.BinaryOp.MUL,
                new Variable(LOC, "n"));
        Statement ret = new ReturnStmt(LOC, sum);
        FunDecl fun = new FunDecl(LOC, "g", Collections.emptyList(), VarType.INT,
                new Block(LOC, Arrays.asList(ret)));
        Program program = new Program(LOC, Arrays.asList(fun));

        // 收集访问顺序
        List<String> visited = new ArrayList<String>();
        AstVisitor<Void, List<String>> collector = new AstVisitor<Void, List<String>>() {
            @Override
            public Void visitProgram(Program node, List<String> ctx) {
                ctx.add("program");
                for (FunDecl f : node.getFunctions()) f.accept(this, ctx);
                return null;
            }

            @Override
            public Void visitFunDecl(FunDecl node, List<String> ctx) {
                ctx.add("fn " + node.getName());
                return node.getBody().accept(this, ctx);
            }

            @Override
            public Void visitBlock(Block node, List<String> ctx) {
                for (Statement s : node.getStatements()) s.accept(this, ctx);
                return null;
            }

            @Override
            public Void visitReturnStmt(ReturnStmt node, List<String> ctx) {
                ctx.add("return");
                return node.getValue().accept(this, ctx);
            }

            @Override
            public Void visitBinaryExpr(BinaryExpr node, List<String> ctx) {
                node.getLeft().accept(this, ctx);
                ctx.add(node.getOperator().toSourceString());
                return node.getRight().accept(this, ctx);
            }

            @Override
            public Void visitVariable(Variable node, List<String> ctx) {
                ctx.add(node.getName());
                return null;
            }
        };

        program.accept(collector, visited);
        // Literal 使用默认实现，不记录
        assertEquals(Arrays.asList("program", "fn g", "return", "*", "n"), visited);
    }
}
