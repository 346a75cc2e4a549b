package com.lumalang.compiler.parser;

import com.lumalang.compiler.ast.SourceLocation;
import com.lumalang.compiler.ast.decl.FunDecl;
import com.lumalang.compiler.ast.decl.Parameter;
import com.lumalang.compiler.ast.stmt.Block;
import com.lumalang.compiler.ast.type.VarType;
import com.lumalang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.lumalang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // fn name(p: T, ...) -> T { ... }
    FunDecl parseFunDecl() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FN, "`fn`");
        String name = parser.expect(IDENTIFIER, "function name").getLexeme();

        // 参数
        parser.expect(LPAREN, "`(`");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            params = parseParamList();
        }
        parser.expect(RPAREN, "`)`");

        // 返回类型
        parser.expect(ARROW, "`->`");
        VarType returnType = parser.parseType("return type");

        Block body = parser.parseBlock();
        return new FunDecl(loc, name, params, returnType, body);
    }

    private List<Parameter> parseParamList() {
        List<Parameter> params = new ArrayList<Parameter>();
        do {
            Token nameTok = parser.expect(IDENTIFIER, "parameter name");
            parser.expect(COLON, "`:`");
            VarType type = parser.parseType("parameter type");
            params.add(new Parameter(parser.locationOf(nameTok), nameTok.getLexeme(), type));
        } while (parser.match(COMMA));
        return params;
    }
}
