package com.lumalang.compiler.parser;

import com.lumalang.compiler.ast.type.VarType;
import com.lumalang.compiler.lexer.Token;

import static com.lumalang.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 *
 * <p>类型名在解析阶段即对照六个内置类型解析，未知类型名是语法错误。</p>
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    VarType parseType(String description) {
        Token tok = parser.current;
        if (!tok.getType().isTypeName() && !tok.is(IDENTIFIER)) {
            throw new ParseException("Expected " + description, tok, description);
        }
        parser.advance();
        try {
            return VarType.fromName(tok.getLexeme());
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), tok, description);
        }
    }
}
