package com.lumalang.compiler.parser;

import com.lumalang.compiler.lexer.Token;
import com.lumalang.compiler.lexer.TokenType;

/**
 * 解析异常
 *
 * <p>语法分析不做错误恢复：第一个异常即终止整个解析。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
        this.expected = null;
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    /** 期望的语法成分描述，可能为 null */
    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.is(TokenType.EOF)) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        return sb.toString();
    }
}
