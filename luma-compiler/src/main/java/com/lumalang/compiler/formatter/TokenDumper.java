package com.lumalang.compiler.formatter;

import com.lumalang.compiler.lexer.Token;

import java.util.List;

/**
 * Token 流转储：每行 "line:column TYPE 'lexeme'"
 */
public class TokenDumper {

    public String dump(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getLine()).append(':').append(token.getColumn())
              .append(' ').append(token.getType())
              .append(" '").append(token.getLexeme()).append("'\n");
        }
        return sb.toString();
    }
}
