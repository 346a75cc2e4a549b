package com.lumalang.compiler.lexer;

import com.lumalang.compiler.diagnostic.SourceSnippet;

/**
 * 词法异常
 *
 * <p>携带出错位置与所在源码行，{@link #getMessage()} 返回带 ^ 指示符的多行渲染结果。</p>
 */
public class LexException extends RuntimeException {
    private final String reason;
    private final String fileName;
    private final int line;
    private final int column;
    private final String sourceLine;

    public LexException(String reason, String fileName, int line, int column, String sourceLine) {
        super(reason);
        this.reason = reason;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.sourceLine = sourceLine;
    }

    /** 不含位置信息的原始错误描述 */
    public String getReason() {
        return reason;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    @Override
    public String getMessage() {
        String header = String.format("[%s:%d:%d] Lexer error: %s", fileName, line, column, reason);
        return SourceSnippet.render(header, sourceLine, column);
    }
}
