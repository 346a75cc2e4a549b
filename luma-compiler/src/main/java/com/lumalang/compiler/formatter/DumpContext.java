package com.lumalang.compiler.formatter;

import com.lumalang.compiler.ast.SourceLocation;

/**
 * 转储上下文，跟踪输出缓冲区和缩进层级
 */
public class DumpContext {
    private final StringBuilder output = new StringBuilder();
    private final DumpConfig config;
    private final String indentUnit;
    private int indentLevel = 0;

    public DumpContext(DumpConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 输出一行（带当前缩进），按配置追加源码位置
     */
    public void line(String text, SourceLocation location) {
        for (int i = 0; i < indentLevel; i++) {
            output.append(indentUnit);
        }
        output.append(text);
        if (config.isShowLocations() && location != null) {
            output.append(" @").append(location.getLine()).append(':').append(location.getColumn());
        }
        output.append('\n');
    }

    public String getOutput() {
        return output.toString();
    }
}
