package com.lumalang.compiler.formatter;

/**
 * AST 转储配置
 */
public class DumpConfig {
    private int indentSize = 2;
    private boolean showLocations = false;

    public DumpConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isShowLocations() {
        return showLocations;
    }

    public void setShowLocations(boolean showLocations) {
        this.showLocations = showLocations;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
