package com.lumalang.compiler.diagnostic;

/**
 * 源码片段渲染：展开 Tab 并在出错列下方画出 ^ 指示符
 *
 * <p>Tab 宽度与 Lexer 的列计数保持一致（4），保证 ^ 与展开后的字符对齐。</p>
 */
public final class SourceSnippet {

    public static final int TAB_SIZE = 4;

    private SourceSnippet() {
    }

    /**
     * 将 Tab 展开到下一个 Tab 停靠点
     */
    public static String expandTabs(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = TAB_SIZE - (sb.length() % TAB_SIZE);
                for (int s = 0; s < spaces; s++) {
                    sb.append(' ');
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 计算 1 起始列号在展开后的行中对应的 0 起始显示位置。
     *
     * <p>逐字符遍历原始行，直到到达目标列之前的位置。列号超出行尾时停在行尾。</p>
     */
    public static int visualColumn(String line, int column) {
        int visual = 0;
        for (int i = 0; i < line.length() && visual < column - 1; i++) {
            if (line.charAt(i) == '\t') {
                visual += TAB_SIZE - (visual % TAB_SIZE);
            } else {
                visual++;
            }
        }
        return visual;
    }

    /**
     * 生成指向指定列的 ^ 行
     */
    public static String caretLine(String line, int column) {
        int pos = visualColumn(line, column);
        StringBuilder sb = new StringBuilder(pos + 1);
        for (int i = 0; i < pos; i++) {
            sb.append(' ');
        }
        return sb.append('^').toString();
    }

    /**
     * 渲染完整诊断：标题行、展开后的源码行、^ 行
     */
    public static String render(String header, String sourceLine, int column) {
        StringBuilder sb = new StringBuilder(header);
        if (sourceLine != null) {
            sb.append('\n').append(expandTabs(sourceLine));
            sb.append('\n').append(caretLine(sourceLine, column));
        }
        return sb.toString();
    }
}
