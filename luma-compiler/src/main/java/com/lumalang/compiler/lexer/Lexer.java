package com.lumalang.compiler.lexer;

import com.lumalang.compiler.diagnostic.SourceSnippet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LumaLang 词法分析器
 *
 * <p>按需逐个产出 Token（{@link #nextToken()}），遇到第一个词法错误即抛出 {@link LexException}。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    // 读取游标（peekToken 需要保存/恢复的全部状态）
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的起始位置
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        map.put("fn", TokenType.KW_FN);
        map.put("let", TokenType.KW_LET);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("return", TokenType.KW_RETURN);

        // 内置类型
        map.put("Int", TokenType.KW_INT);
        map.put("Float", TokenType.KW_FLOAT);
        map.put("String", TokenType.KW_STRING);
        map.put("Char", TokenType.KW_CHAR);
        map.put("Bool", TokenType.KW_BOOL);
        map.put("Void", TokenType.KW_VOID);

        map.put("true", TokenType.BOOL_LITERAL);
        map.put("false", TokenType.BOOL_LITERAL);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后持续返回 EOF。
     */
    public Token nextToken() {
        skipWhitespaceAndComments();

        start = current;
        startLine = line;
        startColumn = column;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, column, current);
        }
        return scanToken();
    }

    /**
     * 查看下一个 Token 但不消费
     */
    public Token peekToken() {
        int savedCurrent = current;
        int savedLine = line;
        int savedColumn = column;
        try {
            return nextToken();
        } finally {
            current = savedCurrent;
            line = savedLine;
            column = savedColumn;
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case ':': return makeToken(TokenType.COLON);

            // 可能是多字符的 Token
            case '+':
                return makeToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);

            case '-':
                if (match('>')) return makeToken(TokenType.ARROW);
                if (match('=')) return makeToken(TokenType.MINUS_ASSIGN);
                return makeToken(TokenType.MINUS);

            case '*':
                return makeToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);

            case '/':
                // 注释已在 skipWhitespaceAndComments 中处理
                return makeToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.DIV);

            case '=':
                return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);

            case '!':
                return makeToken(match('=') ? TokenType.NE : TokenType.NOT);

            case '<':
                return makeToken(match('=') ? TokenType.LE : TokenType.LT);

            case '>':
                return makeToken(match('=') ? TokenType.GE : TokenType.GT);

            case '"':
                return string();

            case '\'':
                return character();

            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                throw error("Unexpected character: '" + c + "'", startLine, startColumn, start);
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c == '\t') {
            column += SourceSnippet.TAB_SIZE - ((column - 1) % SourceSnippet.TAB_SIZE);
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === 空白与注释 ===

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f' || c == '\u000B') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // 单行注释
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else {
                break;
            }
        }
    }

    private void blockComment() {
        advance(); // /
        advance(); // *
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated block comment", line, column, current);
            }
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, start);
    }

    // === 复杂 Token 扫描 ===

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated string", startLine, startColumn, start);
            }
            char c = peek();
            if (c == '"') {
                advance(); // 闭合的 "
                break;
            }
            if (c == '\\') {
                value.append(escapeChar(false));
            } else {
                value.append(advance());
            }
        }
        return makeToken(TokenType.STRING_LITERAL, value.toString());
    }

    private Token character() {
        if (match('\'')) {
            // '' 交由语法分析报告 "Empty char literal"
            return makeToken(TokenType.CHAR_LITERAL, null);
        }
        if (isAtEnd() || peek() == '\n') {
            throw error("Unterminated character literal", startLine, startColumn, start);
        }

        char value = peek() == '\\' ? escapeChar(true) : advance();

        if (!match('\'')) {
            throw error("Unterminated character literal", startLine, startColumn, start);
        }
        return makeToken(TokenType.CHAR_LITERAL, value);
    }

    /**
     * 解析以反斜杠开头的转义序列，当前位置指向反斜杠
     */
    private char escapeChar(boolean inChar) {
        int escLine = line;
        int escColumn = column;
        int escOffset = current;
        advance(); // '\'
        if (isAtEnd()) {
            if (inChar) {
                throw error("Unterminated character literal", startLine, startColumn, start);
            }
            throw error("Unterminated string", startLine, startColumn, start);
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case '\\': return '\\';
            case '"': return '"';
            case '\'':
                if (inChar) return '\'';
                break;
            default:
                break;
        }
        throw error("Invalid escape sequence: \\" + c, escLine, escColumn, escOffset);
    }

    private Token number() {
        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            return makeToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
        }

        String text = source.substring(start, current);
        try {
            return makeToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Invalid integer literal: " + text, startLine, startColumn, start);
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            return makeToken(TokenType.IDENTIFIER);
        }
        if (type == TokenType.BOOL_LITERAL) {
            return makeToken(type, Boolean.valueOf(text));
        }
        return makeToken(type);
    }

    // === 错误报告 ===

    private LexException error(String message, int errLine, int errColumn, int errOffset) {
        return new LexException(message, fileName, errLine, errColumn, lineTextAt(errOffset));
    }

    /**
     * 返回包含指定偏移的整行源码（不含换行符）
     */
    private String lineTextAt(int offset) {
        int lineStart = Math.min(offset, source.length());
        while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
            lineStart--;
        }
        int lineEnd = Math.min(offset, source.length());
        while (lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
            lineEnd++;
        }
        if (lineEnd > lineStart && source.charAt(lineEnd - 1) == '\r') {
            lineEnd--;
        }
        return source.substring(lineStart, lineEnd);
    }
}
