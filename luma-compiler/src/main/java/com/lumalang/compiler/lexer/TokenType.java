package com.lumalang.compiler.lexer;

/**
 * LumaLang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,           // true / false

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_FN, KW_LET, KW_IF, KW_ELSE, KW_RETURN,

    // === 关键词 - 内置类型 ===
    KW_INT, KW_FLOAT, KW_STRING, KW_CHAR, KW_BOOL, KW_VOID,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    MUL_ASSIGN,             // *=
    DIV_ASSIGN,             // /=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // :
    ARROW,          // ->

    // === 特殊 ===
    EOF;

    /**
     * 是否为关键词（含内置类型名）
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为内置类型名
     */
    public boolean isTypeName() {
        switch (this) {
            case KW_INT:
            case KW_FLOAT:
            case KW_STRING:
            case KW_CHAR:
            case KW_BOOL:
            case KW_VOID:
                return true;
            default:
                return false;
        }
    }
}
