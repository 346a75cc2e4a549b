package com.lumalang.compiler.ast.type;

/**
 * 内置变量类型（封闭集合，无用户自定义类型）
 */
public enum VarType {
    INT("Int"),
    FLOAT("Float"),
    STRING("String"),
    CHAR("Char"),
    BOOL("Bool"),
    VOID("Void");

    private final String typeName;

    VarType(String typeName) {
        this.typeName = typeName;
    }

    /** 源码中的类型名 */
    public String getTypeName() {
        return typeName;
    }

    /**
     * 按源码类型名查找
     *
     * @throws IllegalArgumentException 未知类型名
     */
    public static VarType fromName(String name) {
        for (VarType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown type: " + name);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
