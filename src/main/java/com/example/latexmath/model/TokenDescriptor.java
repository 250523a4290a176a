package com.example.latexmath.model;

/**
 * 可接受的下一个词法单元描述：
 *  - LITERAL：具体文本，例如 "{"、"7"、"\alpha"
 *  - COMMAND_CLASS：注册表中某个参数个数的全部命令都可接受时的汇总描述
 */
public record TokenDescriptor(Type type, TokenKind kind, String literal, int arity) {

    public enum Type {
        LITERAL,
        COMMAND_CLASS
    }

    public static TokenDescriptor literal(TokenKind kind, String literal) {
        return new TokenDescriptor(Type.LITERAL, kind, literal, -1);
    }

    public static TokenDescriptor command(String literal, int arity) {
        return new TokenDescriptor(Type.LITERAL, TokenKind.COMMAND, literal, arity);
    }

    public static TokenDescriptor anyCommand(int arity) {
        return new TokenDescriptor(Type.COMMAND_CLASS, TokenKind.COMMAND, null, arity);
    }

    public boolean isLiteral() {
        return type == Type.LITERAL;
    }
}
