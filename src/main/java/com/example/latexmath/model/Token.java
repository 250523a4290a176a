package com.example.latexmath.model;

import java.util.Objects;

/**
 * 一个已分类的词法单元，产出后不可变。
 *
 * @param kind    类别
 * @param literal 原文（命令带反斜杠，例如 "\frac"）
 */
public record Token(TokenKind kind, String literal) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(literal, "literal");
    }

    /** 命令名（去掉反斜杠），非命令返回 null */
    public String commandName() {
        if (kind != TokenKind.COMMAND || literal.length() < 2) {
            return null;
        }
        return literal.substring(1);
    }

    @Override
    public String toString() {
        return kind + "(" + literal + ")";
    }
}
