package com.example.latexmath.model;

/**
 * 注册表条目。
 *
 * @param name     命令名，不带反斜杠
 * @param category 类别
 */
public record CommandDef(String name, CommandCategory category) {

    public int arity() {
        return category.getArity();
    }

    public String literal() {
        return "\\" + name;
    }
}
