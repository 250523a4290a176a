package com.example.latexmath.model;

/**
 * 多参数命令尚欠的参数个数。
 *
 * @param command   命令名（frac、sqrt、begin ...）
 * @param remaining 还没开始读的 {参数} 个数
 */
public record PendingArity(String command, int remaining) {

    public PendingArity consumeOne() {
        return new PendingArity(command, remaining - 1);
    }
}
