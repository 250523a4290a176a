package com.example.latexmath.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 受约束生成会话的结果
 */
@Getter
@AllArgsConstructor
public class GenerationResult {

    private final GenerationStatus status;

    /** 已接受的词法单元拼接而成的表达式 */
    private final String expression;

    private final List<Token> acceptedTokens;

    /** 被自动机拒绝的候选（生成方自己负责重试） */
    private final List<String> rejectedAttempts;

    private final boolean complete;
}
