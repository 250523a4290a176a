package com.example.latexmath.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * 一次完整校验的结果。
 * 失败时 failingIndex 指向第一个被拒绝的词法单元；
 * 所有词法单元都接受但没有闭合时 failingIndex == tokenCount，failingToken 为 null。
 */
@Getter
@AllArgsConstructor
public class ValidationResult {

    private final String input;
    private final boolean valid;
    private final int tokenCount;
    private final FsmState finalState;

    private final int failingIndex;
    private final Token failingToken;
    private final ErrorKind error;

    /** 失败位置当时可接受的文本集合（命令已展开） */
    private final Set<String> expected;

    private final List<TraceStep> trace;
}
