package com.example.latexmath.model;

/**
 * 单步转移结果。接受时 next 为新配置；拒绝时 next 为 null，error 给出原因。
 */
public record StepResult(boolean accepted,
                         FsmState before,
                         FsmState after,
                         ErrorKind error,
                         Configuration next) {

    public static StepResult accept(FsmState before, Configuration next) {
        return new StepResult(true, before, next.getState(), null, next);
    }

    public static StepResult reject(FsmState before, ErrorKind error) {
        return new StepResult(false, before, before, error, null);
    }
}
