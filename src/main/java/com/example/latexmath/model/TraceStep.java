package com.example.latexmath.model;

/**
 * 轨迹中的一步：(token, state_before, state_after, accepted)。
 */
public record TraceStep(int index,
                        Token token,
                        FsmState before,
                        FsmState after,
                        boolean accepted,
                        ErrorKind error) {
}
