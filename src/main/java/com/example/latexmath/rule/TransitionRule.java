package com.example.latexmath.rule;

import com.example.latexmath.model.ErrorKind;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.TokenKind;

import java.util.Set;

/**
 * 转移表中的一条：(from, kind) -> action。
 * targets 是该动作可能到达的状态（守卫条件由引擎按配置判断），供图表工具静态枚举；
 * REJECT 条目的 targets 为空，error 为默认拒绝原因。
 */
public record TransitionRule(FsmState from,
                             TokenKind kind,
                             TransitionAction action,
                             Set<FsmState> targets,
                             ErrorKind error,
                             String description) {

    public boolean isReject() {
        return action == TransitionAction.REJECT;
    }
}
