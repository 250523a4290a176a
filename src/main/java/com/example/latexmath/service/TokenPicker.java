package com.example.latexmath.service;

import com.example.latexmath.model.FsmState;

import java.util.List;
import java.util.Set;

/**
 * 生成方（模型客户端）接入点：每一步从候选里挑一个词法单元。
 * 返回 null 表示放弃；返回候选之外的文本会被自动机拒绝并计入重试次数。
 */
@FunctionalInterface
public interface TokenPicker {

    String pick(PickContext ctx);

    /**
     * @param expression         到目前为止已接受的表达式
     * @param state              自动机当前状态
     * @param candidates         当前可接受的文本
     * @param rejectedAtThisStep 本步已经被拒绝过的文本
     * @param step               已接受的词法单元个数
     */
    record PickContext(String expression,
                       FsmState state,
                       Set<String> candidates,
                       List<String> rejectedAtThisStep,
                       int step) {
    }
}
