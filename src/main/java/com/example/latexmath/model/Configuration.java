package com.example.latexmath.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 自动机的完整可变状态。
 * 由一个 Driver 独占；转移引擎只在副本上改动，接受后才整体替换。
 */
@Getter
@Setter
public class Configuration {

    private FsmState state = FsmState.START;

    private int braceDepth;
    private int bracketDepth;
    private int parenDepth;

    /** 分组闭合到自身零深度时要恢复的状态；参数分组压入的是等待态本身 */
    private final Deque<FsmState> returnStack = new ArrayDeque<>();

    /** 多参数命令尚欠的参数个数 */
    private final Deque<PendingArity> pendingArityStack = new ArrayDeque<>();

    /** 已打开、尚未 \end 的环境名 */
    private final Deque<String> environmentStack = new ArrayDeque<>();

    /** ENVIRONMENT_NAME 中已读到的环境名前缀 */
    private String environmentName = "";

    /** START 时用的开符 */
    private MathDelimiter openedDelimiter;

    /** 上一个接受的词法单元是大型运算符（\limits 只能跟在它后面） */
    private boolean afterBigOperator;

    public static Configuration initial() {
        return new Configuration();
    }

    public Configuration copy() {
        Configuration c = new Configuration();
        c.state = state;
        c.braceDepth = braceDepth;
        c.bracketDepth = bracketDepth;
        c.parenDepth = parenDepth;
        c.returnStack.addAll(returnStack);
        c.pendingArityStack.addAll(pendingArityStack);
        c.environmentStack.addAll(environmentStack);
        c.environmentName = environmentName;
        c.openedDelimiter = openedDelimiter;
        c.afterBigOperator = afterBigOperator;
        return c;
    }

    /** 所有深度计数为 0，所有栈为空 */
    public boolean isBalanced() {
        return braceDepth == 0
                && bracketDepth == 0
                && parenDepth == 0
                && returnStack.isEmpty()
                && pendingArityStack.isEmpty()
                && environmentStack.isEmpty()
                && environmentName.isEmpty();
    }

    public boolean isComplete() {
        return state == FsmState.END && isBalanced();
    }

    /** 栈顶在前 */
    public List<FsmState> returnStackView() {
        return List.copyOf(returnStack);
    }

    public List<PendingArity> pendingArityView() {
        return List.copyOf(pendingArityStack);
    }

    public List<String> environmentStackView() {
        return List.copyOf(environmentStack);
    }

    /** 按值比较，用于确定性校验（重放同一序列得到相同配置） */
    public boolean sameAs(Configuration o) {
        if (o == null) {
            return false;
        }
        return state == o.state
                && braceDepth == o.braceDepth
                && bracketDepth == o.bracketDepth
                && parenDepth == o.parenDepth
                && afterBigOperator == o.afterBigOperator
                && openedDelimiter == o.openedDelimiter
                && environmentName.equals(o.environmentName)
                && returnStackView().equals(o.returnStackView())
                && pendingArityView().equals(o.pendingArityView())
                && environmentStackView().equals(o.environmentStackView());
    }

    @Override
    public String toString() {
        return "Configuration{" +
                "state=" + state +
                ", braceDepth=" + braceDepth +
                ", bracketDepth=" + bracketDepth +
                ", parenDepth=" + parenDepth +
                ", returnStack=" + returnStack +
                ", pendingArityStack=" + pendingArityStack +
                ", environmentStack=" + environmentStack +
                ", environmentName='" + environmentName + '\'' +
                ", openedDelimiter=" + openedDelimiter +
                '}';
    }
}
