package com.example.latexmath.rule;

import com.example.latexmath.model.ErrorKind;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.TokenKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static com.example.latexmath.model.FsmState.*;

/**
 * 静态转移表：(状态, 词法类别) -> 转移条目，全覆盖。
 * 没有显式定义的组合一律补成 REJECT 条目，所以任何 (state, kind) 都恰好有一个结果。
 *
 * 引擎和可能性推导都只读这张表；图表/文档工具也可以直接枚举它，不需要执行引擎。
 */
@Component
public class TransitionTable {

    private static final Set<FsmState> BODY_STATES = statesWhere(FsmState::isBody);
    private static final Set<FsmState> AWAITING_STATES = statesWhere(FsmState::isAwaitingArgument);
    private static final Set<FsmState> SCRIPT_STATES = statesWhere(FsmState::isScript);

    private final Map<FsmState, Map<TokenKind, TransitionRule>> rules = new EnumMap<>(FsmState.class);

    public TransitionTable() {
        for (FsmState s : FsmState.values()) {
            rules.put(s, new EnumMap<>(TokenKind.class));
        }

        // ========= START =========
        define(START, TokenKind.MATH_DELIMITER, TransitionAction.OPEN_MATH, EnumSet.of(MATH_MODE),
                "$ / $$ / \\[ 打开数学模式并记录开符");

        // ========= 正文态：MATH_MODE / CONTENT / MATRIX_MODE =========
        for (FsmState s : BODY_STATES) {
            define(s, TokenKind.LETTER, TransitionAction.STAY, EnumSet.of(s), "变量");
            define(s, TokenKind.DIGIT, TransitionAction.STAY, EnumSet.of(s), "数字");
            define(s, TokenKind.OPERATOR, TransitionAction.STAY, EnumSet.of(s), "运算符");
            define(s, TokenKind.OPEN_PAREN, TransitionAction.OPEN_PAREN, EnumSet.of(s), "paren_depth += 1");
            define(s, TokenKind.CLOSE_PAREN, TransitionAction.CLOSE_PAREN, EnumSet.of(s), "paren_depth -= 1，要求 > 0");
            define(s, TokenKind.OPEN_BRACKET, TransitionAction.OPEN_BRACKET, EnumSet.of(s), "bracket_depth += 1");
            define(s, TokenKind.CLOSE_BRACKET, TransitionAction.CLOSE_BRACKET, EnumSet.of(s), "bracket_depth -= 1，要求 > 0");
            define(s, TokenKind.CARET_SUP, TransitionAction.ENTER_SCRIPT, EnumSet.of(SUPERSCRIPT), "压入调用方，等待上标");
            define(s, TokenKind.UNDERSCORE_SUB, TransitionAction.ENTER_SCRIPT, EnumSet.of(SUBSCRIPT), "压入调用方，等待下标");
            define(s, TokenKind.OPEN_BRACE, TransitionAction.OPEN_GROUP, EnumSet.of(CONTENT), "brace_depth += 1，压入当前态");
            define(s, TokenKind.COMMAND, TransitionAction.DISPATCH_COMMAND,
                    EnumSet.of(s, FRACTION_NUM, COMMAND_PENDING_ARG),
                    "零参数命令停留；k 参数命令压入调用方和 k，等待第一个 {");
        }
        define(MATH_MODE, TokenKind.MATH_DELIMITER, TransitionAction.CLOSE_MATH, EnumSet.of(END),
                "与开符匹配的闭符，且深度为 0、栈为空");
        define(CONTENT, TokenKind.CLOSE_BRACE, TransitionAction.CLOSE_GROUP,
                EnumSet.of(MATH_MODE, CONTENT, MATRIX_MODE, FRACTION_DEN, COMMAND_PENDING_ARG),
                "弹出返回栈；参数分组结束时若仍欠参数则等待下一个 {");
        define(MATRIX_MODE, TokenKind.OTHER, TransitionAction.ALIGNMENT_TAB, EnumSet.of(MATRIX_MODE), "& 分列");

        // ========= 等待 {参数} =========
        for (FsmState s : AWAITING_STATES) {
            Set<FsmState> targets = s == COMMAND_PENDING_ARG
                    ? EnumSet.of(CONTENT, ENVIRONMENT_NAME)
                    : EnumSet.of(CONTENT);
            define(s, TokenKind.OPEN_BRACE, TransitionAction.OPEN_ARGUMENT, targets,
                    "brace_depth += 1，压入参数标记，消耗一个参数");
        }

        // ========= 上标 / 下标 =========
        for (FsmState s : SCRIPT_STATES) {
            Set<FsmState> back = EnumSet.copyOf(BODY_STATES);
            define(s, TokenKind.LETTER, TransitionAction.SCRIPT_OPERAND, back, "单字母操作数，回到调用方");
            define(s, TokenKind.DIGIT, TransitionAction.SCRIPT_OPERAND, back, "单数字操作数，回到调用方");
            define(s, TokenKind.COMMAND, TransitionAction.SCRIPT_OPERAND, back, "零参数命令操作数，回到调用方");
            define(s, TokenKind.OPEN_BRACE, TransitionAction.OPEN_SCRIPT_GROUP, EnumSet.of(CONTENT),
                    "brace_depth += 1，调用方帧即分组帧");
        }

        // ========= 环境名 =========
        define(ENVIRONMENT_NAME, TokenKind.LETTER, TransitionAction.ENVIRONMENT_NAME_CHAR, EnumSet.of(ENVIRONMENT_NAME),
                "保持为已知环境名的前缀");
        define(ENVIRONMENT_NAME, TokenKind.CLOSE_BRACE, TransitionAction.CLOSE_ENVIRONMENT_NAME,
                EnumSet.of(MATRIX_MODE, MATH_MODE, CONTENT),
                "\\begin 进入 MATRIX_MODE；\\end 校验并恢复 \\begin 之前的状态");

        // 其余组合补 REJECT
        for (FsmState s : FsmState.values()) {
            Map<TokenKind, TransitionRule> row = rules.get(s);
            for (TokenKind k : TokenKind.values()) {
                if (!row.containsKey(k)) {
                    row.put(k, new TransitionRule(s, k, TransitionAction.REJECT, Set.of(),
                            defaultRejection(s, k), "reject"));
                }
            }
            rules.put(s, Collections.unmodifiableMap(row));
        }
    }

    private static Set<FsmState> statesWhere(Predicate<FsmState> p) {
        Set<FsmState> out = EnumSet.noneOf(FsmState.class);
        for (FsmState s : FsmState.values()) {
            if (p.test(s)) {
                out.add(s);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private void define(FsmState from, TokenKind kind, TransitionAction action, Set<FsmState> targets, String description) {
        TransitionRule prev = rules.get(from).put(kind,
                new TransitionRule(from, kind, action, Collections.unmodifiableSet(targets), null, description));
        if (prev != null) {
            throw new IllegalArgumentException("transition defined twice: " + from + " x " + kind);
        }
    }

    /**
     * 默认拒绝原因：
     *  - OTHER -> UNKNOWN_TOKEN
     *  - 非 START/MATH_MODE/END 中出现定界符 -> UNBALANCED_DELIMITER（有东西没闭合就想结束）
     *  - 其他 -> INVALID_TRANSITION
     */
    static ErrorKind defaultRejection(FsmState state, TokenKind kind) {
        if (kind == TokenKind.OTHER) {
            return ErrorKind.UNKNOWN_TOKEN;
        }
        if (kind == TokenKind.MATH_DELIMITER && state != START && state != MATH_MODE && state != END) {
            return ErrorKind.UNBALANCED_DELIMITER;
        }
        return ErrorKind.INVALID_TRANSITION;
    }

    public TransitionRule rule(FsmState state, TokenKind kind) {
        return rules.get(state).get(kind);
    }

    /** 某个状态下所有非 REJECT 的条目 */
    public List<TransitionRule> acceptingRulesFrom(FsmState state) {
        List<TransitionRule> out = new ArrayList<>();
        for (TransitionRule r : rules.get(state).values()) {
            if (!r.isReject()) {
                out.add(r);
            }
        }
        return out;
    }

    /** 全表，按状态、类别的声明顺序 */
    public List<TransitionRule> all() {
        List<TransitionRule> out = new ArrayList<>();
        for (Map<TokenKind, TransitionRule> row : rules.values()) {
            out.addAll(row.values());
        }
        return out;
    }
}
