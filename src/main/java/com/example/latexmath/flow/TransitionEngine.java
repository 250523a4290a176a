package com.example.latexmath.flow;

import com.example.latexmath.model.CommandCategory;
import com.example.latexmath.model.CommandDef;
import com.example.latexmath.model.Configuration;
import com.example.latexmath.model.ErrorKind;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.MathDelimiter;
import com.example.latexmath.model.PendingArity;
import com.example.latexmath.model.StepResult;
import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenKind;
import com.example.latexmath.rule.CommandRegistry;
import com.example.latexmath.rule.TransitionRule;
import com.example.latexmath.rule.TransitionTable;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 转移函数本体：(配置, 词法单元) -> 接受并给出新配置 / 拒绝并给出原因。
 *
 * 无状态，线程安全：每一步都在副本上改，接受后由调用方整体替换，
 * 拒绝时调用方手里的配置保持不动。
 */
@Component
public class TransitionEngine {

    private final TransitionTable table;
    private final CommandRegistry registry;

    public TransitionEngine(TransitionTable table, CommandRegistry registry) {
        this.table = table;
        this.registry = registry;
    }

    public TransitionTable getTable() {
        return table;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public StepResult step(Configuration current, Token token) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(token, "token");

        FsmState before = current.getState();
        TransitionRule rule = table.rule(before, token.kind());
        if (rule.isReject()) {
            return StepResult.reject(before, rule.error());
        }

        Configuration next = current.copy();
        ErrorKind error = apply(rule, next, token);
        if (error != null) {
            return StepResult.reject(before, error);
        }
        if (!rule.targets().contains(next.getState())) {
            // 表和引擎对不上，属于实现错误
            throw new IllegalStateException("transition " + before + " x " + token.kind()
                    + " reached " + next.getState() + ", table allows " + rule.targets());
        }
        return StepResult.accept(before, next);
    }

    /** 在 c 上执行动作；返回 null 表示接受，否则为拒绝原因（此时 c 作废） */
    private ErrorKind apply(TransitionRule rule, Configuration c, Token token) {
        boolean afterBigOperator = c.isAfterBigOperator();
        c.setAfterBigOperator(false);

        return switch (rule.action()) {
            case OPEN_MATH -> openMath(c, token);
            case CLOSE_MATH -> closeMath(c, token);
            case STAY -> null;
            case OPEN_PAREN -> {
                c.setParenDepth(c.getParenDepth() + 1);
                yield null;
            }
            case CLOSE_PAREN -> {
                if (c.getParenDepth() == 0) {
                    yield ErrorKind.UNBALANCED_DELIMITER;
                }
                c.setParenDepth(c.getParenDepth() - 1);
                yield null;
            }
            case OPEN_BRACKET -> {
                c.setBracketDepth(c.getBracketDepth() + 1);
                yield null;
            }
            case CLOSE_BRACKET -> {
                if (c.getBracketDepth() == 0) {
                    yield ErrorKind.UNBALANCED_DELIMITER;
                }
                c.setBracketDepth(c.getBracketDepth() - 1);
                yield null;
            }
            case ENTER_SCRIPT -> {
                c.getReturnStack().push(c.getState());
                c.setState(token.kind() == TokenKind.CARET_SUP ? FsmState.SUPERSCRIPT : FsmState.SUBSCRIPT);
                yield null;
            }
            case OPEN_GROUP -> {
                c.setBraceDepth(c.getBraceDepth() + 1);
                c.getReturnStack().push(c.getState());
                c.setState(FsmState.CONTENT);
                yield null;
            }
            case CLOSE_GROUP -> closeGroup(c);
            case DISPATCH_COMMAND -> dispatchCommand(c, token, afterBigOperator);
            case OPEN_ARGUMENT -> openArgument(c);
            case SCRIPT_OPERAND -> scriptOperand(c, token);
            case OPEN_SCRIPT_GROUP -> {
                // ^ / _ 时压入的调用方帧直接作为这个分组的返回帧
                c.setBraceDepth(c.getBraceDepth() + 1);
                c.setState(FsmState.CONTENT);
                yield null;
            }
            case ALIGNMENT_TAB -> "&".equals(token.literal()) ? null : ErrorKind.UNKNOWN_TOKEN;
            case ENVIRONMENT_NAME_CHAR -> environmentNameChar(c, token);
            case CLOSE_ENVIRONMENT_NAME -> closeEnvironmentName(c);
            case REJECT -> rule.error();
        };
    }

    private ErrorKind openMath(Configuration c, Token token) {
        MathDelimiter d = MathDelimiter.fromOpener(token.literal());
        if (d == null) {
            // \] 不能作为开符
            return ErrorKind.INVALID_TRANSITION;
        }
        c.setOpenedDelimiter(d);
        c.setState(FsmState.MATH_MODE);
        return null;
    }

    private ErrorKind closeMath(Configuration c, Token token) {
        String literal = token.literal();
        if (!MathDelimiter.isCloser(literal)) {
            // 数学模式里再出现 \[
            return ErrorKind.INVALID_TRANSITION;
        }
        if (c.getOpenedDelimiter() == null || !c.getOpenedDelimiter().getCloser().equals(literal)) {
            return ErrorKind.DELIMITER_MISMATCH;
        }
        if (!c.isBalanced()) {
            return ErrorKind.UNBALANCED_DELIMITER;
        }
        c.setState(FsmState.END);
        return null;
    }

    private ErrorKind closeGroup(Configuration c) {
        if (c.getBraceDepth() == 0 || c.getReturnStack().isEmpty()) {
            return ErrorKind.UNBALANCED_DELIMITER;
        }
        FsmState frame = c.getReturnStack().pop();
        c.setBraceDepth(c.getBraceDepth() - 1);

        if (!frame.isAwaitingArgument()) {
            c.setState(frame);
            return null;
        }

        // 参数分组结束
        PendingArity pending = c.getPendingArityStack().peek();
        if (pending == null) {
            return ErrorKind.UNBALANCED_DELIMITER;
        }
        if (pending.remaining() > 0) {
            c.setState(frame == FsmState.FRACTION_NUM ? FsmState.FRACTION_DEN : FsmState.COMMAND_PENDING_ARG);
            return null;
        }
        c.getPendingArityStack().pop();
        c.setState(c.getReturnStack().pop());
        return null;
    }

    private ErrorKind dispatchCommand(Configuration c, Token token, boolean afterBigOperator) {
        CommandDef def = registry.get(token.commandName());
        if (def == null) {
            return ErrorKind.UNKNOWN_COMMAND;
        }
        FsmState state = c.getState();

        switch (def.category()) {
            case LIMITS_MODIFIER -> {
                return afterBigOperator ? null : ErrorKind.INVALID_TRANSITION;
            }
            case ROW_SEPARATOR -> {
                return state == FsmState.MATRIX_MODE ? null : ErrorKind.INVALID_TRANSITION;
            }
            case BIG_OPERATOR -> {
                c.setAfterBigOperator(true);
                return null;
            }
            case ENVIRONMENT -> {
                if ("end".equals(def.name()) && state != FsmState.MATRIX_MODE) {
                    return ErrorKind.INVALID_TRANSITION;
                }
            }
            default -> {
            }
        }

        if (def.arity() == 0) {
            return null;
        }
        c.getReturnStack().push(state);
        c.getPendingArityStack().push(new PendingArity(def.name(), def.arity()));
        c.setState(def.category() == CommandCategory.FRACTION ? FsmState.FRACTION_NUM : FsmState.COMMAND_PENDING_ARG);
        return null;
    }

    private ErrorKind openArgument(Configuration c) {
        PendingArity pending = c.getPendingArityStack().peek();
        if (pending == null || pending.remaining() <= 0) {
            return ErrorKind.INVALID_TRANSITION;
        }
        c.setBraceDepth(c.getBraceDepth() + 1);
        c.getReturnStack().push(c.getState());
        c.getPendingArityStack().pop();
        c.getPendingArityStack().push(pending.consumeOne());

        if (isEnvironmentCommand(pending.command())) {
            c.setEnvironmentName("");
            c.setState(FsmState.ENVIRONMENT_NAME);
        } else {
            c.setState(FsmState.CONTENT);
        }
        return null;
    }

    private ErrorKind scriptOperand(Configuration c, Token token) {
        if (token.kind() == TokenKind.COMMAND) {
            CommandDef def = registry.get(token.commandName());
            if (def == null) {
                return ErrorKind.UNKNOWN_COMMAND;
            }
            if (def.arity() != 0
                    || def.category() == CommandCategory.LIMITS_MODIFIER
                    || def.category() == CommandCategory.ROW_SEPARATOR) {
                return ErrorKind.INVALID_TRANSITION;
            }
        }
        if (c.getReturnStack().isEmpty()) {
            return ErrorKind.INVALID_TRANSITION;
        }
        c.setState(c.getReturnStack().pop());
        return null;
    }

    private ErrorKind environmentNameChar(Configuration c, Token token) {
        PendingArity pending = c.getPendingArityStack().peek();
        if (pending == null) {
            return ErrorKind.INVALID_TRANSITION;
        }
        String candidate = c.getEnvironmentName() + token.literal();
        if ("begin".equals(pending.command())) {
            if (!registry.isEnvironmentPrefix(candidate)) {
                return ErrorKind.UNKNOWN_COMMAND;
            }
        } else {
            String open = c.getEnvironmentStack().peek();
            if (open == null || !open.startsWith(candidate)) {
                return ErrorKind.DELIMITER_MISMATCH;
            }
        }
        c.setEnvironmentName(candidate);
        return null;
    }

    private ErrorKind closeEnvironmentName(Configuration c) {
        PendingArity pending = c.getPendingArityStack().peek();
        if (pending == null || c.getReturnStack().isEmpty()) {
            return ErrorKind.INVALID_TRANSITION;
        }
        String name = c.getEnvironmentName();
        boolean begin = "begin".equals(pending.command());
        if (begin && !registry.isEnvironment(name)) {
            return ErrorKind.UNKNOWN_COMMAND;
        }
        if (!begin && !name.equals(c.getEnvironmentStack().peek())) {
            return ErrorKind.DELIMITER_MISMATCH;
        }

        // 弹出参数标记和 pending
        c.getReturnStack().pop();
        c.setBraceDepth(c.getBraceDepth() - 1);
        c.getPendingArityStack().pop();
        c.setEnvironmentName("");

        if (begin) {
            // \begin 的调用方留在栈上，等 \end 时恢复
            c.getEnvironmentStack().push(name);
            c.setState(FsmState.MATRIX_MODE);
            return null;
        }

        // \end 的调用方（MATRIX_MODE）和 \begin 的调用方
        c.getEnvironmentStack().pop();
        c.getReturnStack().pop();
        if (c.getReturnStack().isEmpty()) {
            return ErrorKind.UNBALANCED_DELIMITER;
        }
        c.setState(c.getReturnStack().pop());
        return null;
    }

    private boolean isEnvironmentCommand(String name) {
        CommandDef def = registry.get(name);
        return def != null && def.category() == CommandCategory.ENVIRONMENT;
    }
}
