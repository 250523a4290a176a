package com.example.latexmath.flow;

import com.example.latexmath.model.Configuration;
import com.example.latexmath.model.ErrorKind;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.StepResult;
import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenDescriptor;
import com.example.latexmath.model.TraceStep;
import com.example.latexmath.model.ValidationResult;
import com.example.latexmath.parser.LatexTokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 校验驱动：独占一份 Configuration，把词法单元逐个喂给转移引擎。
 *
 * 不是单例，每个请求/每次生成各用一个实例；不做 I/O，不打日志。
 */
public class LatexMathValidator {

    private final LatexTokenizer tokenizer;
    private final TransitionEngine engine;
    private final PossibilityOracle oracle;
    private final boolean recordTrace;

    private Configuration configuration = Configuration.initial();
    private final List<TraceStep> trace = new ArrayList<>();

    /** reset 之后送进来的词法单元个数（含被拒绝的） */
    private int position;
    private ErrorKind lastError;

    public LatexMathValidator(LatexTokenizer tokenizer,
                              TransitionEngine engine,
                              PossibilityOracle oracle,
                              boolean recordTrace) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.recordTrace = recordTrace;
    }

    public void reset() {
        configuration = Configuration.initial();
        trace.clear();
        position = 0;
        lastError = null;
    }

    /**
     * 走一步。拒绝时返回 false，配置保持在上一次接受之后的样子。
     */
    public boolean processToken(Token token) {
        StepResult r = engine.step(configuration, token);
        if (recordTrace) {
            trace.add(new TraceStep(position, token, r.before(), r.after(), r.accepted(), r.error()));
        }
        position++;
        if (!r.accepted()) {
            lastError = r.error();
            return false;
        }
        configuration = r.next();
        lastError = null;
        return true;
    }

    /**
     * 按文本走一步，文本必须恰好是一个词法单元；纯空白视为空操作。
     */
    public boolean processToken(String literal) {
        List<Token> tokens = tokenizer.tokenize(literal);
        if (tokens.isEmpty()) {
            return true;
        }
        if (tokens.size() != 1) {
            lastError = ErrorKind.INVALID_TRANSITION;
            return false;
        }
        return processToken(tokens.get(0));
    }

    public boolean processInput(String text) {
        return validate(text).isValid();
    }

    /**
     * 分词、reset、逐个喂入，直到被拒绝或者喂完。
     * 失败时带上第一个失败位置和那一刻可接受的文本集合。
     */
    public ValidationResult validate(String text) {
        List<Token> tokens = tokenizer.tokenize(text);
        reset();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!processToken(token)) {
                return new ValidationResult(text, false, tokens.size(), configuration.getState(),
                        i, token, lastError, possibleLiterals(), traceSnapshot());
            }
        }

        if (!isComplete()) {
            // 所有词法单元都接受了，但没有闭合
            lastError = ErrorKind.UNBALANCED_DELIMITER;
            return new ValidationResult(text, false, tokens.size(), configuration.getState(),
                    tokens.size(), null, lastError, possibleLiterals(), traceSnapshot());
        }
        return new ValidationResult(text, true, tokens.size(), configuration.getState(),
                -1, null, null, Set.of(), traceSnapshot());
    }

    public boolean isComplete() {
        return configuration.isComplete();
    }

    public Set<TokenDescriptor> possibilities() {
        return oracle.possibilities(configuration);
    }

    public Set<String> possibleLiterals() {
        return oracle.possibleLiterals(configuration);
    }

    public FsmState getState() {
        return configuration.getState();
    }

    /** 当前配置的副本，外部改不到内部状态 */
    public Configuration configuration() {
        return configuration.copy();
    }

    public List<TraceStep> trace() {
        return traceSnapshot();
    }

    public ErrorKind getLastError() {
        return lastError;
    }

    public int getPosition() {
        return position;
    }

    private List<TraceStep> traceSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(trace));
    }
}
