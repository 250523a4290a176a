package com.example.latexmath.flow;

import com.example.latexmath.config.LatexFsmProperties;
import com.example.latexmath.parser.LatexTokenizer;
import org.springframework.stereotype.Component;

/**
 * 校验器有独占的可变状态，不能做成单例；这里按请求创建，
 * 共享的只是只读的注册表、转移表和无状态的引擎。
 */
@Component
public class LatexMathValidatorFactory {

    private final LatexTokenizer tokenizer;
    private final TransitionEngine engine;
    private final PossibilityOracle oracle;
    private final LatexFsmProperties props;

    public LatexMathValidatorFactory(LatexTokenizer tokenizer,
                                     TransitionEngine engine,
                                     PossibilityOracle oracle,
                                     LatexFsmProperties props) {
        this.tokenizer = tokenizer;
        this.engine = engine;
        this.oracle = oracle;
        this.props = props;
    }

    public LatexMathValidator create() {
        return new LatexMathValidator(tokenizer, engine, oracle, props.isRecordTrace());
    }
}
