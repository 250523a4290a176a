package com.example.latexmath.service;

import com.example.latexmath.config.LatexFsmProperties;
import com.example.latexmath.flow.LatexMathValidator;
import com.example.latexmath.flow.LatexMathValidatorFactory;
import com.example.latexmath.model.GenerationResult;
import com.example.latexmath.model.GenerationStatus;
import com.example.latexmath.model.Token;
import com.example.latexmath.parser.LatexTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 受约束生成会话：reset -> possibilities -> 生成方挑一个 -> process_token，直到表达式完整。
 * 重试/放弃策略都由 TokenPicker 一侧决定，这里只负责计数和收尾。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConstrainedGenerationService {

    private final LatexMathValidatorFactory validatorFactory;
    private final LatexTokenizer tokenizer;
    private final LatexFsmProperties props;

    public GenerationResult generate(TokenPicker picker) {
        LatexMathValidator validator = validatorFactory.create();
        validator.reset();

        List<Token> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        List<String> rejectedAtStep = new ArrayList<>();

        while (accepted.size() < props.getMaxGenerationSteps()) {
            if (validator.isComplete()) {
                return finish(GenerationStatus.COMPLETED, accepted, rejected, true);
            }

            Set<String> candidates = validator.possibleLiterals();
            TokenPicker.PickContext ctx = new TokenPicker.PickContext(
                    tokenizer.join(accepted),
                    validator.getState(),
                    candidates,
                    List.copyOf(rejectedAtStep),
                    accepted.size());

            String choice = picker.pick(ctx);
            if (choice == null) {
                return finish(GenerationStatus.PICKER_GAVE_UP, accepted, rejected, false);
            }

            List<Token> tokens = tokenizer.tokenize(choice);
            if (tokens.size() != 1) {
                log.debug("Picker proposal rejected. step={}, choice={}, state={}, reason=not a single token ({} tokens)",
                        accepted.size(), choice, validator.getState(), tokens.size());
            } else if (validator.processToken(tokens.get(0))) {
                accepted.add(tokens.get(0));
                rejectedAtStep.clear();
                continue;
            } else {
                log.debug("Picker proposal rejected. step={}, choice={}, state={}, error={}",
                        accepted.size(), choice, validator.getState(), validator.getLastError());
            }
            rejected.add(choice);
            rejectedAtStep.add(choice);
            if (rejectedAtStep.size() > props.getMaxRetriesPerStep()) {
                return finish(GenerationStatus.RETRIES_EXHAUSTED, accepted, rejected, false);
            }
        }

        boolean complete = validator.isComplete();
        return finish(complete ? GenerationStatus.COMPLETED : GenerationStatus.STEP_LIMIT_REACHED,
                accepted, rejected, complete);
    }

    private GenerationResult finish(GenerationStatus status,
                                    List<Token> accepted,
                                    List<String> rejected,
                                    boolean complete) {
        String expression = tokenizer.join(accepted);
        log.info("Generation finished. status={}, tokens={}, rejected={}, expression={}",
                status, accepted.size(), rejected.size(), expression);
        return new GenerationResult(status, expression, List.copyOf(accepted), List.copyOf(rejected), complete);
    }
}
