package com.example.latexmath.service;

import com.example.latexmath.config.LatexFsmProperties;
import com.example.latexmath.flow.LatexMathValidator;
import com.example.latexmath.flow.LatexMathValidatorFactory;
import com.example.latexmath.model.TraceStep;
import com.example.latexmath.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 校验主流程：每次调用新建一个校验器 -> 校验 -> 记日志 -> （可选）归档。
 */
@Service
public class LatexValidationService {

    private static final Logger log = LoggerFactory.getLogger(LatexValidationService.class);

    private final LatexMathValidatorFactory validatorFactory;
    private final ValidationArchiveService archiveService;
    private final LatexFsmProperties props;

    public LatexValidationService(LatexMathValidatorFactory validatorFactory,
                                  ValidationArchiveService archiveService,
                                  LatexFsmProperties props) {
        this.validatorFactory = validatorFactory;
        this.archiveService = archiveService;
        this.props = props;
    }

    public ValidationResult validate(String latex) {
        LatexMathValidator validator = validatorFactory.create();
        ValidationResult result = validator.validate(latex);

        if (log.isDebugEnabled()) {
            for (TraceStep step : result.getTrace()) {
                log.debug("step={} token={} {} -> {} accepted={}",
                        step.index(), step.token().literal(), step.before(), step.after(), step.accepted());
            }
        }

        if (result.isValid()) {
            log.info("LaTeX valid. input={}, tokens={}", latex, result.getTokenCount());
        } else {
            log.info("LaTeX invalid. input={}, error={}, failingIndex={}, failingToken={}, state={}",
                    latex, result.getError(), result.getFailingIndex(),
                    result.getFailingToken() == null ? "<end of input>" : result.getFailingToken().literal(),
                    result.getFinalState());
        }

        if (props.isArchiveEnabled()) {
            archiveService.archive(result);
        }
        return result;
    }

    public List<ValidationResult> validateAll(List<String> inputs) {
        List<ValidationResult> results = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            results.add(validate(input));
        }
        return results;
    }
}
