package com.example.latexmath.service;

import com.example.latexmath.model.ValidationResult;
import com.example.latexmath.util.TracePrinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 命令行入口：
 *   java -jar latex-math-fsm.jar '$x^2$' '$\frac{a}{b}$'
 *   java -jar latex-math-fsm.jar --export-table
 * 没有参数时什么也不做（测试启动上下文时也是这样）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationCommandLineRunner implements ApplicationRunner {

    private final LatexValidationService validationService;
    private final TransitionTableExporter exporter;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("export-table")) {
            exporter.export();
        }
        for (String input : args.getNonOptionArgs()) {
            ValidationResult result = validationService.validate(input);
            log.info("\n{}", TracePrinter.prettyPrint(result));
        }
    }
}
