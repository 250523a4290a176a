package com.example.latexmath.flow;

import com.example.latexmath.model.CommandDef;
import com.example.latexmath.model.Configuration;
import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenDescriptor;
import com.example.latexmath.model.TokenKind;
import com.example.latexmath.parser.LatexTokenizer;
import com.example.latexmath.rule.CommandRegistry;
import com.example.latexmath.rule.TransitionRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 给定配置，列出当前可以接受的下一个词法单元。
 *
 * 不另写一份规则：对当前状态下转移表里每个非 REJECT 条目，把该类别的候选文本
 * 逐个交给 TransitionEngine 试走一步（在副本上），接受的才返回。
 * 所以这里给出的任何文本，喂给 process_token 都一定会被接受。
 */
@Component
public class PossibilityOracle {

    private static final List<String> DELIMITERS = List.of("$", "$$", "\\[", "\\]");

    private final TransitionEngine engine;
    private final CommandRegistry registry;

    /** 每种类别的候选文本；COMMAND 另外按注册表枚举 */
    private final Map<TokenKind, List<String>> vocabulary;

    /** 注册表中各参数个数的命令数，用于判断是否“全部可接受” */
    private final Map<Integer, Integer> commandsPerArity = new HashMap<>();

    public PossibilityOracle(TransitionEngine engine, CommandRegistry registry) {
        this.engine = engine;
        this.registry = registry;
        this.vocabulary = buildVocabulary();
        for (CommandDef def : registry.all()) {
            commandsPerArity.merge(def.arity(), 1, Integer::sum);
        }
    }

    private static Map<TokenKind, List<String>> buildVocabulary() {
        Map<TokenKind, List<String>> v = new HashMap<>();
        List<String> letters = new ArrayList<>();
        for (char c = 'a'; c <= 'z'; c++) {
            letters.add(String.valueOf(c));
        }
        for (char c = 'A'; c <= 'Z'; c++) {
            letters.add(String.valueOf(c));
        }
        List<String> digits = new ArrayList<>();
        for (char c = '0'; c <= '9'; c++) {
            digits.add(String.valueOf(c));
        }
        List<String> operators = new ArrayList<>();
        for (char c : LatexTokenizer.OPERATORS.toCharArray()) {
            operators.add(String.valueOf(c));
        }
        v.put(TokenKind.MATH_DELIMITER, DELIMITERS);
        v.put(TokenKind.LETTER, Collections.unmodifiableList(letters));
        v.put(TokenKind.DIGIT, Collections.unmodifiableList(digits));
        v.put(TokenKind.OPERATOR, Collections.unmodifiableList(operators));
        v.put(TokenKind.OPEN_BRACE, List.of("{"));
        v.put(TokenKind.CLOSE_BRACE, List.of("}"));
        v.put(TokenKind.OPEN_BRACKET, List.of("["));
        v.put(TokenKind.CLOSE_BRACKET, List.of("]"));
        v.put(TokenKind.OPEN_PAREN, List.of("("));
        v.put(TokenKind.CLOSE_PAREN, List.of(")"));
        v.put(TokenKind.CARET_SUP, List.of("^"));
        v.put(TokenKind.UNDERSCORE_SUB, List.of("_"));
        // OTHER 里只有矩阵的 & 会被接受
        v.put(TokenKind.OTHER, List.of("&"));
        return v;
    }

    public Set<TokenDescriptor> possibilities(Configuration cfg) {
        Set<TokenDescriptor> out = new LinkedHashSet<>();
        for (TransitionRule rule : engine.getTable().acceptingRulesFrom(cfg.getState())) {
            if (rule.kind() == TokenKind.COMMAND) {
                addCommands(cfg, out);
                continue;
            }
            for (String literal : vocabulary.get(rule.kind())) {
                if (engine.step(cfg, new Token(rule.kind(), literal)).accepted()) {
                    out.add(TokenDescriptor.literal(rule.kind(), literal));
                }
            }
        }
        return out;
    }

    private void addCommands(Configuration cfg, Set<TokenDescriptor> out) {
        Map<Integer, Integer> accepted = new HashMap<>();
        for (CommandDef def : registry.all()) {
            if (engine.step(cfg, new Token(TokenKind.COMMAND, def.literal())).accepted()) {
                out.add(TokenDescriptor.command(def.literal(), def.arity()));
                accepted.merge(def.arity(), 1, Integer::sum);
            }
        }
        for (Map.Entry<Integer, Integer> e : accepted.entrySet()) {
            if (e.getValue().equals(commandsPerArity.get(e.getKey()))) {
                out.add(TokenDescriptor.anyCommand(e.getKey()));
            }
        }
    }

    /** 只要具体文本（命令逐个展开），给生成方直接用 */
    public Set<String> possibleLiterals(Configuration cfg) {
        Set<String> out = new LinkedHashSet<>();
        for (TokenDescriptor d : possibilities(cfg)) {
            if (d.isLiteral()) {
                out.add(d.literal());
            }
        }
        return out;
    }
}
