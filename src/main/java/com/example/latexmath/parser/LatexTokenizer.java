package com.example.latexmath.parser;

import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * LaTeX 数学表达式分词：
 *  - \ + 连续 ASCII 字母 -> 一个 COMMAND（\frac、\alpha）
 *  - \[ / \] -> MATH_DELIMITER；\ + 其他单个字符 -> COMMAND（\{、\,、\\）
 *  - $$ 贪心匹配为一个 MATH_DELIMITER，单个 $ 也是 MATH_DELIMITER
 *  - 空白跳过，其余每个字符单独成一个词法单元，认不出的是 OTHER
 *
 * 纯函数，不做拒绝，拒绝留给状态机。
 */
@Component
public class LatexTokenizer {

    /** 单字符运算符，可能性推导也按这份列举 */
    public static final String OPERATORS = "+-=<>*/!?.,;:'|";

    public List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();

        while (i < n) {
            int cp = text.codePointAt(i);
            int width = Character.charCount(cp);

            if (Character.isWhitespace(cp)) {
                i += width;
                continue;
            }

            if (cp == '\\') {
                int j = i + 1;
                if (j >= n) {
                    // 结尾孤立的反斜杠
                    tokens.add(new Token(TokenKind.OTHER, "\\"));
                    i = j;
                    continue;
                }
                if (isAsciiLetter(text.charAt(j))) {
                    while (j < n && isAsciiLetter(text.charAt(j))) {
                        j++;
                    }
                    tokens.add(new Token(TokenKind.COMMAND, text.substring(i, j)));
                    i = j;
                    continue;
                }
                int next = text.codePointAt(j);
                int end = j + Character.charCount(next);
                String literal = text.substring(i, end);
                if (next == '[' || next == ']') {
                    tokens.add(new Token(TokenKind.MATH_DELIMITER, literal));
                } else {
                    tokens.add(new Token(TokenKind.COMMAND, literal));
                }
                i = end;
                continue;
            }

            if (cp == '$') {
                if (i + 1 < n && text.charAt(i + 1) == '$') {
                    tokens.add(new Token(TokenKind.MATH_DELIMITER, "$$"));
                    i += 2;
                } else {
                    tokens.add(new Token(TokenKind.MATH_DELIMITER, "$"));
                    i += 1;
                }
                continue;
            }

            tokens.add(new Token(classify(cp), text.substring(i, i + width)));
            i += width;
        }
        return Collections.unmodifiableList(tokens);
    }

    /** 单个字符（非反斜杠、非 $）的类别 */
    public TokenKind classify(int cp) {
        if (cp < 128 && isAsciiLetter((char) cp)) {
            return TokenKind.LETTER;
        }
        if (cp >= '0' && cp <= '9') {
            return TokenKind.DIGIT;
        }
        return switch (cp) {
            case '{' -> TokenKind.OPEN_BRACE;
            case '}' -> TokenKind.CLOSE_BRACE;
            case '[' -> TokenKind.OPEN_BRACKET;
            case ']' -> TokenKind.CLOSE_BRACKET;
            case '(' -> TokenKind.OPEN_PAREN;
            case ')' -> TokenKind.CLOSE_PAREN;
            case '^' -> TokenKind.CARET_SUP;
            case '_' -> TokenKind.UNDERSCORE_SUB;
            default -> (cp < 128 && OPERATORS.indexOf(cp) >= 0) ? TokenKind.OPERATOR : TokenKind.OTHER;
        };
    }

    /**
     * 把一串词法单元拼回文本，保证 tokenize(join(tokens)) 得到同样的序列：
     * 控制字后面紧跟字母时补一个空格，相邻两个 $ 之间补一个空格。
     */
    public String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : tokens) {
            if (prev != null && needsSeparator(prev, t)) {
                sb.append(' ');
            }
            sb.append(t.literal());
            prev = t;
        }
        return sb.toString();
    }

    private boolean needsSeparator(Token prev, Token next) {
        if (prev.kind() == TokenKind.COMMAND && isControlWord(prev.literal())
                && !next.literal().isEmpty() && isAsciiLetter(next.literal().charAt(0))) {
            return true;
        }
        return "$".equals(prev.literal()) && next.literal().startsWith("$");
    }

    private static boolean isControlWord(String literal) {
        return literal.length() > 1 && isAsciiLetter(literal.charAt(1));
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
