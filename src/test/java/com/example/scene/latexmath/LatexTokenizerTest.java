package com.example.scene.latexmath;

import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenKind;
import com.example.latexmath.parser.LatexTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LatexTokenizerTest {

    private final LatexTokenizer tokenizer = new LatexTokenizer();

    private static List<String> literals(List<Token> tokens) {
        return tokens.stream().map(Token::literal).toList();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    void controlWordIsOneToken() {
        List<Token> tokens = tokenizer.tokenize("$\\frac{a}{b}$");
        assertEquals(List.of("$", "\\frac", "{", "a", "}", "{", "b", "}", "$"), literals(tokens));
        assertEquals(TokenKind.COMMAND, tokens.get(1).kind());
        assertEquals("frac", tokens.get(1).commandName());
    }

    @Test
    void doubleDollarIsGreedy() {
        List<Token> tokens = tokenizer.tokenize("$$x$$");
        assertEquals(List.of("$$", "x", "$$"), literals(tokens));
        assertEquals(TokenKind.MATH_DELIMITER, tokens.get(0).kind());
        assertEquals(TokenKind.MATH_DELIMITER, tokens.get(2).kind());

        // 三个 $：先贪心取 $$，再剩一个 $
        assertEquals(List.of("$$", "$"), literals(tokenizer.tokenize("$$$")));
    }

    @Test
    void displayBracketsAreDelimitersOtherEscapesAreCommands() {
        List<Token> tokens = tokenizer.tokenize("\\[ \\{ \\, \\\\ \\]");
        assertEquals(List.of("\\[", "\\{", "\\,", "\\\\", "\\]"), literals(tokens));
        assertEquals(List.of(TokenKind.MATH_DELIMITER, TokenKind.COMMAND, TokenKind.COMMAND,
                TokenKind.COMMAND, TokenKind.MATH_DELIMITER), kinds(tokens));
        assertEquals("\\", tokens.get(3).commandName());
    }

    @Test
    void singleCharacterClasses() {
        List<Token> tokens = tokenizer.tokenize("a7+{}[]()^_&");
        assertEquals(List.of(TokenKind.LETTER, TokenKind.DIGIT, TokenKind.OPERATOR,
                TokenKind.OPEN_BRACE, TokenKind.CLOSE_BRACE,
                TokenKind.OPEN_BRACKET, TokenKind.CLOSE_BRACKET,
                TokenKind.OPEN_PAREN, TokenKind.CLOSE_PAREN,
                TokenKind.CARET_SUP, TokenKind.UNDERSCORE_SUB,
                TokenKind.OTHER), kinds(tokens));
    }

    @Test
    void whitespaceIsSkipped() {
        assertEquals(List.of("$", "x", "+", "y", "$"), literals(tokenizer.tokenize(" $x  +\ty\n$ ")));
        assertTrue(tokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void unknownCharactersBecomeOther() {
        List<Token> tokens = tokenizer.tokenize("#%é𝑥\\");
        assertEquals(5, tokens.size());
        for (Token t : tokens) {
            assertEquals(TokenKind.OTHER, t.kind());
        }
        // 补充平面字符保持为一个单元
        assertEquals("𝑥", tokens.get(3).literal());
        assertEquals("\\", tokens.get(4).literal());
    }

    @Test
    void escapedDollarIsNotADelimiter() {
        List<Token> tokens = tokenizer.tokenize("\\$");
        assertEquals(1, tokens.size());
        assertEquals(TokenKind.COMMAND, tokens.get(0).kind());
        assertEquals("$", tokens.get(0).commandName());
    }

    @Test
    void tokenizingIsPure() {
        String input = "$\\sum_{i=1}^{n} \\alpha_i x^{2}$";
        assertEquals(tokenizer.tokenize(input), tokenizer.tokenize(input));
    }

    @Test
    void joinKeepsTokenBoundaries() {
        List<Token> tokens = List.of(
                new Token(TokenKind.MATH_DELIMITER, "$"),
                new Token(TokenKind.COMMAND, "\\alpha"),
                new Token(TokenKind.LETTER, "b"),
                new Token(TokenKind.COMMAND, "\\,"),
                new Token(TokenKind.LETTER, "c"),
                new Token(TokenKind.MATH_DELIMITER, "$"));
        String joined = tokenizer.join(tokens);
        assertEquals("$\\alpha b\\,c$", joined);
        assertEquals(tokens, tokenizer.tokenize(joined));

        List<Token> empty = List.of(new Token(TokenKind.MATH_DELIMITER, "$"), new Token(TokenKind.MATH_DELIMITER, "$"));
        assertEquals(empty, tokenizer.tokenize(tokenizer.join(empty)));
    }
}
