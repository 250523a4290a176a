package com.example.scene.latexmath;

import com.example.latexmath.flow.TransitionEngine;
import com.example.latexmath.model.Configuration;
import com.example.latexmath.model.ErrorKind;
import com.example.latexmath.model.FsmState;
import com.example.latexmath.model.StepResult;
import com.example.latexmath.model.Token;
import com.example.latexmath.model.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransitionEngineTest {

    private final TransitionEngine engine = FsmFixtures.ENGINE;

    /** 依次接受，任何一步被拒绝都直接失败 */
    private Configuration run(String input) {
        Configuration c = Configuration.initial();
        List<Token> tokens = FsmFixtures.TOKENIZER.tokenize(input);
        for (Token t : tokens) {
            StepResult r = engine.step(c, t);
            assertTrue(r.accepted(), "rejected " + t + " at " + c + " error=" + r.error());
            c = r.next();
        }
        return c;
    }

    @Test
    void rejectionLeavesConfigurationUntouched() {
        Configuration c = run("$\\frac{a");
        Configuration snapshot = c.copy();

        StepResult r = engine.step(c, new Token(TokenKind.MATH_DELIMITER, "$"));

        assertFalse(r.accepted());
        assertEquals(ErrorKind.UNBALANCED_DELIMITER, r.error());
        assertNull(r.next());
        assertEquals(FsmState.CONTENT, r.before());
        assertEquals(FsmState.CONTENT, r.after());
        assertTrue(c.sameAs(snapshot));
    }

    @Test
    void acceptingDoesNotMutateInput() {
        Configuration c = run("$x");
        Configuration snapshot = c.copy();

        StepResult r = engine.step(c, new Token(TokenKind.OPEN_BRACE, "{"));

        assertTrue(r.accepted());
        assertEquals(1, r.next().getBraceDepth());
        assertTrue(c.sameAs(snapshot));
    }

    @Test
    void fractionWalksNumeratorThenDenominator() {
        Configuration c = run("$\\frac");
        assertEquals(FsmState.FRACTION_NUM, c.getState());
        assertEquals(List.of(FsmState.MATH_MODE), c.returnStackView());

        c = run("$\\frac{a+b}");
        assertEquals(FsmState.FRACTION_DEN, c.getState());
        assertEquals(0, c.getBraceDepth());

        c = run("$\\frac{a+b}{c-d}");
        assertEquals(FsmState.MATH_MODE, c.getState());
        assertTrue(c.isBalanced());
    }

    @Test
    void nestedFractionReturnsToOuterDenominator() {
        Configuration c = run("$\\frac{\\frac{1}{2}}");
        assertEquals(FsmState.FRACTION_DEN, c.getState());

        c = run("$\\frac{\\frac{1}{2}}{3}$");
        assertTrue(c.isComplete());
    }

    @Test
    void scriptTakesOneOperandOrOneGroup() {
        assertEquals(FsmState.SUPERSCRIPT, run("$x^").getState());
        assertEquals(FsmState.MATH_MODE, run("$x^2").getState());
        assertEquals(FsmState.CONTENT, run("$x^{").getState());
        assertEquals(FsmState.MATH_MODE, run("$x^{2^3}").getState());
        assertEquals(FsmState.MATH_MODE, run("$x^\\alpha").getState());

        Configuration c = run("$x^");
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(c, new Token(TokenKind.COMMAND, "\\frac")).error());
        assertEquals(ErrorKind.UNKNOWN_COMMAND,
                engine.step(c, new Token(TokenKind.COMMAND, "\\nope")).error());
    }

    @Test
    void scriptInsideContentReturnsToContent() {
        Configuration c = run("$\\sqrt{x^2");
        assertEquals(FsmState.CONTENT, c.getState());
        assertEquals(1, c.getBraceDepth());
    }

    @Test
    void braceDepthTracksOpenGroups() {
        Configuration c = run("${{a}");
        assertEquals(1, c.getBraceDepth());
        assertEquals(FsmState.CONTENT, c.getState());

        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(run("$a"), new Token(TokenKind.CLOSE_BRACE, "}")).error());
    }

    @Test
    void parenthesesAndBracketsMustBalance() {
        assertEquals(ErrorKind.UNBALANCED_DELIMITER,
                engine.step(run("$a"), new Token(TokenKind.CLOSE_PAREN, ")")).error());
        assertEquals(ErrorKind.UNBALANCED_DELIMITER,
                engine.step(run("$a"), new Token(TokenKind.CLOSE_BRACKET, "]")).error());
        assertEquals(ErrorKind.UNBALANCED_DELIMITER,
                engine.step(run("$(a"), new Token(TokenKind.MATH_DELIMITER, "$")).error());
        assertTrue(run("$[(a)]$").isComplete());
    }

    @Test
    void closerMustMatchOpener() {
        assertEquals(ErrorKind.DELIMITER_MISMATCH,
                engine.step(run("$x"), new Token(TokenKind.MATH_DELIMITER, "$$")).error());
        assertEquals(ErrorKind.DELIMITER_MISMATCH,
                engine.step(run("\\[x"), new Token(TokenKind.MATH_DELIMITER, "$")).error());
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(Configuration.initial(), new Token(TokenKind.MATH_DELIMITER, "\\]")).error());
        assertTrue(run("\\[x\\]").isComplete());
        assertTrue(run("$$x$$").isComplete());
    }

    @Test
    void limitsOnlyDirectlyAfterBigOperator() {
        assertTrue(run("$\\sum\\limits_{i}^{n}$").isComplete());
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(run("$x"), new Token(TokenKind.COMMAND, "\\limits")).error());
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(run("$\\sum x"), new Token(TokenKind.COMMAND, "\\nolimits")).error());
    }

    @Test
    void matrixEnvironment() {
        Configuration c = run("$\\begin{pmatrix}");
        assertEquals(FsmState.MATRIX_MODE, c.getState());
        assertEquals(List.of("pmatrix"), c.environmentStackView());

        c = run("$\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}$");
        assertTrue(c.isComplete());
    }

    @Test
    void environmentNamesAreChecked() {
        assertEquals(ErrorKind.UNKNOWN_COMMAND,
                engine.step(run("$\\begin{"), new Token(TokenKind.LETTER, "q")).error());
        assertEquals(ErrorKind.UNKNOWN_COMMAND,
                engine.step(run("$\\begin{pma"), new Token(TokenKind.CLOSE_BRACE, "}")).error());
        assertEquals(ErrorKind.DELIMITER_MISMATCH,
                engine.step(run("$\\begin{matrix}a\\end{"), new Token(TokenKind.LETTER, "p")).error());
    }

    @Test
    void rowSeparatorAndEndOnlyInsideMatrix() {
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(run("$x"), new Token(TokenKind.COMMAND, "\\\\")).error());
        assertEquals(ErrorKind.INVALID_TRANSITION,
                engine.step(run("$x"), new Token(TokenKind.COMMAND, "\\end")).error());
        assertEquals(ErrorKind.UNKNOWN_TOKEN,
                engine.step(run("$x"), new Token(TokenKind.OTHER, "&")).error());
        assertEquals(ErrorKind.UNKNOWN_TOKEN,
                engine.step(run("$x"), new Token(TokenKind.OTHER, "#")).error());
    }

    @Test
    void endStateAcceptsNothing() {
        Configuration c = run("$x$");
        assertTrue(c.isComplete());
        for (String literal : List.of("$", "x", "{", "\\alpha")) {
            Token t = FsmFixtures.TOKENIZER.tokenize(literal).get(0);
            assertFalse(engine.step(c, t).accepted(), literal);
        }
    }

    @Test
    void replayingIsDeterministic() {
        String input = "$\\frac{\\sum_{i=1}^{n} x_i}{\\sqrt{n}} + \\begin{cases} a & b \\end{cases}$";
        assertTrue(run(input).sameAs(run(input)));
    }
}
