package com.example.scene.latexmath;

import com.example.latexmath.model.ValidationResult;
import com.example.latexmath.util.TracePrinter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TracePrinterTest {

    @Test
    void printsFailureDetails() {
        ValidationResult r = FsmFixtures.validator().validate("$x^$");
        String text = TracePrinter.prettyPrint(r);
        System.out.println(text);

        assertTrue(text.contains("valid: false"));
        assertTrue(text.contains("error: UNBALANCED_DELIMITER"));
        assertTrue(text.contains("failingIndex: 3"));
        assertTrue(text.contains("REJECT(UNBALANCED_DELIMITER)"));
        assertTrue(text.contains("superscript"));
    }

    @Test
    void printsEndOfInputAndAbbreviatesCandidates() {
        ValidationResult r = FsmFixtures.validator().validate("$x");
        String text = TracePrinter.prettyPrint(r);

        assertTrue(text.contains("failingToken: <end of input>"));
        assertTrue(text.contains("total)"));
    }

    @Test
    void validResultHasNoErrorSection() {
        String text = TracePrinter.prettyPrint(FsmFixtures.validator().validate("$a$"));
        assertTrue(text.contains("valid: true"));
        assertFalse(text.contains("error:"));
        assertEquals("ValidationResult: null\n", TracePrinter.prettyPrint(null));
    }
}
