package com.eqtree.parse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {
    private final Normalizer normalizer = new Normalizer();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "x ≤ 3                ; x <= 3",
            "x ≥ 3                ; x >= 3",
            "x² + y³ = 1          ; x**2 + y**3 = 1",
            "x^2 = 4              ; x**2 = 4",
            "x^10 = 1             ; x**10 = 1",
            "2^x = 8              ; 2**x = 8",
            "x^n = 1              ; x**n = 1",
            "232x = 5             ; 232*x = 5",
            "2(x+1) = 4           ; 2*(x+1) = 4",
            "2 (x+1) = 4          ; 2*(x+1) = 4",
            "(x-1)(x+2) = 0       ; (x-1)*(x+2) = 0",
            "(x-1) (x+2) = 0      ; (x-1)*(x+2) = 0",
            "3x^2 = 12            ; 3*x**2 = 12",
            "|x - 3| = 7          ; AbsoluteValue(x - 3) = 7",
            "| x | = 2            ; AbsoluteValue(x) = 2",
            "|x| + |y| = 2        ; AbsoluteValue(x) + AbsoluteValue(y) = 2"
    })
    public void testNormalize(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    public void testBlankLineNormalizesToEmpty() {
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize("   \t"));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    public void testInputIsTrimmed() {
        assertEquals("x = 1", normalizer.normalize("  x = 1 \n"));
    }

    @Test
    public void testBareCaretIsLeftForTheParser() {
        assertEquals("x^(2) = 4", normalizer.normalize("x^(2) = 4"));
        assertEquals("x ^ 2 = 4", normalizer.normalize("x ^ 2 = 4"));
    }

    @Test
    public void testUnpairedBarIsLeftForTheParser() {
        assertEquals("AbsoluteValue(x) + |y = 1", normalizer.normalize("|x| + |y = 1"));
    }

    @Test
    public void testAdjacentBarsAreRejected() {
        assertThrows(ExpressionParseException.class, () -> normalizer.normalize("||x| - 1| = 2"));
        assertThrows(ExpressionParseException.class, () -> normalizer.normalize("|x|| y| = 2"));
    }

    @Test
    public void testNormalizedTextParses() {
        ExpressionParser parser = new ExpressionParser();
        assertDoesNotThrow(() -> parser.parse(normalizer.normalize("3x^2 + 2(x - 1)(x + 1) - |x|")));
    }
}
