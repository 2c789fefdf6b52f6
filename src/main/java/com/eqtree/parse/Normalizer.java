package com.eqtree.parse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites ad hoc notation into text the expression grammar accepts. The steps run in a fixed
 * order and each relies on the previous ones:
 * <ol>
 *     <li>{@code ≤ ≥} become {@code <= >=};</li>
 *     <li>superscript {@code ² ³} become {@code **2 **3};</li>
 *     <li>{@code ^} followed by digits or letters becomes {@code **};</li>
 *     <li>{@code *} is inserted between a digit and a following letter or {@code (}, and between
 *     {@code )} and {@code (};</li>
 *     <li>innermost {@code |...|} pairs become {@code AbsoluteValue(...)}, left to right.</li>
 * </ol>
 */
public class Normalizer {
    public static final String ABSOLUTE_VALUE = "AbsoluteValue";

    private static final Pattern CARET_DIGITS = Pattern.compile("\\^(\\d+)");
    private static final Pattern CARET_LETTERS = Pattern.compile("\\^([a-zA-Z]+)");
    private static final Pattern DIGIT_THEN_LETTER_OR_PAREN = Pattern.compile("(\\d)\\s*([a-zA-Z(])");
    private static final Pattern CLOSE_THEN_OPEN = Pattern.compile("\\)\\s*\\(");
    private static final Pattern INNERMOST_BARS = Pattern.compile("\\|\\s*([^|]+?)\\s*\\|");
    private static final Pattern ADJACENT_BARS = Pattern.compile("\\|\\s*\\|");

    /**
     * @return the normalized text, or an empty string when the line is blank
     * @throws ExpressionParseException when absolute-value bars are adjacent, as in {@code ||x|-1|}
     */
    public String normalize(String line) {
        if (line == null) {
            return "";
        }
        String text = line.strip();
        if (text.isEmpty()) {
            return "";
        }

        text = text.replace("≤", "<=").replace("≥", ">=");
        text = text.replace("²", "**2").replace("³", "**3");
        text = CARET_DIGITS.matcher(text).replaceAll("**$1");
        text = CARET_LETTERS.matcher(text).replaceAll("**$1");
        text = DIGIT_THEN_LETTER_OR_PAREN.matcher(text).replaceAll("$1*$2");
        text = CLOSE_THEN_OPEN.matcher(text).replaceAll(")*(");
        return replaceBars(text);
    }

    private String replaceBars(String text) {
        if (ADJACENT_BARS.matcher(text).find()) {
            throw new ExpressionParseException("Ambiguous nested absolute value bars in '" + text + "'");
        }
        while (text.indexOf('|') >= 0) {
            Matcher m = INNERMOST_BARS.matcher(text);
            if (!m.find()) {
                // an unpaired bar is left for the parser to reject
                break;
            }
            text = text.substring(0, m.start()) + ABSOLUTE_VALUE + "(" + m.group(1) + ")" + text.substring(m.end());
        }
        return text;
    }
}
