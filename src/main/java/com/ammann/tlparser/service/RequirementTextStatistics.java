package com.ammann.tlparser.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Size measures of a natural-language requirement.
 *
 * <p>The text is trimmed and, when it does not end in sentence punctuation, a full stop is
 * appended before measuring, so a single unterminated sentence counts as one sentence.
 *
 * @param length        characters of the completed text
 * @param wordCount     whitespace-separated words
 * @param sentenceCount runs of {@code .!?} followed by whitespace or the end of the text
 */
public record RequirementTextStatistics(int length, int wordCount, int sentenceCount)
{
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?:\\s|$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Measures a requirement text.
     *
     * @return the measures, or {@code null} for a missing or blank text
     */
    public static RequirementTextStatistics of(String text)
    {
        if (text == null || text.isBlank()) {
            return null;
        }
        String cleaned = text.strip();
        char last = cleaned.charAt(cleaned.length() - 1);
        if (last != '.' && last != '!' && last != '?') {
            cleaned = cleaned + ".";
        }

        int words = WHITESPACE.split(cleaned).length;
        int sentences = 0;
        Matcher matcher = SENTENCE_END.matcher(cleaned);
        while (matcher.find()) {
            sentences++;
        }
        return new RequirementTextStatistics(cleaned.length(), words, sentences);
    }
}
