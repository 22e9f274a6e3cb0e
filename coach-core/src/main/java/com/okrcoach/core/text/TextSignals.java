package com.okrcoach.core.text;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by the detectors.
 *
 * <p>All methods are null-safe: a null text never matches and counts as zero.
 */
public final class TextSignals {

    private TextSignals() {}

    /** Lower-cases with a fixed locale; null becomes the empty string. */
    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /** True when the (already lower-cased) text contains any of the given fragments. */
    public static boolean containsAny(String lower, String... fragments) {
        if (lower == null || lower.isEmpty()) return false;
        for (String f : fragments) {
            if (lower.contains(f)) return true;
        }
        return false;
    }

    /** Number of non-overlapping matches of {@code pattern} in {@code text}. */
    public static int countMatches(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return 0;
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) count++;
        return count;
    }

    public static boolean matches(Pattern pattern, String text) {
        return text != null && pattern.matcher(text).find();
    }

    /** Case-insensitive pattern compile used throughout the detectors. */
    public static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
