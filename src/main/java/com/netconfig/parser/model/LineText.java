package com.netconfig.parser.model;

import lombok.experimental.UtilityClass;

/**
 * Plain string helpers shared by the parsers and the line model.
 */
@UtilityClass
public class LineText {

    /**
     * Count the leading space characters. Tabs are not counted.
     */
    public static int leadingSpaces(String text) {
        if (text == null) {
            return 0;
        }
        int i = 0;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    /**
     * Strip trailing whitespace and line terminators, keeping leading whitespace.
     */
    public static String stripTrailing(String text) {
        return text == null ? "" : text.stripTrailing();
    }

    /**
     * True if the trimmed text starts with one of the given marker characters.
     */
    public static boolean isComment(String text, String markers) {
        String trimmed = text == null ? "" : text.strip();
        return !trimmed.isEmpty() && markers.indexOf(trimmed.charAt(0)) >= 0;
    }

    /**
     * Last non-whitespace character, or 0 for a blank line.
     */
    public static char lastSignificantChar(String text) {
        String stripped = stripTrailing(text);
        return stripped.isEmpty() ? 0 : stripped.charAt(stripped.length() - 1);
    }
}
