package com.koni.querytags.domain.model;

import java.util.regex.Pattern;

/**
 * Builds SQL block comments that cannot break out of themselves.
 */
public final class SqlComments {

    public static final String OPEN = "/*";
    public static final String CLOSE = "*/";

    /**
     * An opening run such as {@code /*} or {@code //**} with an optional optimizer-hint
     * {@code +} and trailing whitespace, or a closing run such as {@code *}{@code /} or
     * {@code **}{@code //} with leading whitespace.
     */
    private static final Pattern DELIMITER_RUN = Pattern.compile("/+\\*+\\+?\\s*|\\s*\\*+/+");

    private SqlComments() {
    }

    /**
     * Removes comment delimiters from the given content.
     * Removal is repeated until no delimiter is left, since dropping one run can join
     * its neighbours into a new one.
     *
     * @param content raw comment content
     * @return content that contains neither {@code /*} nor its closing counterpart
     */
    public static String escape(String content) {
        if (content == null) {
            return "";
        }
        String escaped = content;
        while (escaped.contains(OPEN) || escaped.contains(CLOSE)) {
            escaped = DELIMITER_RUN.matcher(escaped).replaceAll("");
        }
        return escaped;
    }

    /**
     * Escapes the content and wraps it in comment delimiters.
     *
     * @return the comment, or an empty string when nothing is left after escaping
     */
    public static String wrap(String content) {
        String escaped = escape(content);
        if (escaped.isEmpty()) {
            return "";
        }
        return OPEN + escaped + CLOSE;
    }
}
