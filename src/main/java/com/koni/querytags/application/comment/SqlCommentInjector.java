package com.koni.querytags.application.comment;

/**
 * Adds comments to SQL statements, at the end by default or at the start when
 * {@code prependComment} is set. Some log pipelines truncate long statements,
 * which is when prepending helps.
 */
public class SqlCommentInjector {

    private final boolean prependComment;

    public SqlCommentInjector(boolean prependComment) {
        this.prependComment = prependComment;
    }

    public boolean isPrependComment() {
        return prependComment;
    }

    /**
     * Adds each comment in turn, separated from the statement by a single space.
     * Empty comments and comments the statement already contains are skipped.
     *
     * @param sql the statement
     * @param comments the comments to add
     * @return the commented statement
     */
    public String inject(String sql, String... comments) {
        if (sql == null) {
            return null;
        }
        String result = sql;
        for (String comment : comments) {
            if (comment == null || comment.isEmpty() || result.contains(comment)) {
                continue;
            }
            result = prependComment ? comment + " " + result : result + " " + comment;
        }
        return result;
    }
}
