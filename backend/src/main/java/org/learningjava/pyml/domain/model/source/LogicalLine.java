package org.learningjava.pyml.domain.model.source;

/**
 * One non-blank line of a PyML document with its indentation already resolved.
 *
 * @param depth            indentation level, in source indentation units
 * @param content          text with the indentation and trailing whitespace stripped
 * @param sourceLineNumber 1-based physical line number, for diagnostics
 * @param comment          true when the line is a kept {@code #} comment
 */
public record LogicalLine(
        int depth,
        String content,
        int sourceLineNumber,
        boolean comment
) {
}
