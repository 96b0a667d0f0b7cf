package org.learningjava.pyml.domain.model.options;

import org.learningjava.pyml.domain.error.ConfigurationException;

/**
 * Per-run formatting options. None of them changes the meaning of the emitted program.
 *
 * @param blockStyle        how nested blocks are delimited in the output
 * @param indentationUnit   text emitted once per nesting level
 * @param sourceIndentWidth number of spaces per nesting level in the input
 * @param keepComments      carry {@code #} comments into the output
 */
public record TranspileOptions(
        BlockStyle blockStyle,
        String indentationUnit,
        int sourceIndentWidth,
        boolean keepComments
) {

    public static final String DEFAULT_INDENTATION_UNIT = "  ";
    public static final int DEFAULT_SOURCE_INDENT_WIDTH = 2;

    public TranspileOptions {
        if (blockStyle == null) {
            throw new ConfigurationException("block style must be set");
        }
        if (indentationUnit == null || indentationUnit.isEmpty()
                || !indentationUnit.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new ConfigurationException("indentation unit must be a non-empty run of spaces or tabs, got '"
                    + indentationUnit + "'");
        }
        if (sourceIndentWidth <= 0) {
            throw new ConfigurationException("source indent width must be positive, got " + sourceIndentWidth);
        }
    }

    public static TranspileOptions defaults() {
        return new TranspileOptions(BlockStyle.COLON_INDENT, DEFAULT_INDENTATION_UNIT,
                DEFAULT_SOURCE_INDENT_WIDTH, false);
    }

    /** Builds options from raw configuration strings; null values fall back to the defaults. */
    public static TranspileOptions of(String blockStyle, String indentationUnit, Integer sourceIndentWidth,
                                      Boolean keepComments) {
        TranspileOptions d = defaults();
        return new TranspileOptions(
                blockStyle != null ? BlockStyle.parse(blockStyle) : d.blockStyle(),
                indentationUnit != null ? indentationUnit : d.indentationUnit(),
                sourceIndentWidth != null ? sourceIndentWidth : d.sourceIndentWidth(),
                keepComments != null ? keepComments : d.keepComments()
        );
    }

    public TranspileOptions withBlockStyle(BlockStyle style) {
        return new TranspileOptions(style, indentationUnit, sourceIndentWidth, keepComments);
    }

    public TranspileOptions withIndentationUnit(String unit) {
        return new TranspileOptions(blockStyle, unit, sourceIndentWidth, keepComments);
    }

    public TranspileOptions withKeepComments(boolean keep) {
        return new TranspileOptions(blockStyle, indentationUnit, sourceIndentWidth, keep);
    }
}
