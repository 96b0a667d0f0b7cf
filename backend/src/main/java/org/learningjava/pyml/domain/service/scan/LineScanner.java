package org.learningjava.pyml.domain.service.scan;

import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.source.LogicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw document text into logical lines: resolves indentation depth,
 * strips whitespace and drops blank and comment lines.
 */
public class LineScanner {

    private static final Logger log = LoggerFactory.getLogger(LineScanner.class);

    public static final String COMMENT_MARKER = "#";

    private final int indentWidth;
    private final boolean keepComments;

    public LineScanner(int indentWidth, boolean keepComments) {
        this.indentWidth = indentWidth;
        this.keepComments = keepComments;
    }

    public List<LogicalLine> scan(String text) {
        List<LogicalLine> lines = new ArrayList<>();
        String[] physical = text.split("\n", -1);

        for (int i = 0; i < physical.length; i++) {
            int lineNumber = i + 1;
            String raw = physical[i];
            if (raw.endsWith("\r")) {
                raw = raw.substring(0, raw.length() - 1);
            }

            String content = raw.strip();
            if (content.isEmpty()) {
                continue;
            }
            boolean comment = content.startsWith(COMMENT_MARKER);
            if (comment && !keepComments) {
                continue;
            }

            int depth = depthOf(raw, lineNumber);
            if (comment) {
                content = content.substring(COMMENT_MARKER.length()).strip();
            }
            lines.add(new LogicalLine(depth, content, lineNumber, comment));
        }

        log.debug("Scanned {} logical lines out of {} physical lines", lines.size(), physical.length);
        return lines;
    }

    private int depthOf(String raw, int lineNumber) {
        int spaces = 0;
        while (spaces < raw.length() && Character.isWhitespace(raw.charAt(spaces))) {
            if (raw.charAt(spaces) != ' ') {
                throw new StructuralException(lineNumber, "indentation must use spaces only");
            }
            spaces++;
        }
        if (spaces % indentWidth != 0) {
            throw new StructuralException(lineNumber,
                    "indentation of " + spaces + " spaces is not a multiple of " + indentWidth);
        }
        return spaces / indentWidth;
    }
}
