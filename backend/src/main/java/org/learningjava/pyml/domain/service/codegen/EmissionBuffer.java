package org.learningjava.pyml.domain.service.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects generated lines with their nesting level and renders them with
 * the configured indentation unit. Formatting only.
 */
public class EmissionBuffer {

    private record Line(int level, String text) {}

    private final String indentationUnit;
    private final List<Line> lines = new ArrayList<>();

    public EmissionBuffer(String indentationUnit) {
        this.indentationUnit = indentationUnit;
    }

    public void line(int level, String text) {
        lines.add(new Line(level, text));
    }

    public int lineCount() {
        return lines.size();
    }

    public String render() {
        if (lines.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Line line : lines) {
            sb.append(indentationUnit.repeat(line.level())).append(line.text()).append('\n');
        }
        return sb.toString();
    }
}
