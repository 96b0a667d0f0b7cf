package org.learningjava.pyml.domain.model.program;

/**
 * Result of a successful run.
 *
 * @param code      emitted Python source
 * @param lineCount number of emitted lines
 * @param nodeCount number of top-level statements in the source
 */
public record TranspiledProgram(String code, int lineCount, int nodeCount) {
}
