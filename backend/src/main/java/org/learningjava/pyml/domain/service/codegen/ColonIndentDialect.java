package org.learningjava.pyml.domain.service.codegen;

/** {@code header:} followed by an indented body; dedent closes the block. */
public class ColonIndentDialect implements BlockDialect {

    @Override
    public void open(EmissionBuffer out, int level, String header) {
        out.line(level, header + ":");
    }

    @Override
    public void close(EmissionBuffer out, int level) {
        // nothing to emit, the dedent ends the block
    }
}
