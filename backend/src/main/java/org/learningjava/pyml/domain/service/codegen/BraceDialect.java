package org.learningjava.pyml.domain.service.codegen;

public class BraceDialect implements BlockDialect {

    @Override
    public void open(EmissionBuffer out, int level, String header) {
        out.line(level, header + " {");
    }

    @Override
    public void close(EmissionBuffer out, int level) {
        out.line(level, "}");
    }
}
