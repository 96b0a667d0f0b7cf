package org.learningjava.pyml.domain.error;

/** Malformed indentation, illegal depth jump, dedent to an unknown level or an empty block. */
public class StructuralException extends TranspileException {

    public StructuralException(int line, String detail) {
        super(ErrorKind.STRUCTURAL, line, detail);
    }
}
