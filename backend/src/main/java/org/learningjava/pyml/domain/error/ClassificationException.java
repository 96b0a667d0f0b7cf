package org.learningjava.pyml.domain.error;

/** A node shape that matches no classification rule. */
public class ClassificationException extends TranspileException {

    public ClassificationException(int line, String detail) {
        super(ErrorKind.CLASSIFICATION, line, detail);
    }
}
