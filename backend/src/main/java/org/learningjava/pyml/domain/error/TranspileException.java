package org.learningjava.pyml.domain.error;

import java.util.Locale;

/**
 * Fatal transpilation failure. Carries the error kind and the offending
 * source line; line 0 means the error is not tied to a line.
 */
public abstract class TranspileException extends RuntimeException {

    private final ErrorKind kind;
    private final int line;
    private final String detail;

    protected TranspileException(ErrorKind kind, int line, String detail) {
        super(format(kind, line, detail));
        this.kind = kind;
        this.line = line;
        this.detail = detail;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int line() {
        return line;
    }

    /** Message without the kind/line prefix. */
    public String detail() {
        return detail;
    }

    private static String format(ErrorKind kind, int line, String detail) {
        String k = kind.name().toLowerCase(Locale.ROOT);
        return line > 0
                ? k + " error at line " + line + ": " + detail
                : k + " error: " + detail;
    }
}
