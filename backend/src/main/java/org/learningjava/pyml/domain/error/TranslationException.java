package org.learningjava.pyml.domain.error;

public class TranslationException extends TranspileException {

    public TranslationException(int line, String detail) {
        super(ErrorKind.TRANSLATION, line, detail);
    }

    public static TranslationException undefinedCallable(int callLine, String name, int definitionLine) {
        return new TranslationException(callLine,
                "undefined-callable '" + name + "': called before its definition at line " + definitionLine);
    }
}
