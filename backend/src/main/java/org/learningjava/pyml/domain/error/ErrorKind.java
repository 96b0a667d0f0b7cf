package org.learningjava.pyml.domain.error;

public enum ErrorKind {
    STRUCTURAL,
    CLASSIFICATION,
    TRANSLATION,
    CONFIGURATION
}
