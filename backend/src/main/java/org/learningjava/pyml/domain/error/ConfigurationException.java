package org.learningjava.pyml.domain.error;

public class ConfigurationException extends TranspileException {

    public ConfigurationException(String detail) {
        super(ErrorKind.CONFIGURATION, 0, detail);
    }
}
