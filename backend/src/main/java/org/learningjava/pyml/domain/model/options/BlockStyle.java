package org.learningjava.pyml.domain.model.options;

import org.learningjava.pyml.domain.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

public enum BlockStyle {
    BRACE,
    COLON_INDENT;

    /** Accepts {@code brace}, {@code colon-indent}, {@code colon_indent}, any case. */
    public static BlockStyle parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("block style must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return BlockStyle.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unrecognized block style '" + raw + "', expected one of "
                    + Arrays.toString(values()));
        }
    }
}
