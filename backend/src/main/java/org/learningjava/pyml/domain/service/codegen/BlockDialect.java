package org.learningjava.pyml.domain.service.codegen;

import org.learningjava.pyml.domain.model.options.BlockStyle;

/**
 * How a block header opens and closes its body in the target text.
 */
public interface BlockDialect {

    void open(EmissionBuffer out, int level, String header);

    void close(EmissionBuffer out, int level);

    static BlockDialect forStyle(BlockStyle style) {
        return switch (style) {
            case BRACE -> new BraceDialect();
            case COLON_INDENT -> new ColonIndentDialect();
        };
    }
}
