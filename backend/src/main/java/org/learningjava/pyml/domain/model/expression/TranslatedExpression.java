package org.learningjava.pyml.domain.model.expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Python expression produced from a raw PyML value.
 *
 * @param text        target-language expression
 * @param identifiers root names the expression reads, in order of appearance
 */
public record TranslatedExpression(String text, Set<String> identifiers) {

    public TranslatedExpression {
        identifiers = Collections.unmodifiableSet(new LinkedHashSet<>(identifiers));
    }
}
