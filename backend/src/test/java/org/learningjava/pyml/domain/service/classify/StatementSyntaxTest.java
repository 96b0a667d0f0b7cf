package org.learningjava.pyml.domain.service.classify;

import org.junit.jupiter.api.Test;
import org.learningjava.pyml.domain.error.ClassificationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementSyntaxTest {

    @Test
    void parses_for_clause_with_several_targets() {
        StatementSyntax.ForClause clause = StatementSyntax.forClause("for k ,v in data", 1);

        assertEquals(List.of("k", "v"), clause.targets());
        assertEquals("data", clause.iterable());
        assertTrue(clause.unpacksPairs());
        assertFalse(clause.isRange());
    }

    @Test
    void rejects_malformed_for_clause() {
        assertThrows(ClassificationException.class, () -> StatementSyntax.forClause("for x data", 1));
        assertThrows(ClassificationException.class, () -> StatementSyntax.forClause("for 1x in data", 1));
    }

    @Test
    void underscore_means_no_parameter() {
        StatementSyntax.FunctionSignature signature = StatementSyntax.functionSignature("function main define _", 1);

        assertEquals("main", signature.name());
        assertFalse(signature.hasParameter());
    }

    @Test
    void function_name_cannot_be_reserved() {
        assertThrows(ClassificationException.class,
                () -> StatementSyntax.functionSignature("function print define x", 3));
    }

    @Test
    void import_path_splits_on_last_dot() {
        StatementSyntax.ImportPath path = StatementSyntax.importPath("- os.path.join", 1);

        assertEquals("os.path", path.module());
        assertEquals("join", path.member());
        assertEquals("join", path.boundName());
        assertEquals("math", StatementSyntax.importPath("math", 1).boundName());
    }

    @Test
    void rejects_invalid_import_path() {
        assertThrows(ClassificationException.class, () -> StatementSyntax.importPath("- os..path", 1));
    }

    @Test
    void if_condition_is_required() {
        assertEquals("a and b", StatementSyntax.ifCondition("if  a and b", 1));
        assertThrows(ClassificationException.class, () -> StatementSyntax.ifCondition("if", 1));
    }
}
