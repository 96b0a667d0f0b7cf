package org.learningjava.pyml.domain.service.tree;

import org.junit.jupiter.api.Test;
import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.source.LogicalLine;
import org.learningjava.pyml.domain.model.tree.Node;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockBuilderTest {

    private final BlockBuilder builder = new BlockBuilder();

    @Test
    void nests_children_under_the_previous_shallower_line() {
        List<Node> roots = builder.build(List.of(
                new LogicalLine(0, "function f define x:", 1, false),
                new LogicalLine(1, "if x > 1:", 2, false),
                new LogicalLine(2, "print: x", 3, false),
                new LogicalLine(1, "return: x", 4, false),
                new LogicalLine(0, "f: 2", 5, false)
        ));

        assertEquals(2, roots.size());
        Node f = roots.get(0);
        assertEquals("function f define x", f.key());
        assertEquals(2, f.children().size());
        assertEquals("if x > 1", f.children().get(0).key());
        assertEquals("print", f.children().get(0).children().get(0).key());
        assertEquals("return", f.children().get(1).key());
        assertTrue(roots.get(1).children().isEmpty());
    }

    @Test
    void splits_on_first_colon_outside_strings_and_brackets() {
        Node quoted = BlockBuilder.split(new LogicalLine(0, "print: \"a: b\"", 1, false));
        assertEquals("print", quoted.key());
        assertEquals("\"a: b\"", quoted.value());

        Node sliced = BlockBuilder.split(new LogicalLine(0, "head: items[1:3]", 1, false));
        assertEquals("head", sliced.key());
        assertEquals("items[1:3]", sliced.value());

        Node escaped = BlockBuilder.split(new LogicalLine(0, "s: 'it\\'s: here'", 1, false));
        assertEquals("s", escaped.key());
        assertEquals("'it\\'s: here'", escaped.value());
    }

    @Test
    void content_without_colon_is_a_bare_value() {
        Node node = BlockBuilder.split(new LogicalLine(0, "- \"x\"", 7, false));

        assertFalse(node.hasKey());
        assertEquals("- \"x\"", node.value());
        assertEquals(7, node.sourceLineNumber());
    }

    @Test
    void header_colon_leaves_an_empty_value() {
        Node node = BlockBuilder.split(new LogicalLine(0, "packages:", 1, false));

        assertEquals("packages", node.key());
        assertFalse(node.hasValue());
    }

    @Test
    void rejects_a_depth_jump_of_more_than_one_level() {
        StructuralException ex = assertThrows(StructuralException.class, () -> builder.build(List.of(
                new LogicalLine(0, "if x:", 1, false),
                new LogicalLine(2, "y: 1", 2, false)
        )));

        assertEquals(2, ex.line());
        assertTrue(ex.getMessage().contains("illegal depth jump"));
    }

    @Test
    void rejects_an_indented_first_line() {
        StructuralException ex = assertThrows(StructuralException.class,
                () -> builder.build(List.of(new LogicalLine(1, "x: 1", 3, false))));

        assertEquals(3, ex.line());
    }

    @Test
    void a_comment_cannot_open_a_block() {
        StructuralException ex = assertThrows(StructuralException.class, () -> builder.build(List.of(
                new LogicalLine(0, "note", 1, true),
                new LogicalLine(1, "x: 1", 2, false)
        )));

        assertTrue(ex.getMessage().contains("comment cannot open a block"));
    }

    @Test
    void comments_become_keyless_comment_nodes() {
        List<Node> roots = builder.build(List.of(
                new LogicalLine(0, "x: 1 is fine", 1, true),
                new LogicalLine(0, "x: 1", 2, false)
        ));

        assertTrue(roots.get(0).isComment());
        assertFalse(roots.get(0).hasKey());
        assertEquals("x: 1 is fine", roots.get(0).value());
    }
}
