package org.learningjava.pyml.domain.service.tree;

import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.source.LogicalLine;
import org.learningjava.pyml.domain.model.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the node forest from logical lines. Indentation depth decides
 * nesting; only single-level descent is allowed.
 */
public class BlockBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlockBuilder.class);

    private record Open(int depth, Node node, boolean comment) {}

    public List<Node> build(List<LogicalLine> lines) {
        List<Node> roots = new ArrayList<>();
        Deque<Open> stack = new ArrayDeque<>();

        for (LogicalLine line : lines) {
            int depth = line.depth();
            int maxDepth = stack.isEmpty() ? 0 : stack.peek().depth() + 1;
            if (depth > maxDepth) {
                throw new StructuralException(line.sourceLineNumber(),
                        "illegal depth jump to level " + depth + ", at most " + maxDepth + " allowed here");
            }
            if (depth == maxDepth && !stack.isEmpty() && stack.peek().comment()) {
                throw new StructuralException(line.sourceLineNumber(), "a comment cannot open a block");
            }

            while (!stack.isEmpty() && stack.peek().depth() >= depth) {
                stack.pop();
            }
            if (!stack.isEmpty() && stack.peek().depth() != depth - 1) {
                throw new StructuralException(line.sourceLineNumber(), "dedent to unknown level " + depth);
            }

            Node node = line.comment()
                    ? Node.comment(line.content(), line.sourceLineNumber())
                    : split(line);

            if (stack.isEmpty()) {
                roots.add(node);
            } else {
                stack.peek().node().addChild(node);
            }
            stack.push(new Open(depth, node, line.comment()));
        }

        log.debug("Built {} root nodes from {} lines", roots.size(), lines.size());
        return roots;
    }

    /** Splits on the first top-level colon; without one the whole content is a bare value. */
    static Node split(LogicalLine line) {
        String content = line.content();
        int colon = topLevelColon(content);
        if (colon < 0) {
            return new Node(null, content, line.sourceLineNumber());
        }
        String key = content.substring(0, colon).strip();
        String value = content.substring(colon + 1).strip();
        return new Node(key, value, line.sourceLineNumber());
    }

    static int topLevelColon(String content) {
        char quote = 0;
        int nesting = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> nesting++;
                case ')', ']', '}' -> nesting = Math.max(0, nesting - 1);
                case ':' -> {
                    if (nesting == 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }
}
