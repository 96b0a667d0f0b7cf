package org.learningjava.pyml.domain.service.classify;

import org.learningjava.pyml.domain.error.ClassificationException;
import org.learningjava.pyml.domain.error.StructuralException;
import org.learningjava.pyml.domain.model.tree.Node;
import org.learningjava.pyml.domain.model.tree.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.learningjava.pyml.domain.service.classify.StatementSyntax.*;

/**
 * Assigns a {@link Role} to every node in a single document-order pass.
 * <p>
 * A {@code key: value} line is ambiguous on its own: it can be a plain
 * assignment, a call or a control header. The decision depends on the node's
 * shape, its parent's role and the callables declared earlier in the
 * document, which is why a fresh classifier (and symbol table) is used for
 * every run.
 */
public class NodeClassifier {

    private static final Logger log = LoggerFactory.getLogger(NodeClassifier.class);

    private final SymbolTable symbols = new SymbolTable();

    public SymbolTable classify(List<Node> roots) {
        classifySiblings(roots, null);
        return symbols;
    }

    private void classifySiblings(List<Node> siblings, Node parent) {
        Node previous = null;
        for (Node node : siblings) {
            classify(node, parent, previous);
            if (!node.isComment()) {
                previous = node;
            }
        }
    }

    private void classify(Node node, Node parent, Node previous) {
        int line = node.sourceLineNumber();

        if (node.isComment()) {
            assign(node, Role.COMMENT);
            return;
        }

        // rule 1: entries under packages
        if (parent != null && parent.role() == Role.IMPORT_LIST) {
            classifyImportEntry(node);
            return;
        }

        if (node.hasKey()) {
            String word = leadingWord(node.key());

            // rule 2: control headers and function definitions
            switch (word) {
                case IF -> {
                    ifCondition(node.key(), line);
                    requireNoInlineBody(node, IF);
                    openBlock(node, Role.IF_HEADER);
                    return;
                }
                case ELSE -> {
                    if (!node.key().equals(ELSE)) {
                        throw new ClassificationException(line,
                                "'else' takes no condition; 'else if' chains are not supported");
                    }
                    requireNoInlineBody(node, ELSE);
                    if (previous == null || previous.role() != Role.IF_HEADER) {
                        throw new ClassificationException(line, "'else' without a preceding 'if'");
                    }
                    openBlock(node, Role.ELSE_HEADER);
                    return;
                }
                case FOR -> {
                    ForClause clause = forClause(node.key(), line);
                    requireNoInlineBody(node, FOR);
                    if (clause.isRange() && clause.unpacksPairs()) {
                        throw new ClassificationException(line, "a range loop takes a single loop variable");
                    }
                    clause.targets().forEach(symbols::declareVariable);
                    openBlock(node, clause.isRange() ? Role.RANGE_FOR_HEADER : Role.FOR_HEADER);
                    return;
                }
                case FUNCTION -> {
                    FunctionSignature signature = functionSignature(node.key(), line);
                    requireNoInlineBody(node, FUNCTION);
                    symbols.declareFunction(signature.name(), line);
                    if (signature.hasParameter()) {
                        symbols.declareVariable(signature.parameter());
                    }
                    openBlock(node, Role.FUNCTION_DEF);
                    return;
                }
                default -> {
                }
            }

            // rule 3: print / return
            if (node.key().equals(PRINT) || node.key().equals(RETURN)) {
                if (node.hasBody()) {
                    throw new ClassificationException(line, "'" + node.key() + "' cannot have nested lines");
                }
                assign(node, node.key().equals(PRINT) ? Role.PRINT : Role.RETURN);
                classifyComments(node);
                return;
            }

            // rule 4: packages
            if (node.key().equals(PACKAGES)) {
                if (node.hasValue() || !node.hasBody()) {
                    throw new ClassificationException(line, "'packages' expects a nested list of package paths");
                }
                assign(node, Role.IMPORT_LIST);
                classifySiblings(node.children(), node);
                return;
            }

            // rules 6 and 7: calls with arguments and assignments
            classifyKeyed(node);
            return;
        }

        String content = node.value();

        // rule 5: zero-argument call
        if (content.endsWith(";")) {
            String callee = content.substring(0, content.length() - 1).strip();
            if (!isDottedIdentifier(callee)) {
                throw new ClassificationException(line, "invalid call target '" + callee + "'");
            }
            if (node.hasBody()) {
                throw new ClassificationException(line, "call '" + callee + ";' cannot have nested lines");
            }
            symbols.recordCall(callee, line);
            assign(node, Role.BARE_CALL);
            classifyComments(node);
            return;
        }

        // rule 8: list items are only legal inside a list-bearing node
        if (isListItem(content)) {
            throw new ClassificationException(line, "list item outside of a list");
        }

        throw new ClassificationException(line, "unrecognized statement '" + content + "'");
    }

    private void classifyKeyed(Node node) {
        int line = node.sourceLineNumber();
        String key = node.key();

        if (!isDottedIdentifier(key) || RESERVED.contains(key)) {
            throw new ClassificationException(line, "unrecognized statement '" + key + "'");
        }

        boolean callable = symbols.isCallable(key);
        if (node.hasBody()) {
            if (node.hasValue()) {
                throw new ClassificationException(line, "'" + key + "' has both an inline value and nested lines");
            }
            assign(node, callable ? Role.ARG_CALL : Role.ASSIGNMENT);
            classifyAggregate(node, callable);
        } else {
            if (!node.hasValue()) {
                throw new ClassificationException(line, "missing value for '" + key + "'");
            }
            assign(node, callable ? Role.ARG_CALL : Role.ASSIGNMENT);
            classifyComments(node);
        }

        if (!callable) {
            // a function of this name defined further down turns this line into a forward call
            symbols.recordCall(key, line);
            symbols.declareVariable(key);
        }
    }

    /**
     * Classifies the children of a list- or dict-bearing node. All entries of
     * one aggregate must have the same shape.
     */
    private void classifyAggregate(Node owner, boolean keywordArguments) {
        List<Node> entries = owner.children().stream().filter(n -> !n.isComment()).toList();
        boolean allItems = entries.stream().allMatch(n -> !n.hasKey() && isListItem(n.value()));
        boolean allPairs = entries.stream().allMatch(Node::hasKey);

        if (!allItems && !allPairs) {
            throw new ClassificationException(owner.sourceLineNumber(),
                    "nested lines must be either all '- item' entries or all 'key: value' pairs");
        }

        for (Node child : owner.children()) {
            int line = child.sourceLineNumber();
            if (child.isComment()) {
                assign(child, Role.COMMENT);
                continue;
            }

            if (allItems) {
                String item = stripListMarker(child.value());
                assign(child, Role.LIST_ENTRY);
                if (child.hasBody()) {
                    classifyAggregate(child, false);
                    if (!item.isEmpty() && child.children().stream()
                            .anyMatch(n -> n.role() == Role.LIST_ENTRY)) {
                        throw new ClassificationException(line,
                                "a list item with inline content can only nest 'key: value' pairs");
                    }
                } else if (item.isEmpty()) {
                    throw new ClassificationException(line, "empty list item");
                } else {
                    classifyComments(child);
                }
            } else {
                if (child.key().isEmpty() || isListItem(child.key())) {
                    throw new ClassificationException(line, "invalid entry key '" + child.key() + "'");
                }
                if (keywordArguments && !isIdentifier(child.key())) {
                    throw new ClassificationException(line, "keyword argument '" + child.key() + "' is not a valid name");
                }
                assign(child, Role.DICT_ENTRY);
                if (child.hasBody()) {
                    if (child.hasValue()) {
                        throw new ClassificationException(line,
                                "'" + child.key() + "' has both an inline value and nested lines");
                    }
                    classifyAggregate(child, false);
                } else if (!child.hasValue()) {
                    throw new ClassificationException(line, "missing value for '" + child.key() + "'");
                } else {
                    classifyComments(child);
                }
            }
        }
    }

    private void classifyImportEntry(Node node) {
        int line = node.sourceLineNumber();
        if (node.hasKey()) {
            throw new ClassificationException(line, "package entries are plain paths, got '" + node.key() + ":'");
        }
        Node nested = node.children().stream().filter(n -> !n.isComment()).findFirst().orElse(null);
        if (nested != null) {
            throw new StructuralException(nested.sourceLineNumber(), "package entries cannot have nested lines");
        }
        symbols.declareImport(importPath(node.value(), line));
        assign(node, Role.IMPORT_ENTRY);
        classifyComments(node);
    }

    private void openBlock(Node header, Role role) {
        assign(header, role);
        if (!header.hasBody()) {
            throw new StructuralException(header.sourceLineNumber(), "empty block after '" + header.key() + "'");
        }
        classifySiblings(header.children(), header);
    }

    /** Kept comments nested under a statement that has no body of its own. */
    private static void classifyComments(Node node) {
        for (Node child : node.children()) {
            assign(child, Role.COMMENT);
        }
    }

    private static void requireNoInlineBody(Node node, String keyword) {
        if (node.hasValue()) {
            throw new ClassificationException(node.sourceLineNumber(),
                    "'" + keyword + "' header must end with ':' and put its body on the following lines");
        }
    }

    private static void assign(Node node, Role role) {
        node.assignRole(role);
        log.debug("Line {} classified as {}", node.sourceLineNumber(), role);
    }
}
