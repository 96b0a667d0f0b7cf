package org.learningjava.pyml.domain.service.codegen;

import org.learningjava.pyml.domain.model.expression.TranslatedExpression;
import org.learningjava.pyml.domain.model.tree.Node;
import org.learningjava.pyml.domain.model.tree.Role;
import org.learningjava.pyml.domain.service.classify.StatementSyntax;
import org.learningjava.pyml.domain.service.classify.StatementSyntax.ForClause;
import org.learningjava.pyml.domain.service.classify.StatementSyntax.FunctionSignature;
import org.learningjava.pyml.domain.service.classify.StatementSyntax.ImportPath;
import org.learningjava.pyml.domain.service.classify.SymbolTable;
import org.learningjava.pyml.domain.service.expression.ExpressionTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a classified forest and emits Python statements in document order.
 */
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private final ExpressionTranslator translator;
    private final BlockDialect dialect;
    private final SymbolTable symbols;
    private final Set<String> warned = new HashSet<>();

    public CodeGenerator(ExpressionTranslator translator, BlockDialect dialect, SymbolTable symbols) {
        this.translator = translator;
        this.dialect = dialect;
        this.symbols = symbols;
    }

    public void generate(List<Node> roots, EmissionBuffer out) {
        for (Node root : roots) {
            emit(root, 0, out);
        }
    }

    private void emit(Node node, int level, EmissionBuffer out) {
        int line = node.sourceLineNumber();
        switch (node.role()) {
            case COMMENT -> out.line(level, commentText(node));
            case ASSIGNMENT -> statement(node, node.key() + " = " + valueOf(node), level, out);
            case ARG_CALL -> statement(node, node.key() + "(" + argumentsOf(node) + ")", level, out);
            case BARE_CALL -> {
                String callee = node.value().substring(0, node.value().length() - 1).strip();
                statement(node, callee + "()", level, out);
            }
            case PRINT -> statement(node, "print(" + printArgument(node) + ")", level, out);
            case RETURN -> statement(node, node.hasValue() ? "return " + expr(node.value(), line) : "return", level, out);
            case IMPORT_LIST -> {
                for (Node entry : node.children()) {
                    if (entry.isComment()) {
                        out.line(level, commentText(entry));
                        continue;
                    }
                    out.line(level, importStatement(StatementSyntax.importPath(entry.value(), entry.sourceLineNumber())));
                    nestedComments(entry, level, out);
                }
            }
            case IF_HEADER -> block(node, "if " + expr(StatementSyntax.ifCondition(node.key(), line), line), level, out);
            case ELSE_HEADER -> block(node, "else", level, out);
            case FOR_HEADER, RANGE_FOR_HEADER -> block(node, forHeader(node), level, out);
            case FUNCTION_DEF -> {
                FunctionSignature signature = StatementSyntax.functionSignature(node.key(), line);
                String params = signature.hasParameter() ? signature.parameter() : "";
                block(node, "def " + signature.name() + "(" + params + ")", level, out);
            }
            default -> throw new IllegalStateException("Cannot emit " + node + " at this position");
        }
    }

    /** One-line statement followed by the comments kept inside it. */
    private static void statement(Node node, String text, int level, EmissionBuffer out) {
        out.line(level, text);
        nestedComments(node, level + 1, out);
    }

    private static void nestedComments(Node owner, int level, EmissionBuffer out) {
        for (Node child : owner.children()) {
            if (child.isComment()) {
                out.line(level, commentText(child));
            } else {
                nestedComments(child, level, out);
            }
        }
    }

    private static String commentText(Node comment) {
        return comment.value().isEmpty() ? "#" : "# " + comment.value();
    }

    private void block(Node header, String headerText, int level, EmissionBuffer out) {
        dialect.open(out, level, headerText);
        for (Node child : header.children()) {
            emit(child, level + 1, out);
        }
        dialect.close(out, level);
    }

    private String forHeader(Node node) {
        int line = node.sourceLineNumber();
        ForClause clause = StatementSyntax.forClause(node.key(), line);
        String iterable = expr(clause.iterable(), line);
        if (node.role() == Role.FOR_HEADER && clause.unpacksPairs() && StatementSyntax.isDottedIdentifier(iterable)) {
            iterable = iterable + ".items()";
        }
        return "for " + String.join(", ", clause.targets()) + " in " + iterable;
    }

    private static String importStatement(ImportPath path) {
        return path.isMember()
                ? "from " + path.module() + " import " + path.member()
                : "import " + path.module();
    }

    private String valueOf(Node node) {
        return node.hasBody() ? aggregate(node) : expr(node.value(), node.sourceLineNumber());
    }

    private String argumentsOf(Node call) {
        if (!call.hasBody()) {
            return expr(call.value(), call.sourceLineNumber());
        }
        List<String> args = new ArrayList<>();
        for (Node entry : entries(call)) {
            if (entry.role() == Role.DICT_ENTRY) {
                args.add(entry.key() + "=" + valueOf(entry));
            } else {
                args.add(itemOf(entry));
            }
        }
        return String.join(", ", args);
    }

    /** Dict or list literal built from the node's entries. */
    private String aggregate(Node owner) {
        List<Node> entries = entries(owner);
        boolean dict = !entries.isEmpty() && entries.get(0).role() == Role.DICT_ENTRY;
        if (dict) {
            return entries.stream()
                    .map(e -> dictKey(e.key()) + ": " + valueOf(e))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return entries.stream()
                .map(this::itemOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String itemOf(Node item) {
        String inline = StatementSyntax.stripListMarker(item.value());
        if (!item.hasBody()) {
            return expr(inline, item.sourceLineNumber());
        }
        String nested = aggregate(item);
        if (inline.isEmpty()) {
            return nested;
        }
        // inline content of a list item with properties is kept under 'item'
        String head = "'item': " + expr(inline, item.sourceLineNumber());
        return nested.equals("{}") ? "{" + head + "}" : "{" + head + ", " + nested.substring(1);
    }

    private static List<Node> entries(Node owner) {
        return owner.children().stream().filter(n -> !n.isComment()).toList();
    }

    private static String dictKey(String key) {
        boolean quoted = key.length() >= 2
                && (key.startsWith("\"") && key.endsWith("\"") || key.startsWith("'") && key.endsWith("'"));
        return quoted ? key : "'" + key.replace("'", "\\'") + "'";
    }

    private String printArgument(Node node) {
        if (!node.hasValue()) {
            return "";
        }
        String value = node.value();
        int line = node.sourceLineNumber();
        if (looksLikeBareText(value)) {
            return checked(translator.translateText(value, line), line);
        }
        return expr(value, line);
    }

    /**
     * Unquoted text with a {@code {name}} placeholder, e.g. {@code Hello {name}}
     * or {@code {name} says hi}. A value opening a string literal is an expression.
     */
    private static boolean looksLikeBareText(String value) {
        if (ExpressionTranslator.startsStringLiteral(value)) {
            return false;
        }
        int open = value.indexOf('{');
        return open >= 0 && value.indexOf('}', open) > open;
    }

    private String expr(String raw, int line) {
        return checked(translator.translate(raw, line), line);
    }

    private String checked(TranslatedExpression expression, int line) {
        for (String name : expression.identifiers()) {
            int dot = name.indexOf('.');
            if (dot > 0) {
                String root = name.substring(0, dot);
                if (!symbols.isBound(root) && warned.add(root)) {
                    log.warn("Line {}: '{}' is used but '{}' is not imported", line, name, root);
                }
            }
        }
        log.trace("Line {}: {}", line, expression.text());
        return expression.text();
    }
}
