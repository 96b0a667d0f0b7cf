package org.learningjava.pyml.domain.service.classify;

import org.learningjava.pyml.domain.error.ClassificationException;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of the statement shapes shared by the classifier and the code generator.
 */
public final class StatementSyntax {

    public static final String IF = "if";
    public static final String ELSE = "else";
    public static final String FOR = "for";
    public static final String FUNCTION = "function";
    public static final String PRINT = "print";
    public static final String RETURN = "return";
    public static final String PACKAGES = "packages";
    public static final String NO_PARAMETER = "_";
    public static final String LIST_MARKER = "-";
    public static final String RANGE_PREFIX = "range.";

    public static final Set<String> RESERVED = Set.of(IF, ELSE, FOR, FUNCTION, PRINT, RETURN, PACKAGES);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DOTTED_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern FOR_CLAUSE = Pattern.compile("for\\s+(.+?)\\s+in\\s+(.+)");
    private static final Pattern FUNCTION_SIGNATURE = Pattern.compile("function\\s+(\\S+)\\s+define\\s+(.+)");

    public record ForClause(List<String> targets, String iterable) {

        public boolean isRange() {
            return iterable.startsWith(RANGE_PREFIX);
        }

        public boolean unpacksPairs() {
            return targets.size() > 1;
        }
    }

    public record FunctionSignature(String name, String parameter) {

        public boolean hasParameter() {
            return parameter != null;
        }
    }

    /** Module import ({@code math}) or member import ({@code time.sleep}). */
    public record ImportPath(String module, String member) {

        public boolean isMember() {
            return member != null;
        }

        /** Name under which the import is reachable in generated code. */
        public String boundName() {
            return isMember() ? member : module;
        }
    }

    private StatementSyntax() {
    }

    public static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches();
    }

    public static boolean isDottedIdentifier(String s) {
        return s != null && DOTTED_IDENTIFIER.matcher(s).matches();
    }

    /** First whitespace-separated word of a key, or the key itself. */
    public static String leadingWord(String key) {
        String trimmed = key.strip();
        int space = indexOfWhitespace(trimmed);
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    public static boolean isListItem(String content) {
        return content != null && content.startsWith(LIST_MARKER);
    }

    public static String stripListMarker(String content) {
        return isListItem(content) ? content.substring(LIST_MARKER.length()).strip() : content.strip();
    }

    public static String ifCondition(String key, int line) {
        String condition = key.strip().substring(IF.length()).strip();
        if (condition.isEmpty()) {
            throw new ClassificationException(line, "'if' requires a condition");
        }
        return condition;
    }

    public static ForClause forClause(String key, int line) {
        Matcher m = FOR_CLAUSE.matcher(key.strip());
        if (!m.matches()) {
            throw new ClassificationException(line, "expected 'for <name> in <iterable>', got '" + key + "'");
        }
        List<String> targets = Arrays.stream(m.group(1).split(","))
                .map(String::strip)
                .toList();
        for (String target : targets) {
            if (!isIdentifier(target)) {
                throw new ClassificationException(line, "invalid loop variable '" + target + "'");
            }
        }
        return new ForClause(targets, m.group(2).strip());
    }

    public static FunctionSignature functionSignature(String key, int line) {
        Matcher m = FUNCTION_SIGNATURE.matcher(key.strip());
        if (!m.matches()) {
            throw new ClassificationException(line, "expected 'function <name> define <parameter>', got '" + key + "'");
        }
        String name = m.group(1);
        String parameter = m.group(2).strip();
        if (!isIdentifier(name) || StatementSyntax.RESERVED.contains(name)) {
            throw new ClassificationException(line, "invalid function name '" + name + "'");
        }
        if (parameter.equals(NO_PARAMETER)) {
            return new FunctionSignature(name, null);
        }
        if (!isIdentifier(parameter)) {
            throw new ClassificationException(line,
                    "function '" + name + "' must declare a single parameter or '_', got '" + parameter + "'");
        }
        return new FunctionSignature(name, parameter);
    }

    public static ImportPath importPath(String content, int line) {
        String path = stripListMarker(content);
        if (!isDottedIdentifier(path)) {
            throw new ClassificationException(line, "invalid package path '" + path + "'");
        }
        int dot = path.lastIndexOf('.');
        return dot < 0
                ? new ImportPath(path, null)
                : new ImportPath(path.substring(0, dot), path.substring(dot + 1));
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
