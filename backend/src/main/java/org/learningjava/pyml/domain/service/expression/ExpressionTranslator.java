package org.learningjava.pyml.domain.service.expression;

import org.learningjava.pyml.domain.error.TranslationException;
import org.learningjava.pyml.domain.model.expression.TranslatedExpression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Translates a raw PyML value into a Python expression.
 * <p>
 * Operators and dotted references are host syntax already and pass through
 * untouched. The translator rewrites literal spellings, {@code range.A.B[.C]}
 * sugar and interpolated strings, and checks that quotes and brackets balance.
 */
public class ExpressionTranslator {

    private static final Map<String, String> LITERALS = Map.of(
            "true", "True",
            "false", "False",
            "null", "None"
    );

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "lambda", "for",
            "True", "False", "None"
    );

    private static final Set<String> STRING_PREFIXES = Set.of(
            "f", "r", "b", "u", "fr", "rf", "br", "rb"
    );

    private static final Pattern RANGE_COMPONENT = Pattern.compile("-?[0-9]+|[A-Za-z_][A-Za-z0-9_]*");

    private static final String RANGE = "range";

    public TranslatedExpression translate(String raw, int line) {
        return new Scan(raw, line).run();
    }

    /**
     * Turns free text such as {@code Hello {name}} into a quoted, interpolated
     * string literal.
     */
    public TranslatedExpression translateText(String text, int line) {
        String quoted = "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        return translate(quoted, line);
    }

    /** Whether the value opens with a quote, optionally behind a string prefix such as {@code f} or {@code rb}. */
    public static boolean startsStringLiteral(String value) {
        int letters = 0;
        while (letters < value.length() && letters < 2 && Character.isLetter(value.charAt(letters))) {
            letters++;
        }
        if (letters >= value.length()) {
            return false;
        }
        char c = value.charAt(letters);
        return (c == '"' || c == '\'')
                && (letters == 0 || STRING_PREFIXES.contains(value.substring(0, letters).toLowerCase()));
    }

    /** One left-to-right pass over a raw value. */
    private final class Scan {

        private final String src;
        private final int line;
        private final StringBuilder out = new StringBuilder();
        private final Set<String> identifiers = new LinkedHashSet<>();
        private final Deque<Character> brackets = new ArrayDeque<>();
        private int pos;
        private boolean afterDot;

        Scan(String src, int line) {
            this.src = src;
            this.line = line;
        }

        TranslatedExpression run() {
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '"' || c == '\'') {
                    out.append(string(""));
                    afterDot = false;
                } else if (Character.isLetter(c) || c == '_') {
                    word();
                } else if (Character.isDigit(c)) {
                    number();
                    afterDot = false;
                } else {
                    bracket(c);
                    out.append(c);
                    pos++;
                    if (!Character.isWhitespace(c)) {
                        afterDot = c == '.';
                    }
                }
            }
            if (!brackets.isEmpty()) {
                throw new TranslationException(line, "unbalanced '" + brackets.peek() + "' in '" + src + "'");
            }
            return new TranslatedExpression(out.toString(), identifiers);
        }

        private void bracket(char c) {
            switch (c) {
                case '(', '[', '{' -> brackets.push(c);
                case ')', ']', '}' -> {
                    char expected = c == ')' ? '(' : c == ']' ? '[' : '{';
                    if (brackets.isEmpty() || brackets.peek() != expected) {
                        throw new TranslationException(line, "unbalanced '" + c + "' in '" + src + "'");
                    }
                    brackets.pop();
                }
                default -> {
                }
            }
        }

        private void word() {
            int start = pos;
            while (pos < src.length() && isWordChar(src.charAt(pos))) {
                pos++;
            }
            String name = src.substring(start, pos);

            if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                    && STRING_PREFIXES.contains(name.toLowerCase())) {
                out.append(string(name));
                afterDot = false;
                return;
            }

            if (!afterDot && name.equals(RANGE) && pos < src.length() && src.charAt(pos) == '.') {
                out.append(range());
                afterDot = false;
                return;
            }

            if (!afterDot && LITERALS.containsKey(name.toLowerCase()) && !followedBy('.') && !followedBy('(')) {
                out.append(LITERALS.get(name.toLowerCase()));
                afterDot = false;
                return;
            }

            out.append(name);
            if (!afterDot && !KEYWORDS.contains(name) && !followedBy('=')) {
                identifiers.add(name + trailingAttributes());
            }
            afterDot = false;
        }

        /** Dotted attribute chain that directly follows a name, without consuming it. */
        private String trailingAttributes() {
            int p = pos;
            while (p + 1 < src.length() && src.charAt(p) == '.'
                    && (Character.isLetter(src.charAt(p + 1)) || src.charAt(p + 1) == '_')) {
                int end = p + 1;
                while (end < src.length() && isWordChar(src.charAt(end))) {
                    end++;
                }
                p = end;
            }
            return src.substring(pos, p);
        }

        private boolean followedBy(char c) {
            int p = pos;
            while (p < src.length() && src.charAt(p) == ' ') {
                p++;
            }
            if (p >= src.length() || src.charAt(p) != c) {
                return false;
            }
            // '==' is a comparison, a single '=' is a keyword argument
            return c != '=' || p + 1 >= src.length() || src.charAt(p + 1) != '=';
        }

        private void number() {
            int start = pos;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                boolean exponentSign = (c == '+' || c == '-')
                        && (src.charAt(pos - 1) == 'e' || src.charAt(pos - 1) == 'E')
                        && Character.isDigit(src.charAt(start));
                if (Character.isLetterOrDigit(c) || c == '_' || exponentSign
                        || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))
                        || (c == '.' && (pos + 1 == src.length() || !Character.isLetter(src.charAt(pos + 1))))) {
                    pos++;
                } else {
                    break;
                }
            }
            out.append(src, start, pos);
        }

        /** {@code range.A.B[.C]} starting at the dot after {@code range}. */
        private String range() {
            List<String> components = new ArrayList<>();
            while (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                int start = pos;
                if (pos < src.length() && src.charAt(pos) == '-') {
                    pos++;
                }
                while (pos < src.length() && isWordChar(src.charAt(pos))) {
                    pos++;
                }
                String component = src.substring(start, pos);
                if (!RANGE_COMPONENT.matcher(component).matches()) {
                    throw new TranslationException(line, "invalid range component '" + component + "' in '" + src + "'");
                }
                components.add(component);
            }
            if (components.size() < 2 || components.size() > 3) {
                throw new TranslationException(line, "range takes 2 or 3 dotted components (start.stop[.step]), got "
                        + components.size() + " in '" + src + "'");
            }
            for (String component : components) {
                if (!Character.isDigit(component.charAt(component.length() - 1))) {
                    identifiers.add(component);
                }
            }
            return RANGE + "(" + String.join(", ", components) + ")";
        }

        /**
         * Reads a quoted literal at {@code pos}. Strings with {@code {expr}}
         * placeholders become f-strings, each placeholder translated on its own.
         */
        private String string(String prefix) {
            char quote = src.charAt(pos);
            int start = pos + 1;
            int end = start;
            while (end < src.length() && src.charAt(end) != quote) {
                if (src.charAt(end) == '\\') {
                    end++;
                }
                end++;
            }
            if (end >= src.length()) {
                throw new TranslationException(line, "unterminated string in '" + src + "'");
            }
            pos = end + 1;

            String body = src.substring(start, end);
            String lower = prefix.toLowerCase();
            if (lower.contains("r") && !lower.contains("f") || lower.contains("b")) {
                return prefix + quote + body + quote;
            }

            Interpolation interpolation = interpolate(body);
            if (!interpolation.placeholders() && !interpolation.escapedBraces() && !lower.contains("f")) {
                return prefix + quote + body + quote;
            }
            if (interpolation.strayBrace()) {
                throw new TranslationException(line, "single '}' in interpolated string '" + src + "'");
            }
            String fPrefix = lower.contains("f") ? prefix : "f" + prefix;
            return fPrefix + quote + interpolation.text() + quote;
        }

        private record Interpolation(String text, boolean placeholders, boolean escapedBraces, boolean strayBrace) {}

        private Interpolation interpolate(String body) {
            StringBuilder sb = new StringBuilder();
            boolean placeholders = false;
            boolean escapedBraces = false;
            boolean strayBrace = false;
            int i = 0;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (c == '\\' && i + 1 < body.length()) {
                    sb.append(c).append(body.charAt(i + 1));
                    i += 2;
                } else if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                    sb.append("{{");
                    escapedBraces = true;
                    i += 2;
                } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                    sb.append("}}");
                    escapedBraces = true;
                    i += 2;
                } else if (c == '{') {
                    int close = closingBrace(body, i);
                    sb.append('{').append(placeholder(body.substring(i + 1, close))).append('}');
                    placeholders = true;
                    i = close + 1;
                } else if (c == '}') {
                    strayBrace = true;
                    sb.append(c);
                    i++;
                } else {
                    sb.append(c);
                    i++;
                }
            }
            return new Interpolation(sb.toString(), placeholders, escapedBraces, strayBrace);
        }

        private int closingBrace(String body, int open) {
            int depth = 0;
            char quote = 0;
            for (int i = open; i < body.length(); i++) {
                char c = body.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return i;
                }
            }
            throw new TranslationException(line, "unterminated interpolation in '" + src + "'");
        }

        /** Translates {@code expr} or {@code expr:spec}; the format spec is kept verbatim. */
        private String placeholder(String content) {
            String expr = content;
            String spec = "";
            int split = formatSpecStart(content);
            if (split >= 0) {
                expr = content.substring(0, split);
                spec = content.substring(split);
            }
            if (expr.isBlank()) {
                throw new TranslationException(line, "empty interpolation placeholder in '" + src + "'");
            }
            TranslatedExpression inner = translate(expr.strip(), line);
            identifiers.addAll(inner.identifiers());
            return inner.text() + spec;
        }

        private int formatSpecStart(String content) {
            int depth = 0;
            char quote = 0;
            for (int i = 0; i < content.length(); i++) {
                char c = content.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                } else if (depth == 0 && (c == ':' || (c == '!' && i + 1 < content.length()
                        && content.charAt(i + 1) != '='))) {
                    return i;
                }
            }
            return -1;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
