package org.sessionstate.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles matcher expressions used by associations and filters.
 * <p>
 * An expression is a sequence of matchers, each optionally negated with
 * {@code !}:
 * <ul>
 *   <li>{@code {*.jpg,*.png}} - globs over file names ({@code ,,} is a literal comma)</li>
 *   <li>{@code {{/tmp/*}}} - globs over full paths</li>
 *   <li>{@code /regex/flags} - regular expression over file names ({@code i} flag)</li>
 *   <li>{@code //regex//flags} - regular expression over full paths</li>
 *   <li>{@code <image/*>} - mime types; never match by name</li>
 * </ul>
 * A bare expression without brackets is treated as a glob list. A path
 * matches when every matcher of the expression matches it.
 */
public final class Matchers {

    private Matchers() {}

    /**
     * @param expr matcher expression
     * @return predicate over paths
     * @throws InvalidMatcherException on empty, unbalanced or invalid expressions
     */
    public static Predicate<String> compile(String expr) throws InvalidMatcherException {
        if (expr == null || expr.isBlank()) {
            throw new InvalidMatcherException(expr, "Empty matcher");
        }
        String s = expr.strip();
        char first = s.charAt(0);
        if (first != '{' && first != '/' && first != '<' && first != '!') {
            return globs(s, s, false);
        }

        List<Predicate<String>> parts = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            boolean negated = c == '!';
            if (negated) {
                i++;
                if (i >= s.length()) {
                    throw new InvalidMatcherException(expr, "Dangling negation");
                }
            }
            int[] end = new int[1];
            Predicate<String> p = single(expr, s, i, end);
            parts.add(negated ? p.negate() : p);
            i = end[0];
        }
        return path -> parts.stream().allMatch(p -> p.test(path));
    }

    /**
     * Compiles a manual filter, which is a plain regular expression. An empty
     * expression matches nothing.
     */
    public static Pattern compileFilter(String expr) throws InvalidMatcherException {
        if (expr == null || expr.isEmpty()) {
            return Pattern.compile("(?!)");
        }
        try {
            return Pattern.compile(expr);
        } catch (PatternSyntaxException e) {
            throw new InvalidMatcherException(expr, e.getDescription(), e);
        }
    }

    private static Predicate<String> single(String expr, String s, int i, int[] end)
            throws InvalidMatcherException {
        if (s.startsWith("{{", i)) {
            int close = s.indexOf("}}", i + 2);
            if (close < 0) throw new InvalidMatcherException(expr, "Unclosed {{");
            end[0] = close + 2;
            return globs(expr, s.substring(i + 2, close), true);
        }
        if (s.charAt(i) == '{') {
            int close = s.indexOf('}', i + 1);
            if (close < 0) throw new InvalidMatcherException(expr, "Unclosed {");
            end[0] = close + 1;
            return globs(expr, s.substring(i + 1, close), false);
        }
        if (s.startsWith("//", i)) {
            int close = s.indexOf("//", i + 2);
            if (close < 0) throw new InvalidMatcherException(expr, "Unclosed //");
            int flagsEnd = flagsEnd(s, close + 2);
            end[0] = flagsEnd;
            return regex(expr, s.substring(i + 2, close), s.substring(close + 2, flagsEnd), true);
        }
        if (s.charAt(i) == '/') {
            int close = s.indexOf('/', i + 1);
            if (close < 0) throw new InvalidMatcherException(expr, "Unclosed /");
            int flagsEnd = flagsEnd(s, close + 1);
            end[0] = flagsEnd;
            return regex(expr, s.substring(i + 1, close), s.substring(close + 1, flagsEnd), false);
        }
        if (s.charAt(i) == '<') {
            int close = s.indexOf('>', i + 1);
            if (close < 0) throw new InvalidMatcherException(expr, "Unclosed <");
            if (close == i + 1) throw new InvalidMatcherException(expr, "Empty mime pattern");
            end[0] = close + 1;
            return path -> false;
        }
        throw new InvalidMatcherException(expr, "Unexpected character '" + s.charAt(i) + "'");
    }

    private static int flagsEnd(String s, int from) {
        int i = from;
        while (i < s.length() && (s.charAt(i) == 'i' || s.charAt(i) == 'I')) {
            i++;
        }
        return i;
    }

    private static Predicate<String> regex(String expr, String body, String flags, boolean fullPath)
            throws InvalidMatcherException {
        if (body.isEmpty()) {
            throw new InvalidMatcherException(expr, "Empty regular expression");
        }
        // last flag wins
        boolean ignoreCase = flags.lastIndexOf('i') > flags.lastIndexOf('I');
        try {
            Pattern p = Pattern.compile(body, ignoreCase ? Pattern.CASE_INSENSITIVE : 0);
            return path -> p.matcher(fullPath ? path : name(path)).find();
        } catch (PatternSyntaxException e) {
            throw new InvalidMatcherException(expr, e.getDescription(), e);
        }
    }

    private static Predicate<String> globs(String expr, String body, boolean fullPath)
            throws InvalidMatcherException {
        List<Pattern> patterns = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == ',') {
                if (i + 1 < body.length() && body.charAt(i + 1) == ',') {
                    current.append(',');
                    i++;
                    continue;
                }
                patterns.add(globToPattern(expr, current.toString()));
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        patterns.add(globToPattern(expr, current.toString()));
        return path -> {
            String subject = fullPath ? path : name(path);
            return patterns.stream().anyMatch(p -> p.matcher(subject).matches());
        };
    }

    private static Pattern globToPattern(String expr, String glob) throws InvalidMatcherException {
        if (glob.isEmpty()) {
            throw new InvalidMatcherException(expr, "Empty glob");
        }
        StringBuilder re = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> re.append("[^/]*");
                case '?' -> re.append("[^/]");
                case '[' -> {
                    int close = glob.indexOf(']', i + 2);
                    if (close < 0) {
                        throw new InvalidMatcherException(expr, "Unclosed [ in glob");
                    }
                    String cls = glob.substring(i + 1, close);
                    if (cls.startsWith("!")) {
                        cls = "^" + cls.substring(1);
                    }
                    re.append('[').append(cls.replace("\\", "\\\\")).append(']');
                    i = close;
                }
                default -> re.append(Pattern.quote(String.valueOf(c)));
            }
        }
        try {
            return Pattern.compile(re.toString(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new InvalidMatcherException(expr, e.getDescription(), e);
        }
    }

    private static String name(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
