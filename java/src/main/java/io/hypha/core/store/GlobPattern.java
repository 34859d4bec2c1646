package io.hypha.core.store;

import java.util.regex.Pattern;

/**
 * Redis-style glob: {@code *} any run, {@code ?} any single character, {@code [abc]} / {@code [^a-z]}
 * classes, {@code \} escapes the next character.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder out = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    out.append(".*");
                    break;
                case '?':
                    out.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i++;
                        out.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        out.append(Pattern.quote("\\"));
                    }
                    break;
                case '[':
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        out.append(Pattern.quote("["));
                        break;
                    }
                    out.append(characterClass(glob.substring(i + 1, close)));
                    i = close;
                    break;
                default:
                    out.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return new GlobPattern(glob, Pattern.compile(out.toString(), Pattern.DOTALL));
    }

    /**
     * Escapes glob metacharacters so {@code value} only matches itself.
     */
    public static String literal(String value) {
        StringBuilder out = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    public boolean matches(String key) {
        return regex.matcher(key).matches();
    }

    public boolean isLiteral() {
        return glob.indexOf('*') < 0 && glob.indexOf('?') < 0 && glob.indexOf('[') < 0 && glob.indexOf('\\') < 0;
    }

    @Override
    public String toString() {
        return glob;
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int start = 0;
        if (body.startsWith("^")) {
            cls.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }
}
