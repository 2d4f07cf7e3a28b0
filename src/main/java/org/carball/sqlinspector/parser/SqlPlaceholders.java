package org.carball.sqlinspector.parser;

import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Finds bind placeholders in SQL text: {@code ?} for positional and
 * {@code :name} for named parameters. Placeholders inside string literals,
 * quoted identifiers and comments are left alone, as are {@code ::type} casts.
 */
public final class SqlPlaceholders {

    private SqlPlaceholders() {
        // Utility class - prevent instantiation
    }

    /**
     * Rewrites every placeholder with the text returned by the matching function.
     * A {@code null} replacement keeps the placeholder unchanged.
     *
     * @param positional receives the 0-based index of each {@code ?}
     * @param named      receives the name of each {@code :name}
     */
    public static String replace(String sql, IntFunction<String> positional, Function<String, String> named) {
        StringBuilder out = new StringBuilder(sql.length());
        int positionalIndex = 0;
        int i = 0;
        int length = sql.length();

        while (i < length) {
            char c = sql.charAt(i);

            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? length : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(sql, i, end);
                i = end;
            } else if (c == '?') {
                String replacement = positional.apply(positionalIndex++);
                out.append(replacement != null ? replacement : "?");
                i++;
            } else if (c == ':' && isNamedPlaceholderStart(sql, i)) {
                int end = i + 1;
                while (end < length && isIdentifierPart(sql.charAt(end))) {
                    end++;
                }
                String name = sql.substring(i + 1, end);
                String replacement = named.apply(name);
                out.append(replacement != null ? replacement : sql.substring(i, end));
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }

        return out.toString();
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // a doubled quote is an escaped quote inside the literal
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static boolean isNamedPlaceholderStart(String sql, int colon) {
        boolean afterColon = colon > 0 && sql.charAt(colon - 1) == ':';
        boolean hasName = colon + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(colon + 1))
                && sql.charAt(colon + 1) != '$';
        return !afterColon && hasName;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
