package com.whereq.vigil.validation;

import com.whereq.vigil.exception.ScanValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits free-form option strings on POSIX shell-word boundaries and re-quotes every
 * token so that no token can carry additional shell syntax.
 * <p>
 * {@code sanitize(sanitize(s))} tokenizes to the same words as {@code sanitize(s)}.
 */
public final class ArgumentSanitizer {

    private static final Pattern SAFE_TOKEN = Pattern.compile("^[A-Za-z0-9_@%+=:,./-]+$");

    private ArgumentSanitizer() {
    }

    /**
     * Tokenize and re-quote an argument string, joining tokens with single spaces
     *
     * @throws ScanValidationException on an unterminated quote or trailing escape
     */
    public static String sanitize(String arguments) {
        return tokenize(arguments).stream()
            .map(ArgumentSanitizer::quote)
            .collect(Collectors.joining(" "));
    }

    /**
     * POSIX shell-word splitting: whitespace separates words, single quotes are literal,
     * double quotes allow backslash escapes of {@code \ " $ `} and newline,
     * a bare backslash escapes the next character.
     */
    public static List<String> tokenize(String arguments) {
        List<String> tokens = new ArrayList<>();
        if (arguments == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int length = arguments.length();

        while (i < length) {
            char c = arguments.charAt(i);

            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int close = arguments.indexOf('\'', i + 1);
                if (close < 0) {
                    throw new ScanValidationException("No closing quotation in arguments: " + arguments);
                }
                current.append(arguments, i + 1, close);
                inToken = true;
                i = close + 1;
            } else if (c == '"') {
                i++;
                boolean closed = false;
                while (i < length) {
                    char d = arguments.charAt(i);
                    if (d == '"') {
                        closed = true;
                        i++;
                        break;
                    }
                    if (d == '\\' && i + 1 < length && "\\\"$`\n".indexOf(arguments.charAt(i + 1)) >= 0) {
                        current.append(arguments.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    current.append(d);
                    i++;
                }
                if (!closed) {
                    throw new ScanValidationException("No closing quotation in arguments: " + arguments);
                }
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new ScanValidationException("No escaped character in arguments: " + arguments);
                }
                current.append(arguments.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Quote a single word for a POSIX shell. Safe words are returned unchanged.
     */
    public static String quote(String token) {
        if (token.isEmpty()) {
            return "''";
        }
        if (SAFE_TOKEN.matcher(token).matches()) {
            return token;
        }
        return "'" + token.replace("'", "'\"'\"'") + "'";
    }
}
