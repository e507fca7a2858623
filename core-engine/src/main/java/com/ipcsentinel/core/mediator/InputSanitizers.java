package com.ipcsentinel.core.mediator;

import com.ipcsentinel.core.exception.InvalidInputException;

import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Denylist sanitizers for common argument shapes.
 *
 * <p>
 * These are a second line of defense: they reject the obvious traversal and
 * injection shapes, but alternate encodings can get past them. Parameterized
 * queries and canonical path checks at the point of use remain necessary.
 * </p>
 *
 * <p>
 * Both methods are pure and throw {@link InvalidInputException} (without a
 * channel) on rejection. {@link #PATH} and {@link #SQL} adapt them for
 * {@link HandlerOptions.Builder#sanitizer}.
 * </p>
 *
 * @since 1.0.0
 */
public final class InputSanitizers {

    private static final List<String> TRAVERSAL_SEQUENCES = List.of(
            "../", "..\\",
            "%2e%2e/", "%2e%2e\\",
            "%2e%2e%2f", "%2e%2e%5c",
            "..%2f", "..%5c");

    private static final List<Pattern> SQL_DENYLIST = List.of(
            Pattern.compile(";\\s*DROP", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*DELETE", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*UPDATE", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*INSERT", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*"),
            Pattern.compile("\\*/"),
            Pattern.compile("\\bUNION\\b.*\\bSELECT\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\bOR\\b.*=.*\\bOR\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL));

    private static final Pattern BACKSLASHES = Pattern.compile("\\\\");
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/+");

    /** {@link #sanitizePath(String)} as a handler sanitizer. */
    public static final UnaryOperator<Object> PATH = arg -> sanitizePath(requireString(arg));

    /** {@link #sanitizeSql(String)} as a handler sanitizer. */
    public static final UnaryOperator<Object> SQL = arg -> sanitizeSql(requireString(arg));

    private InputSanitizers() {
        // utility class — not instantiable
    }

    /**
     * Reject directory traversal and normalize separators.
     *
     * @param path raw path from the caller
     * @return the path with {@code \} turned into {@code /} and repeated
     *         {@code /} collapsed
     * @throws InvalidInputException if the path contains a traversal sequence
     */
    public static String sanitizePath(String path) {
        if (path == null) {
            throw new InvalidInputException(null, "Path must not be null");
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String sequence : TRAVERSAL_SEQUENCES) {
            if (lower.contains(sequence)) {
                throw new InvalidInputException(null, "Path traversal detected");
            }
        }
        String forward = BACKSLASHES.matcher(path).replaceAll("/");
        return REPEATED_SLASHES.matcher(forward).replaceAll("/");
    }

    /**
     * Reject query text matching a known injection shape.
     *
     * @param query raw query fragment
     * @return the query unchanged
     * @throws InvalidInputException if a denylisted pattern matches
     */
    public static String sanitizeSql(String query) {
        if (query == null) {
            throw new InvalidInputException(null, "Query must not be null");
        }
        for (Pattern pattern : SQL_DENYLIST) {
            if (pattern.matcher(query).find()) {
                throw new InvalidInputException(null, "Potential SQL injection detected");
            }
        }
        return query;
    }

    private static String requireString(Object arg) {
        if (!(arg instanceof String s)) {
            throw new InvalidInputException(null, "Expected a string argument");
        }
        return s;
    }
}
