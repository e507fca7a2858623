package com.ipcsentinel.core.sender;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;

/**
 * Checks the frame a call came from before anything else looks at it.
 *
 * <p>
 * Rules, in order:
 * </p>
 * <ol>
 * <li>no frame – rejected</li>
 * <li>URL that does not parse to an absolute URL – rejected</li>
 * <li>nested frame (iframe) – rejected whatever its origin</li>
 * <li>non-empty allow-list without the frame's origin – rejected</li>
 * </ol>
 *
 * <p>
 * Origins follow web-origin serialization: {@code scheme://host[:port]} with
 * the port dropped when it is the scheme's default. {@code file:} URLs have
 * the origin {@code file://}; other URLs without a host have the opaque
 * origin {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SenderValidator {

    public static final String REASON_NO_FRAME = "no sender frame";
    public static final String REASON_IFRAME = "IPC from iframe not allowed";
    public static final String REASON_ORIGIN = "origin not in allowlist";
    public static final String REASON_INVALID_URL = "invalid sender URL";

    static final String OPAQUE_ORIGIN = "null";

    private SenderValidator() {
        // utility class — not instantiable
    }

    /**
     * Validate a sender frame without origin restrictions.
     */
    public static SenderValidationResult validateSender(SenderFrame frame) {
        return validateSender(frame, null);
    }

    /**
     * Validate a sender frame.
     *
     * @param frame          caller frame, may be {@code null}
     * @param allowedOrigins permitted origins; {@code null} or empty disables
     *                       the origin check
     * @return the verdict, never {@code null}
     */
    public static SenderValidationResult validateSender(SenderFrame frame, Collection<String> allowedOrigins) {
        if (frame == null) {
            return SenderValidationResult.invalid(REASON_NO_FRAME);
        }

        String origin;
        try {
            origin = originOf(frame.getUrl());
        } catch (IllegalArgumentException e) {
            return SenderValidationResult.invalid(REASON_INVALID_URL);
        }

        if (frame.hasParentFrame()) {
            return SenderValidationResult.invalid(REASON_IFRAME, origin, frame.getFrameId());
        }

        if (allowedOrigins != null && !allowedOrigins.isEmpty() && !allowedOrigins.contains(origin)) {
            return SenderValidationResult.invalid(REASON_ORIGIN, origin, frame.getFrameId());
        }

        return SenderValidationResult.valid(origin, frame.getFrameId());
    }

    /**
     * Serialize the origin of a URL.
     *
     * @param url absolute URL
     * @return origin string
     * @throws IllegalArgumentException if the URL is missing, malformed or
     *                                  relative
     */
    public static String originOf(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("URL has no scheme: " + url);
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if ("file".equals(scheme)) {
            return "file://";
        }
        if (uri.isOpaque()) {
            return OPAQUE_ORIGIN;
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            if (isSpecialScheme(scheme)) {
                throw new IllegalArgumentException("URL has no host: " + url);
            }
            return OPAQUE_ORIGIN;
        }

        StringBuilder origin = new StringBuilder(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && port != defaultPort(scheme)) {
            origin.append(':').append(port);
        }
        return origin.toString();
    }

    private static boolean isSpecialScheme(String scheme) {
        return defaultPort(scheme) != -1;
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http", "ws" -> 80;
            case "https", "wss" -> 443;
            case "ftp" -> 21;
            default -> -1;
        };
    }
}
