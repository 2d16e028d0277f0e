package tally.system.filter;

import jakarta.ws.rs.container.ContainerRequestContext;

import io.vertx.core.http.HttpServerRequest;

/**
 * Resolves the client address of a request.
 *
 * <p>Priority: RFC 7239 {@code Forwarded}, then the first {@code X-Forwarded-For} entry, then
 * {@code X-Real-IP}, then the socket peer address.
 */
public final class ClientAddressResolver {

    static final String UNKNOWN = "unknown";

    private ClientAddressResolver() {}

    public static String resolve(ContainerRequestContext ctx, HttpServerRequest request) {
        final var forwarded = ctx.getHeaderString("Forwarded");
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null && !ip.isBlank()) {
                return ip;
            }
        }

        final var xForwardedFor = ctx.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            final var first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        final var realIp = ctx.getHeaderString("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        if (request != null && request.remoteAddress() != null) {
            final var host = request.remoteAddress().hostAddress();
            if (host != null) {
                return host;
            }
        }
        return UNKNOWN;
    }

    /**
     * Parse the client IP from RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is the one closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase().startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                // IPv6: address is inside the brackets, port follows them
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value;
            }
        }
        return null;
    }
}
