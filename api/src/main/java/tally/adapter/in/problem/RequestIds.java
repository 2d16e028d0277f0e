package tally.adapter.in.problem;

import java.util.UUID;

import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Correlation id handling shared by filters and exception mappers.
 *
 * <p>An inbound {@code X-Request-ID} header is reused; otherwise a random id is generated once
 * per request and stored as a request property.
 */
public final class RequestIds {

    public static final String HEADER = "X-Request-ID";
    static final String PROPERTY = "tally.request.id";
    private static final int MAX_LENGTH = 128;

    private RequestIds() {}

    public static String resolve(ContainerRequestContext ctx) {
        final var existing = ctx.getProperty(PROPERTY);
        if (existing instanceof String id) {
            return id;
        }
        final var header = ctx.getHeaderString(HEADER);
        final var id = header != null && !header.isBlank() && header.length() <= MAX_LENGTH
                ? header.trim()
                : UUID.randomUUID().toString();
        ctx.setProperty(PROPERTY, id);
        return id;
    }
}
