package io.regtransport.client;

import java.net.URI;
import java.util.NoSuchElementException;

import io.regtransport.client.http.HttpResponse;
import io.regtransport.spec.RegistryClientException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pages of a paginated registry listing.
 * <p>
 * A forward-only, lazy sequence: each {@link #next()} issues exactly one authenticated request
 * and the URL of the following page is taken from the response's {@code link} header. Relative
 * links are resolved against the page that returned them. Iteration ends when a page carries no
 * {@code rel="next"} link whose target is a valid URI, or after a page request fails.
 * Not thread-safe.
 *
 * <pre>{@code
 * PaginatedResponses pages = transport.paginatedRequest(catalogUrl, Set.of(200));
 * while (pages.hasNext()) {
 *     HttpResponse page = pages.next();
 *     ...
 * }
 * }</pre>
 */
public final class PaginatedResponses {

    private static final Logger LOGGER = LoggerFactory.getLogger(PaginatedResponses.class);

    private final RegistryTransport transport;
    private final RegistryRequest request;
    private @Nullable String nextUrl;

    PaginatedResponses(RegistryTransport transport, RegistryRequest request) {
        this.transport = transport;
        this.request = request;
        this.nextUrl = request.url();
    }

    public boolean hasNext() {
        return nextUrl != null;
    }

    /**
     * Fetches the next page.
     *
     * @return the response for the page
     * @throws NoSuchElementException if there are no more pages
     * @throws RegistryClientException if the page request fails; iteration ends
     */
    public HttpResponse next() throws RegistryClientException {
        String url = nextUrl;
        if (url == null) {
            throw new NoSuchElementException("No more pages for " + request);
        }
        nextUrl = null;

        HttpResponse response = transport.request(request.withUrl(url));
        nextUrl = HttpUtils.parseNextLinkHeader(response)
                .map(next -> resolve(url, next))
                .orElse(null);
        return response;
    }

    private static @Nullable String resolve(String url, String next) {
        try {
            return URI.create(url).resolve(next).toString();
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Ignoring unusable next link {} on {}: {}", next, url, e.getMessage());
            return null;
        }
    }
}
