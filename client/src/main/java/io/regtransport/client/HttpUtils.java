package io.regtransport.client;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.regtransport.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;

/**
 * URL and header helpers for the Registry v2 wire protocol.
 */
public final class HttpUtils {

    private static final Pattern NEXT_LINK = Pattern.compile(".*<(.+)>;\\s*rel=\"next\".*");

    private HttpUtils() {
    }

    /**
     * Returns the scheme used to reach a registry: {@code http} for {@code localhost:<port>},
     * {@code https} for everything else.
     *
     * @param registry the registry host
     * @return the scheme
     */
    public static String scheme(String registry) {
        return registry.startsWith("localhost:") ? "http" : "https";
    }

    /**
     * Extracts the {@code rel="next"} target of an RFC 5988 {@code link} header.
     *
     * @param link the header value, may be {@code null}
     * @return the next URL, or empty if the header is absent or has no next relation
     */
    public static Optional<String> parseNextLinkHeader(@Nullable String link) {
        if (link == null || link.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = NEXT_LINK.matcher(link);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    public static Optional<String> parseNextLinkHeader(HttpResponse response) {
        return parseNextLinkHeader(response.firstHeader("link").orElse(null));
    }
}
