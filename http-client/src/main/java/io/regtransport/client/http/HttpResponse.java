package io.regtransport.client.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A complete HTTP response: status, headers and body.
 */
public interface HttpResponse {

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the response headers. Lookups on the returned map ignore case.
     *
     * @return the headers, never {@code null}
     */
    Map<String, List<String>> headers();

    default Optional<String> firstHeader(String name) {
        List<String> values = headers().get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    /**
     * Returns the body bytes.
     *
     * @return the body, empty but never {@code null}
     */
    byte[] body();

    default String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }
}
