package io.regtransport.client.http;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable {@link HttpResponse}.
 * <p>
 * The body array is not copied: ownership passes to the response, and callers of {@link #body()}
 * must not modify the returned array.
 *
 * @param statusCode the HTTP status code
 * @param headers the headers, copied into a case-insensitive map
 * @param body the body bytes
 */
public record DefaultHttpResponse(int statusCode, Map<String, List<String>> headers, byte[] body)
        implements HttpResponse {

    public DefaultHttpResponse {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                copy.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
            }
        }
        copy.replaceAll((k, v) -> List.copyOf(v));
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    public static DefaultHttpResponse of(int statusCode, Map<String, List<String>> headers, String body) {
        return new DefaultHttpResponse(statusCode, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    public static DefaultHttpResponse of(int statusCode, String body) {
        return of(statusCode, Map.of(), body);
    }

    @Override
    public String toString() {
        return "DefaultHttpResponse[statusCode=" + statusCode + ", headers=" + headers + "]";
    }
}
