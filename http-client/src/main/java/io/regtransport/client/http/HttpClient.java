package io.regtransport.client.http;

import java.io.IOException;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Synchronous HTTP client used to talk to registries and their token endpoints.
 *
 * <p>URLs are absolute: a registry and the realm issuing its tokens usually live on different
 * hosts, so a single client instance serves both.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient();
 *
 * HttpResponse response = client.request("PUT", "https://gcr.io/v2/foo/bar/manifests/latest")
 *     .addHeader("Authorization", "Bearer token")
 *     .addHeader("content-type", MediaTypes.MANIFEST_SCHEMA2)
 *     .body(manifest)
 *     .send();
 * }</pre>
 */
public interface HttpClient {

    static HttpClient createHttpClient() {
        return HttpClientBuilder.DEFAULT_FACTORY.create();
    }

    /**
     * Creates a builder for a request.
     *
     * @param method the HTTP method, e.g. {@code GET} or {@code PUT}
     * @param url the absolute target URL
     * @return a new request builder
     */
    RequestBuilder request(String method, String url);

    default RequestBuilder get(String url) {
        return request("GET", url);
    }

    interface RequestBuilder {

        RequestBuilder addHeader(String name, String value);

        RequestBuilder addHeaders(Map<String, String> headers);

        /**
         * Sets the request body. A {@code null} body sends no content.
         *
         * @param body the body bytes
         * @return this builder for chaining
         */
        RequestBuilder body(byte @Nullable [] body);

        /**
         * Performs the request and waits for the complete response.
         *
         * @return the response, whatever its status
         * @throws IOException if the exchange fails
         * @throws InterruptedException if the calling thread is interrupted while waiting
         */
        HttpResponse send() throws IOException, InterruptedException;
    }
}
