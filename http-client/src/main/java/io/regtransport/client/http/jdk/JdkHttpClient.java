package io.regtransport.client.http.jdk;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import io.regtransport.client.http.DefaultHttpResponse;
import io.regtransport.client.http.HttpClient;
import io.regtransport.client.http.HttpResponse;
import io.regtransport.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    // Computed or managed by java.net.http itself; setting them raises IllegalArgumentException.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final java.net.http.HttpClient httpClient;
    private final @Nullable Duration requestTimeout;

    JdkHttpClient(java.net.http.HttpClient httpClient, @Nullable Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public RequestBuilder request(String method, String url) {
        Assert.checkNotEmptyParam("method", method);
        Assert.checkNotNullParam("url", url);
        return new JdkRequestBuilder(method, url);
    }

    private class JdkRequestBuilder implements RequestBuilder {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte @Nullable [] body;

        JdkRequestBuilder(String method, String url) {
            this.method = method.toUpperCase(Locale.ROOT);
            try {
                this.uri = URI.create(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("URI [" + url + "] is not valid", e);
            }
        }

        @Override
        public RequestBuilder addHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        @Override
        public RequestBuilder addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        @Override
        public RequestBuilder body(byte @Nullable [] body) {
            this.body = body;
            return this;
        }

        @Override
        public HttpResponse send() throws IOException, InterruptedException {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                if (RESTRICTED_HEADERS.contains(headerEntry.getKey().toLowerCase(Locale.ROOT))) {
                    LOGGER.trace("Leaving header {} to the JDK client", headerEntry.getKey());
                    continue;
                }
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            if (requestTimeout != null) {
                builder.timeout(requestTimeout);
            }
            HttpRequest.BodyPublisher publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(body);
            HttpRequest request = builder.method(method, publisher).build();

            LOGGER.debug("{} {}", method, uri);
            java.net.http.HttpResponse<byte[]> response = httpClient.send(request, BodyHandlers.ofByteArray());
            LOGGER.debug("{} {} -> {}", method, uri, response.statusCode());
            return new DefaultHttpResponse(response.statusCode(), response.headers().map(), response.body());
        }
    }
}
