package io.regtransport.client;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import io.regtransport.spec.MediaTypes;
import io.regtransport.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A request issued through a {@link RegistryTransport}.
 * <p>
 * Only the URL and the accepted status codes are required. The method defaults to {@code GET}
 * without a body and {@code PUT} with one; an empty body counts as no body. The content type
 * defaults to {@code application/json} and is only sent along with a body.
 */
public final class RegistryRequest {

    private final String url;
    private final Set<Integer> acceptedCodes;
    private final @Nullable String method;
    private final byte @Nullable [] body;
    private final @Nullable String contentType;
    private final @Nullable List<String> acceptedMimeTypes;

    private RegistryRequest(String url, Set<Integer> acceptedCodes, @Nullable String method,
                            byte @Nullable [] body, @Nullable String contentType,
                            @Nullable List<String> acceptedMimeTypes) {
        this.url = Assert.checkNotNullParam("url", url);
        this.acceptedCodes = Set.copyOf(Assert.checkNotNullParam("acceptedCodes", acceptedCodes));
        this.method = method;
        this.body = body == null ? null : body.clone();
        this.contentType = contentType;
        this.acceptedMimeTypes = acceptedMimeTypes == null ? null : List.copyOf(acceptedMimeTypes);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String url() {
        return url;
    }

    public Set<Integer> acceptedCodes() {
        return acceptedCodes;
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    /**
     * Returns a copy of the body, or {@code null} when the request carries none.
     *
     * @return the body bytes
     */
    public byte @Nullable [] body() {
        return body != null && body.length > 0 ? body.clone() : null;
    }

    /**
     * Returns the method to use, applying the GET/PUT default.
     *
     * @return the HTTP method
     */
    public String method() {
        if (method != null && !method.isEmpty()) {
            return method;
        }
        return hasBody() ? "PUT" : "GET";
    }

    public String contentType() {
        return contentType != null ? contentType : MediaTypes.APPLICATION_JSON;
    }

    public @Nullable List<String> acceptedMimeTypes() {
        return acceptedMimeTypes;
    }

    /**
     * Returns a copy of this request targeting another URL.
     *
     * @param url the new target
     * @return the new request
     */
    public RegistryRequest withUrl(String url) {
        return new RegistryRequest(url, acceptedCodes, method, body, contentType, acceptedMimeTypes);
    }

    @Override
    public String toString() {
        return method() + " " + url;
    }

    public static class Builder {
        private final String url;
        private Set<Integer> acceptedCodes = Set.of();
        private @Nullable String method;
        private byte @Nullable [] body;
        private @Nullable String contentType;
        private @Nullable List<String> acceptedMimeTypes;

        private Builder(String url) {
            this.url = url;
        }

        public Builder acceptedCodes(Set<Integer> acceptedCodes) {
            this.acceptedCodes = acceptedCodes;
            return this;
        }

        public Builder acceptedCodes(Integer... acceptedCodes) {
            this.acceptedCodes = Set.copyOf(Arrays.asList(acceptedCodes));
            return this;
        }

        public Builder method(@Nullable String method) {
            this.method = method;
            return this;
        }

        public Builder body(byte @Nullable [] body) {
            this.body = body;
            return this;
        }

        public Builder contentType(@Nullable String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder acceptedMimeTypes(@Nullable List<String> acceptedMimeTypes) {
            this.acceptedMimeTypes = acceptedMimeTypes;
            return this;
        }

        public RegistryRequest build() {
            return new RegistryRequest(url, acceptedCodes, method, body, contentType, acceptedMimeTypes);
        }
    }
}
