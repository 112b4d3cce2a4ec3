package io.regtransport.client.http.jdk;

import java.time.Duration;

import io.regtransport.client.http.HttpClient;
import io.regtransport.client.http.HttpClientBuilder;
import io.regtransport.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link HttpClient}s backed by {@code java.net.http}.
 * <p>
 * Defaults: HTTP/1.1, normal redirect handling (registries redirect blob downloads to storage
 * hosts), a 30 second connect timeout and no request timeout.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private java.net.http.HttpClient.Version version = java.net.http.HttpClient.Version.HTTP_1_1;
    private java.net.http.HttpClient.Redirect redirect = java.net.http.HttpClient.Redirect.NORMAL;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private @Nullable Duration requestTimeout;

    public JdkHttpClientBuilder version(java.net.http.HttpClient.Version version) {
        this.version = Assert.checkNotNullParam("version", version);
        return this;
    }

    public JdkHttpClientBuilder followRedirects(java.net.http.HttpClient.Redirect redirect) {
        this.redirect = Assert.checkNotNullParam("redirect", redirect);
        return this;
    }

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = Assert.checkNotNullParam("connectTimeout", connectTimeout);
        return this;
    }

    /**
     * Sets the timeout applied to each request, {@code null} to wait indefinitely.
     *
     * @param requestTimeout the timeout
     * @return this builder
     */
    public JdkHttpClientBuilder requestTimeout(@Nullable Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public HttpClient create() {
        java.net.http.HttpClient httpClient = java.net.http.HttpClient.newBuilder()
                .version(version)
                .followRedirects(redirect)
                .connectTimeout(connectTimeout)
                .build();
        return new JdkHttpClient(httpClient, requestTimeout);
    }
}
