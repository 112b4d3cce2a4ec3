package io.regtransport.client;

import io.regtransport.client.http.HttpClientBuilder;
import io.regtransport.util.Assert;

/**
 * Settings shared by the requests a {@link RegistryTransport} issues.
 *
 * @see RegistryTransportConfigBuilder
 */
public class RegistryTransportConfig {

    public static final String DEFAULT_USER_AGENT = "regtransport-java/0.1";

    public static final RegistryTransportConfig DEFAULT = new RegistryTransportConfig();

    private final String userAgent;
    private final HttpClientBuilder httpClientBuilder;

    public RegistryTransportConfig(String userAgent, HttpClientBuilder httpClientBuilder) {
        this.userAgent = Assert.checkNotEmptyParam("userAgent", userAgent);
        this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
    }

    public RegistryTransportConfig() {
        this(DEFAULT_USER_AGENT, HttpClientBuilder.DEFAULT_FACTORY);
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * Returns the factory used when a transport is created without an explicit client.
     *
     * @return the client factory
     */
    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }
}
