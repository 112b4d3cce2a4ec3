package io.regtransport.client;

import io.regtransport.client.http.HttpClientBuilder;
import io.regtransport.util.Assert;

public class RegistryTransportConfigBuilder {

    private String userAgent = RegistryTransportConfig.DEFAULT_USER_AGENT;
    private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;

    public RegistryTransportConfigBuilder userAgent(String userAgent) {
        Assert.checkNotEmptyParam("userAgent", userAgent);
        this.userAgent = userAgent;

        return this;
    }

    public RegistryTransportConfigBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;

        return this;
    }

    public RegistryTransportConfig build() {
        return new RegistryTransportConfig(userAgent, httpClientBuilder);
    }
}
