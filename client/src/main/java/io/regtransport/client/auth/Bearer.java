package io.regtransport.client.auth;

import io.regtransport.util.Assert;

/**
 * A Bearer token issued by a registry's token endpoint.
 */
public final class Bearer implements Credential {

    private final String token;

    public Bearer(String token) {
        this.token = Assert.checkNotNullParam("token", token);
    }

    public String getToken() {
        return token;
    }

    @Override
    public String get() {
        return "Bearer " + token;
    }

    @Override
    public String toString() {
        return "Bearer[****]";
    }
}
