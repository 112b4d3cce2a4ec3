package io.regtransport.client.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import io.regtransport.util.Assert;

/**
 * Username and password credentials, only ever sent to the token endpoint.
 */
public final class Basic implements Credential {

    private final String username;
    private final String password;

    public Basic(String username, String password) {
        this.username = Assert.checkNotNullParam("username", username);
        this.password = Assert.checkNotNullParam("password", password);
    }

    public String getUsername() {
        return username;
    }

    @Override
    public String get() {
        String raw = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "Basic[username=" + username + "]";
    }
}
