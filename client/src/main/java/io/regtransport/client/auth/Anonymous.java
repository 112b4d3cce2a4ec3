package io.regtransport.client.auth;

/**
 * Anonymous access: the token exchange is performed without an {@code Authorization} header.
 */
public final class Anonymous implements Credential {

    public static final Anonymous INSTANCE = new Anonymous();

    private Anonymous() {
    }

    @Override
    public String get() {
        return "";
    }

    @Override
    public String toString() {
        return "Anonymous";
    }
}
