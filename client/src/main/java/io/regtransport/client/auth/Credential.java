package io.regtransport.client.auth;

/**
 * Supplies the value of an {@code Authorization} header.
 * <p>
 * Implementations may return a different value on each call (for instance when an underlying
 * secret rotates), so callers must not cache the result.
 */
@FunctionalInterface
public interface Credential {

    /**
     * Returns the current {@code Authorization} header value.
     *
     * @return the header value, empty for anonymous access
     */
    String get();
}
