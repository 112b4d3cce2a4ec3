package io.regtransport.spec;

/**
 * Base exception for failures talking to a registry.
 * <p>
 * Thrown directly when the underlying HTTP exchange fails (I/O error or interruption). Protocol
 * level failures use the specialised subclasses:
 * <ul>
 *   <li>{@link BadStateException} - the registry did not follow the expected authentication flow</li>
 *   <li>{@code RegistryDiagnosticException} - a request completed with an unaccepted status</li>
 * </ul>
 */
public class RegistryClientException extends Exception {

    public RegistryClientException() {
        super();
    }

    public RegistryClientException(final String msg) {
        super(msg);
    }

    public RegistryClientException(final Throwable cause) {
        super(cause);
    }

    public RegistryClientException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
