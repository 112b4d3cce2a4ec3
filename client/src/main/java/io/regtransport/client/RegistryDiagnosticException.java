package io.regtransport.client;

import java.util.List;
import java.util.StringJoiner;

import io.regtransport.client.http.HttpResponse;
import io.regtransport.spec.Diagnostic;
import io.regtransport.spec.Diagnostics;
import io.regtransport.spec.RegistryClientException;

/**
 * Raised when a registry request completes with a status the caller did not accept.
 * <p>
 * The registry's error body is decoded into {@link Diagnostic}s on a best effort basis. The
 * message is the response status line followed by one {@code message: detail} line per
 * diagnostic, in body order.
 */
public class RegistryDiagnosticException extends RegistryClientException {

    private final transient HttpResponse response;
    private final transient List<Diagnostic> diagnostics;

    public RegistryDiagnosticException(HttpResponse response) {
        this(response, Diagnostics.fromContent(response.bodyAsString()));
    }

    private RegistryDiagnosticException(HttpResponse response, List<Diagnostic> diagnostics) {
        super(buildMessage(response, diagnostics));
        this.response = response;
        this.diagnostics = diagnostics;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public HttpResponse getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.statusCode();
    }

    private static String buildMessage(HttpResponse response, List<Diagnostic> diagnostics) {
        StringJoiner joiner = new StringJoiner("\n");
        joiner.add("response: status " + response.statusCode());
        for (Diagnostic diagnostic : diagnostics) {
            joiner.add(diagnostic.message() + ": " + diagnostic.detail());
        }
        return joiner.toString();
    }
}
