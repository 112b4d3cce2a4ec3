/**
 * HTTP client abstraction used by the registry transport.
 *
 * <p>The transport only needs one operation from its HTTP layer: send a request with a method,
 * URL, headers and optional body, and block until the full response is available.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.regtransport.client.http.HttpClient} - request builder API</li>
 *   <li>{@link io.regtransport.client.http.HttpResponse} - status, case-insensitive headers and body</li>
 *   <li>{@link io.regtransport.client.http.HttpClientBuilder} - creates clients; the default
 *       factory builds on the JDK {@code java.net.http} client</li>
 * </ul>
 */
@NullMarked
package io.regtransport.client.http;

import org.jspecify.annotations.NullMarked;
