/**
 * Authenticated access to Registry v2 style HTTP APIs.
 *
 * <p>{@link io.regtransport.client.RegistryTransport} pings a registry, exchanges credentials for
 * a Bearer token, issues authenticated requests and transparently reauthenticates when a token
 * expires. {@link io.regtransport.client.PaginatedResponses} follows {@code link} headers across
 * the pages of a listing.
 */
@NullMarked
package io.regtransport.client;

import org.jspecify.annotations.NullMarked;
