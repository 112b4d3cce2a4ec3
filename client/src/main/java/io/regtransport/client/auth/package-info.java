/**
 * Credentials presented to registries and their token endpoints.
 *
 * <p>{@link io.regtransport.client.auth.Basic} and {@link io.regtransport.client.auth.Anonymous}
 * are exchanged for a {@link io.regtransport.client.auth.Bearer} token, which is what ordinary
 * registry requests carry.
 */
@NullMarked
package io.regtransport.client.auth;

import org.jspecify.annotations.NullMarked;
