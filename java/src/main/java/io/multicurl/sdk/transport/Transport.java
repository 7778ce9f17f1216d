package io.multicurl.sdk.transport;

import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;

/**
 * Sole point of contact with the network.
 *
 * <p>
 * Implementations must never let a fault escape: connection errors, timeouts and interruptions are reported as
 * {@link ResponseEnvelope#failure()}. Implementations are called from pool threads and must be thread-safe.
 * </p>
 */
@FunctionalInterface
public interface Transport {

    ResponseEnvelope exchange(RequestConfig request);
}
