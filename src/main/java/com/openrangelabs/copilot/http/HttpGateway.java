package com.openrangelabs.copilot.http;

import reactor.core.publisher.Mono;

/**
 * Transport seam shared by the connectors.
 *
 * <p>Every HTTP status, 2xx or not, is delivered as a {@link RawResponse}. Only a
 * failure to obtain a response at all is signalled, as a {@link TransportException}.
 * Implementations apply their own timeouts and perform no retries.
 */
public interface HttpGateway {

    Mono<RawResponse> send(GatewayRequest request);
}
