package it.pagopa.soapclient.client;

import reactor.core.publisher.Mono;

/**
 * Executes a request passing the given payload as the SOAP envelope body, then de-serializes
 * the HTTP response body as the given response type.
 * <p>
 * The returned {@link Mono} signals a
 * {@link it.pagopa.soapclient.exceptions.SoapClientException} when serializing the request,
 * performing the HTTP exchange or de-serializing the response fails.
 */
public interface SoapRoundTripper {

    <T> Mono<T> roundTrip(
                          Object request,
                          Class<T> responseType
    );

    <T> Mono<T> roundTripSoap12(
                                String action,
                                Object request,
                                Class<T> responseType
    );
}
