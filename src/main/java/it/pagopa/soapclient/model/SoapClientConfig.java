package it.pagopa.soapclient.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.reactivestreams.Publisher;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Immutable configuration of a {@link it.pagopa.soapclient.client.SoapClient}.
 * <p>
 * A single instance can be shared by concurrent round trips as long as the configured
 * {@link #webClient} and hooks are themselves safe for concurrent use.
 */
@Value
@Builder(toBuilder = true)
public class SoapClientConfig {

    /**
     * Endpoint every envelope is posted to
     */
    @NonNull
    String url;

    /**
     * Value of the User-Agent header, not sent when null or empty
     */
    String userAgent;

    /**
     * SOAP namespace: default namespace of the envelope and prefix of derived SOAPAction values
     */
    String namespace;

    String urnNamespace;

    String tnsNamespace;

    String xsiNamespace;

    /**
     * When set SOAPAction carries the bare action name instead of {@code namespace/action}
     */
    boolean excludeActionNamespace;

    /**
     * Value of {@code xmlns:soapenv}, SOAP 1.1 envelope namespace when not set
     */
    String envelopeNamespace;

    /**
     * Content of the SOAP Header element: a JAXB object, a {@code JAXBElement} or an
     * {@code Iterable} of them
     */
    Object header;

    /**
     * Content-Type of SOAP 1.1 requests, {@code text/xml} when not set
     */
    String contentType;

    Consumer<WebClient.RequestBodySpec> preRequest;

    Consumer<ClientResponse> postResponse;

    /**
     * Maximum duration of a whole round trip
     */
    Duration deadline;

    /**
     * Aborts the in-flight round trip on its first signal
     */
    Publisher<?> cancellation;

    /**
     * Transport override, a shared default client is used when not set
     */
    WebClient webClient;

    /**
     * Namespace slot key ({@code tns0} to {@code tns14}) to namespace URI. Other keys are ignored.
     */
    @Singular
    Map<String, String> usedNamespaces;
}
