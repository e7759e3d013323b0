package it.pagopa.soapclient.client;

import it.pagopa.soapclient.exceptions.SoapCancelledException;
import it.pagopa.soapclient.exceptions.SoapClientException;
import it.pagopa.soapclient.exceptions.SoapDeserializationException;
import it.pagopa.soapclient.exceptions.SoapHttpException;
import it.pagopa.soapclient.exceptions.SoapSerializationException;
import it.pagopa.soapclient.exceptions.SoapTransportException;
import it.pagopa.soapclient.model.NamespaceSlot;
import it.pagopa.soapclient.model.SoapClientConfig;
import it.pagopa.soapclient.model.SoapEnvelope;
import it.pagopa.soapclient.utils.soap.Jaxb2SoapDecoder;
import it.pagopa.soapclient.utils.soap.Jaxb2SoapEncoder;
import it.pagopa.soapclient.utils.soap.XmlTypeAnnotator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ResolvableType;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.xml.bind.JAXBElement;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SOAP client performing one HTTP round trip per call.
 * <p>
 * Every round trip annotates the request with {@link XmlTypeAnnotator}, wraps it in a
 * {@link SoapEnvelope} built from the {@link SoapClientConfig}, posts the serialized envelope
 * to the configured endpoint and decodes the Body of a {@code 200 OK} response as the requested
 * type. Any other status is reported as {@link SoapHttpException}. No call is ever retried.
 * <p>
 * Three variants are available:
 * <ul>
 * <li>{@link #roundTrip(Object, Class)}: SOAP 1.1, SOAPAction derived from the request type
 * name</li>
 * <li>{@link #roundTripWithAction(String, Object, Class)}: SOAP 1.1, explicit SOAPAction</li>
 * <li>{@link #roundTripSoap12(String, Object, Class)}: SOAP 1.2, action carried by the
 * Content-Type, which is the only header it sets</li>
 * </ul>
 */
@Slf4j
public class SoapClient implements SoapRoundTripper {

    public static final String SOAP_ACTION_HEADER = "SOAPAction";

    static final int MAX_ERROR_BODY_BYTES = 1024 * 1024;

    private static final ResolvableType ENVELOPE_TYPE = ResolvableType.forClass(SoapEnvelope.class);

    @Getter
    private final SoapClientConfig config;

    private final Jaxb2SoapEncoder encoder;

    private final Jaxb2SoapDecoder decoder;

    public SoapClient(SoapClientConfig config) {
        this(config, new Jaxb2SoapEncoder(), new Jaxb2SoapDecoder());
    }

    public SoapClient(
            SoapClientConfig config,
            Jaxb2SoapEncoder encoder,
            Jaxb2SoapDecoder decoder
    ) {
        this.config = Objects.requireNonNull(config, "SOAP client configuration must not be null");
        this.encoder = encoder;
        this.decoder = decoder;
    }

    @Override
    public <T> Mono<T> roundTrip(
                                 Object request,
                                 Class<T> responseType
    ) {
        String action = request == null ? null : actionName(request);
        return doRoundTrip(action, headers -> setSoap11Headers(headers, request, action), request, responseType);
    }

    /**
     * SOAP 1.1 round trip with a caller supplied action, combined with the configured namespace
     * unless {@link SoapClientConfig#isExcludeActionNamespace()}.
     *
     * @param soapAction   the action name
     * @param request      the Body payload
     * @param responseType the expected Body payload type of the response
     * @param <T>          the response type
     * @return the decoded response payload
     */
    public <T> Mono<T> roundTripWithAction(
                                           String soapAction,
                                           Object request,
                                           Class<T> responseType
    ) {
        return doRoundTrip(
                soapAction,
                headers -> setSoap11Headers(headers, request, soapAction),
                request,
                responseType
        );
    }

    @Override
    public <T> Mono<T> roundTripSoap12(
                                      String action,
                                      Object request,
                                      Class<T> responseType
    ) {
        return doRoundTrip(
                action,
                headers -> headers.set(HttpHeaders.CONTENT_TYPE, soap12ContentType(action)),
                request,
                responseType
        );
    }

    static String soap12ContentType(String action) {
        return "application/soap+xml; charset=utf-8; action=\"%s\"".formatted(action);
    }

    static String actionName(Object request) {
        if (request instanceof JAXBElement<?> element) {
            return element.getValue() != null ? ClassUtils.getUserClass(element.getValue()).getSimpleName()
                    : element.getDeclaredType().getSimpleName();
        }
        return ClassUtils.getUserClass(request).getSimpleName();
    }

    SoapEnvelope buildEnvelope(Object request) {
        SoapEnvelope.SoapEnvelopeBuilder envelope = SoapEnvelope.builder()
                .envelopeNamespace(
                        StringUtils.hasLength(config.getEnvelopeNamespace()) ? config.getEnvelopeNamespace()
                                : SoapEnvelope.SOAP_11_ENVELOPE_NAMESPACE
                )
                .defaultNamespace(
                        StringUtils.hasLength(config.getNamespace()) ? config.getNamespace() : config.getUrl()
                )
                .tnsNamespace(config.getTnsNamespace())
                .urnNamespace(config.getUrnNamespace())
                .xsiNamespace(config.getXsiNamespace())
                .header(config.getHeader())
                .body(request);
        config.getUsedNamespaces().forEach(
                (key, uri) -> NamespaceSlot.fromKey(key).ifPresentOrElse(
                        slot -> envelope.namespaceSlot(slot, uri),
                        () -> log.debug("Ignoring unknown namespace slot [{}]", key)
                )
        );
        return envelope.build();
    }

    private <T> Mono<T> doRoundTrip(
                                    String action,
                                    Consumer<HttpHeaders> headersSetter,
                                    Object request,
                                    Class<T> responseType
    ) {
        Mono<T> roundTrip = Mono.defer(() -> {
            byte[] envelope = serialize(request);
            WebClient webClient = config.getWebClient() != null ? config.getWebClient() : DefaultTransport.WEB_CLIENT;
            WebClient.RequestBodySpec requestSpec = webClient.post()
                    .uri(URI.create(config.getUrl()))
                    .headers(headersSetter);
            if (config.getPreRequest() != null) {
                config.getPreRequest().accept(requestSpec);
            }
            log.info("SOAP round trip init for endpoint [{}], action [{}]", config.getUrl(), action);
            return requestSpec
                    .bodyValue(envelope)
                    .exchangeToMono(response -> handleResponse(response, responseType));
        })
                .onErrorMap(
                        error -> !(error instanceof SoapClientException),
                        error -> new SoapTransportException("SOAP HTTP exchange failed: " + error.getMessage(), error)
                )
                .doOnSuccess(
                        response -> log.info(
                                "SOAP round trip completed for endpoint [{}], action [{}]",
                                config.getUrl(),
                                action
                        )
                );
        return withCancellation(roundTrip);
    }

    private byte[] serialize(Object request) {
        try {
            XmlTypeAnnotator.annotate(request);
        } catch (RuntimeException e) {
            throw new SoapSerializationException("Could not annotate request XML types", e);
        }
        DataBuffer buffer = encoder.encodeValue(
                buildEnvelope(request),
                DefaultDataBufferFactory.sharedInstance,
                ENVELOPE_TYPE,
                MediaType.TEXT_XML,
                Map.of()
        );
        try {
            byte[] envelope = new byte[buffer.readableByteCount()];
            buffer.read(envelope);
            if (log.isDebugEnabled()) {
                log.debug("SOAP request envelope: {}", new String(envelope, StandardCharsets.UTF_8));
            }
            return envelope;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private <T> Mono<T> handleResponse(
                                       ClientResponse response,
                                       Class<T> responseType
    ) {
        if (config.getPostResponse() != null) {
            config.getPostResponse().accept(response);
        }
        int statusCode = response.rawStatusCode();
        if (statusCode != HttpStatus.OK.value()) {
            return readErrorBody(response)
                    .flatMap(body -> Mono.<T>error(new SoapHttpException(statusCode, statusLine(statusCode), body)));
        }
        MediaType contentType = response.headers().contentType().orElse(null);
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()))
                .map(
                        buffer -> responseType.cast(
                                decoder.decode(buffer, ResolvableType.forClass(responseType), contentType, Map.of())
                        )
                )
                .switchIfEmpty(Mono.error(() -> new SoapDeserializationException("Empty SOAP response")));
    }

    /**
     * Read at most {@link #MAX_ERROR_BODY_BYTES} of an error response body. A read failure ends
     * the body: the bytes received so far are kept.
     */
    private static Mono<String> readErrorBody(ClientResponse response) {
        return DataBufferUtils
                .takeUntilByteCount(response.body(BodyExtractors.toDataBuffers()), MAX_ERROR_BODY_BYTES)
                .map(buffer -> {
                    try {
                        byte[] chunk = new byte[buffer.readableByteCount()];
                        buffer.read(chunk);
                        return chunk;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .onErrorResume(error -> {
                    log.debug("Error response body truncated by read failure: {}", error.getMessage());
                    return Flux.empty();
                })
                .collect(ByteArrayOutputStream::new, ByteArrayOutputStream::writeBytes)
                .map(body -> body.toString(StandardCharsets.UTF_8));
    }

    static String statusLine(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status == null ? String.valueOf(statusCode) : statusCode + " " + status.getReasonPhrase();
    }

    private <T> Mono<T> withCancellation(Mono<T> roundTrip) {
        Mono<T> result = roundTrip;
        if (config.getDeadline() != null) {
            result = result.timeout(
                    config.getDeadline(),
                    Mono.error(
                            () -> new SoapCancelledException(
                                    "SOAP round trip deadline of %s exceeded".formatted(config.getDeadline())
                            )
                    )
            );
        }
        if (config.getCancellation() != null) {
            Mono<T> cancelled = Mono.from(config.getCancellation())
                    .flatMap(signal -> Mono.<T>error(new SoapCancelledException("SOAP round trip cancelled")))
                    .switchIfEmpty(Mono.never());
            result = Mono.firstWithSignal(result, cancelled);
        }
        return result;
    }

    private void setSoap11Headers(
                                  HttpHeaders headers,
                                  Object request,
                                  String action
    ) {
        if (StringUtils.hasLength(config.getUserAgent())) {
            headers.add(HttpHeaders.USER_AGENT, config.getUserAgent());
        }
        headers.set(
                HttpHeaders.CONTENT_TYPE,
                StringUtils.hasLength(config.getContentType()) ? config.getContentType() : MediaType.TEXT_XML_VALUE
        );
        if (request != null) {
            headers.add(SOAP_ACTION_HEADER, qualifiedAction(action));
        }
    }

    private String qualifiedAction(String action) {
        if (config.isExcludeActionNamespace()) {
            return action;
        }
        return "%s/%s".formatted(Objects.toString(config.getNamespace(), ""), action);
    }

    private static final class DefaultTransport {
        private static final WebClient WEB_CLIENT = WebClient.create();
    }
}
