package it.pagopa.soapclient.utils.soap;

import it.pagopa.soapclient.exceptions.SoapDeserializationException;
import it.pagopa.soapclient.exceptions.SoapFaultException;
import it.pagopa.soapclient.utils.SoapTestUtils;
import org.junit.jupiter.api.Test;
import org.springframework.core.ResolvableType;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.util.MimeTypeUtils;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Jaxb2SoapDecoderTest {

    private final Jaxb2SoapDecoder decoder = new Jaxb2SoapDecoder();

    @Test
    void shouldDecodeJaxbTypesOnly() {
        assertTrue(
                decoder.canDecode(ResolvableType.forClass(SoapTestUtils.GetUserResponse.class), MimeTypeUtils.TEXT_XML)
        );
        assertFalse(decoder.canDecode(ResolvableType.forClass(String.class), MimeTypeUtils.TEXT_XML));
    }

    @Test
    void shouldDecodeBodyPayload() {
        SoapTestUtils.GetUserResponse response = decoder.decodeEnvelope(
                SoapTestUtils.getUserResponseEnvelope("Alice").getBytes(StandardCharsets.UTF_8),
                SoapTestUtils.GetUserResponse.class
        );

        assertEquals("Alice", response.getName());
    }

    @Test
    void shouldSkipHeaderAndIgnoreEnvelopeNamespace() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <env:Envelope xmlns:env="urn:any">
                    <env:Header><trace><id>1</id></trace></env:Header>
                    <env:Body><GetUserResponse><name>Bob</name></GetUserResponse></env:Body>
                </env:Envelope>
                """;

        SoapTestUtils.GetUserResponse response = decoder
                .decodeEnvelope(xml.getBytes(StandardCharsets.UTF_8), SoapTestUtils.GetUserResponse.class);

        assertEquals("Bob", response.getName());
    }

    @Test
    void shouldDecodeDeclaredLatinEncoding() {
        String xml = """
                <?xml version="1.0" encoding="ISO-8859-1"?>
                <soap:Envelope xmlns:soap="http://schemas.xmlsoap.org/soap/envelope/">
                    <soap:Body><GetUserResponse><name>Zoë</name></GetUserResponse></soap:Body>
                </soap:Envelope>
                """;

        SoapTestUtils.GetUserResponse response = decoder
                .decodeEnvelope(xml.getBytes(StandardCharsets.ISO_8859_1), SoapTestUtils.GetUserResponse.class);

        assertEquals("Zoë", response.getName());
    }

    @Test
    void shouldRaiseSoap11Fault() {
        byte[] document = SoapTestUtils.soap11FaultEnvelope("soap:Server", "Internal failure")
                .getBytes(StandardCharsets.UTF_8);

        SoapFaultException exception = assertThrows(
                SoapFaultException.class,
                () -> decoder.decodeEnvelope(document, SoapTestUtils.GetUserResponse.class)
        );

        assertEquals("soap:Server", exception.getFaultCode());
        assertEquals("Internal failure", exception.getFaultString());
    }

    @Test
    void shouldRaiseSoap12Fault() {
        String xml = """
                <env:Envelope xmlns:env="http://www.w3.org/2003/05/soap-envelope">
                    <env:Body>
                        <env:Fault>
                            <env:Code><env:Value>env:Sender</env:Value></env:Code>
                            <env:Reason><env:Text xml:lang="en">Bad request</env:Text></env:Reason>
                        </env:Fault>
                    </env:Body>
                </env:Envelope>
                """;

        SoapFaultException exception = assertThrows(
                SoapFaultException.class,
                () -> decoder.decodeEnvelope(xml.getBytes(StandardCharsets.UTF_8), SoapTestUtils.GetUserResponse.class)
        );

        assertEquals("env:Sender", exception.getFaultCode());
        assertEquals("Bad request", exception.getFaultString());
    }

    @Test
    void shouldRejectNonEnvelopeDocument() {
        byte[] document = "<GetUserResponse><name>Alice</name></GetUserResponse>".getBytes(StandardCharsets.UTF_8);

        SoapDeserializationException exception = assertThrows(
                SoapDeserializationException.class,
                () -> decoder.decodeEnvelope(document, SoapTestUtils.GetUserResponse.class)
        );

        assertThat(exception.getMessage()).contains("<Envelope>").contains("<GetUserResponse>");
    }

    @Test
    void shouldRejectEmptyBody() {
        String xml = """
                <soap:Envelope xmlns:soap="http://schemas.xmlsoap.org/soap/envelope/">
                    <soap:Body/>
                </soap:Envelope>
                """;

        SoapDeserializationException exception = assertThrows(
                SoapDeserializationException.class,
                () -> decoder.decodeEnvelope(xml.getBytes(StandardCharsets.UTF_8), SoapTestUtils.GetUserResponse.class)
        );

        assertEquals("SOAP Body is empty", exception.getMessage());
    }

    @Test
    void shouldRejectNilPayload() {
        String xml = """
                <soap:Envelope xmlns:soap="http://schemas.xmlsoap.org/soap/envelope/"
                               xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
                    <soap:Body><GetUserResponse xsi:nil="true"/></soap:Body>
                </soap:Envelope>
                """;

        SoapDeserializationException exception = assertThrows(
                SoapDeserializationException.class,
                () -> decoder.decodeEnvelope(xml.getBytes(StandardCharsets.UTF_8), SoapTestUtils.GetUserResponse.class)
        );

        assertEquals("SOAP Body element <GetUserResponse> carries no GetUserResponse value", exception.getMessage());
    }

    @Test
    void shouldRejectEnvelopeWithoutBody() {
        String xml = "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\"/>";

        SoapDeserializationException exception = assertThrows(
                SoapDeserializationException.class,
                () -> decoder.decodeEnvelope(xml.getBytes(StandardCharsets.UTF_8), SoapTestUtils.GetUserResponse.class)
        );

        assertEquals("SOAP Envelope has no Body", exception.getMessage());
    }

    @Test
    void shouldRejectMalformedDocument() {
        byte[] document = "<soap:Envelope><soap:Body>".getBytes(StandardCharsets.UTF_8);

        assertThrows(
                SoapDeserializationException.class,
                () -> decoder.decodeEnvelope(document, SoapTestUtils.GetUserResponse.class)
        );
    }

    @Test
    void shouldDecodeDataBufferPublisher() {
        byte[] document = SoapTestUtils.getUserResponseEnvelope("Carol").getBytes(StandardCharsets.UTF_8);
        DataBuffer first = DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOfRange(document, 0, 20));
        DataBuffer second = DefaultDataBufferFactory.sharedInstance
                .wrap(Arrays.copyOfRange(document, 20, document.length));

        StepVerifier.create(
                decoder.decodeToMono(
                        Flux.just(first, second),
                        ResolvableType.forClass(SoapTestUtils.GetUserResponse.class),
                        MimeTypeUtils.TEXT_XML,
                        Map.of()
                )
        )
                .expectNext(new SoapTestUtils.GetUserResponse("Carol"))
                .verifyComplete();
    }
}
