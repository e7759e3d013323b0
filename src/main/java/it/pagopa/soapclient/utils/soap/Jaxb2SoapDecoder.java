package it.pagopa.soapclient.utils.soap;

import it.pagopa.soapclient.exceptions.SoapDeserializationException;
import it.pagopa.soapclient.exceptions.SoapFaultException;
import it.pagopa.soapclient.model.SoapEnvelope;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.Decoder;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.xml.bind.JAXBElement;
import javax.xml.bind.JAXBException;
import javax.xml.bind.annotation.XmlRootElement;
import javax.xml.bind.annotation.XmlType;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the payload of a SOAP response envelope.
 * <p>
 * The document encoding is resolved by {@link XmlCharsetResolver}. {@code Envelope} and
 * {@code Body} are matched by local name whatever their namespace; the first element inside
 * {@code Body} is unmarshalled with JAXB as the target type. A SOAP 1.1 or 1.2 {@code Fault} in
 * its place is reported as {@link SoapFaultException}, a nil element as
 * {@link SoapDeserializationException}.
 */
public class Jaxb2SoapDecoder implements Decoder<Object> {

    private static final Set<String> faultNamespaces = Set.of(
            SoapEnvelope.SOAP_11_ENVELOPE_NAMESPACE,
            SoapEnvelope.SOAP_12_ENVELOPE_NAMESPACE
    );

    private final JaxbContextContainer jaxbContexts = new JaxbContextContainer();

    private final XMLInputFactory inputFactory = createInputFactory();

    @Override
    public boolean canDecode(
                             ResolvableType elementType,
                             @Nullable MimeType mimeType
    ) {
        Class<?> outputClass = elementType.toClass();
        return (outputClass.isAnnotationPresent(XmlRootElement.class) ||
                outputClass.isAnnotationPresent(XmlType.class));
    }

    @Override
    public Flux<Object> decode(
                               Publisher<DataBuffer> inputStream,
                               ResolvableType elementType,
                               @Nullable MimeType mimeType,
                               @Nullable Map<String, Object> hints
    ) {
        return decodeToMono(inputStream, elementType, mimeType, hints).flux();
    }

    @Override
    public Mono<Object> decodeToMono(
                                     Publisher<DataBuffer> inputStream,
                                     ResolvableType elementType,
                                     @Nullable MimeType mimeType,
                                     @Nullable Map<String, Object> hints
    ) {
        return DataBufferUtils.join(inputStream)
                .map(buffer -> decode(buffer, elementType, mimeType, hints));
    }

    @Override
    public Object decode(
                         DataBuffer buffer,
                         ResolvableType targetType,
                         @Nullable MimeType mimeType,
                         @Nullable Map<String, Object> hints
    ) {
        try {
            byte[] document = new byte[buffer.readableByteCount()];
            buffer.read(document);
            return decodeEnvelope(document, targetType.toClass());
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    @Override
    public List<MimeType> getDecodableMimeTypes() {
        return List.of(MimeTypeUtils.TEXT_XML, Jaxb2SoapEncoder.SOAP_12_XML, MimeTypeUtils.APPLICATION_XML);
    }

    /**
     * Decode a whole response document.
     *
     * @param document    the raw response body
     * @param payloadType the type of the first Body child
     * @param <T>         the payload type
     * @return the unmarshalled payload
     * @throws SoapDeserializationException if the document is not an envelope holding a
     *                                      payload of the given type
     */
    public <T> T decodeEnvelope(
                                byte[] document,
                                Class<T> payloadType
    ) {
        try {
            XMLStreamReader reader = inputFactory.createXMLStreamReader(XmlCharsetResolver.newReader(document));
            if (nextElement(reader) != XMLStreamConstants.START_ELEMENT) {
                throw new SoapDeserializationException("Empty SOAP response");
            }
            if (!"Envelope".equals(reader.getLocalName())) {
                throw new SoapDeserializationException(
                        "Expected element type <Envelope> but have <%s>".formatted(reader.getLocalName())
                );
            }
            if (!moveToChild(reader, "Body")) {
                throw new SoapDeserializationException("SOAP Envelope has no Body");
            }
            if (nextElement(reader) != XMLStreamConstants.START_ELEMENT) {
                throw new SoapDeserializationException("SOAP Body is empty");
            }
            if ("Fault".equals(reader.getLocalName()) && faultNamespaces.contains(reader.getNamespaceURI())) {
                throw readFault(reader);
            }
            JAXBElement<T> element = jaxbContexts.createUnmarshaller(payloadType).unmarshal(reader, payloadType);
            if (element.isNil() || element.getValue() == null) {
                throw new SoapDeserializationException(
                        "SOAP Body element <%s> carries no %s value".formatted(
                                element.getName().getLocalPart(),
                                payloadType.getSimpleName()
                        )
                );
            }
            reader.close();
            return element.getValue();
        } catch (XMLStreamException e) {
            throw new SoapDeserializationException("Malformed SOAP response", e);
        } catch (JAXBException e) {
            throw new SoapDeserializationException("Could not unmarshal SOAP Body to " + payloadType, e);
        }
    }

    /**
     * Advance to the next start or end tag, ignoring character data, comments and processing
     * instructions.
     */
    private static int nextElement(XMLStreamReader reader) throws XMLStreamException {
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT || event == XMLStreamConstants.END_ELEMENT) {
                return event;
            }
        }
        return XMLStreamConstants.END_DOCUMENT;
    }

    private static boolean moveToChild(
                                       XMLStreamReader reader,
                                       String localName
    ) throws XMLStreamException {
        while (nextElement(reader) == XMLStreamConstants.START_ELEMENT) {
            if (localName.equals(reader.getLocalName())) {
                return true;
            }
            skipElement(reader);
        }
        return false;
    }

    private static void skipElement(XMLStreamReader reader) throws XMLStreamException {
        int depth = 1;
        while (depth > 0) {
            int event = nextElement(reader);
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            } else {
                throw new XMLStreamException("Unexpected end of document");
            }
        }
    }

    private static SoapFaultException readFault(XMLStreamReader reader) throws XMLStreamException {
        String faultCode = null;
        String faultString = null;
        int depth = 1;
        while (depth > 0) {
            int event = nextElement(reader);
            if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            } else if (event == XMLStreamConstants.START_ELEMENT) {
                String localName = reader.getLocalName();
                if (faultCode == null && ("faultcode".equals(localName) || "Value".equals(localName))) {
                    faultCode = reader.getElementText().trim();
                } else if (faultString == null && ("faultstring".equals(localName) || "Text".equals(localName))) {
                    faultString = reader.getElementText().trim();
                } else {
                    depth++;
                }
            } else {
                throw new XMLStreamException("Unexpected end of document inside SOAP Fault");
            }
        }
        return new SoapFaultException(faultCode, faultString);
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }
}
