package it.pagopa.soapclient.utils.soap;

import it.pagopa.soapclient.exceptions.SoapSerializationException;
import it.pagopa.soapclient.model.SoapEnvelope;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.Encoder;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.PooledDataBuffer;
import org.springframework.lang.Nullable;
import org.springframework.util.ClassUtils;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.xml.XMLConstants;
import javax.xml.bind.JAXBElement;
import javax.xml.bind.JAXBException;
import javax.xml.bind.annotation.XmlRootElement;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link SoapEnvelope} as a SOAP XML document.
 * <p>
 * The envelope frame is written with StAX exactly as modelled (no XML declaration, fixed
 * {@code soapenv} prefix); header blocks and body payload are marshalled with JAXB as document
 * fragments, so unqualified payload elements inherit the envelope default namespace. Payload
 * classes lacking {@link XmlRootElement} are wrapped in an element named after their simple
 * class name.
 */
public class Jaxb2SoapEncoder implements Encoder<Object> {

    public static final MimeType SOAP_12_XML = new MimeType("application", "soap+xml");

    private final JaxbContextContainer jaxbContexts = new JaxbContextContainer();

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    @Override
    public boolean canEncode(
                             ResolvableType elementType,
                             @Nullable MimeType mimeType
    ) {
        return SoapEnvelope.class.isAssignableFrom(elementType.toClass()) &&
                (mimeType == null || getEncodableMimeTypes().stream().anyMatch(m -> m.isCompatibleWith(mimeType)));
    }

    @Override
    public Flux<DataBuffer> encode(
                                   Publisher<?> inputStream,
                                   DataBufferFactory bufferFactory,
                                   ResolvableType elementType,
                                   @Nullable MimeType mimeType,
                                   @Nullable Map<String, Object> hints
    ) {
        return Flux.from(inputStream)
                .take(1)
                .concatMap(
                        value -> Mono.fromCallable(() -> encodeValue(value, bufferFactory, elementType, mimeType, hints))
                )
                .doOnDiscard(PooledDataBuffer.class, PooledDataBuffer::release);
    }

    @Override
    public DataBuffer encodeValue(
                                  Object value,
                                  DataBufferFactory bufferFactory,
                                  ResolvableType valueType,
                                  @Nullable MimeType mimeType,
                                  @Nullable Map<String, Object> hints
    ) {
        boolean release = true;
        DataBuffer buffer = bufferFactory.allocateBuffer(1024);
        try (OutputStream outputStream = buffer.asOutputStream()) {
            writeEnvelope((SoapEnvelope) value, outputStream);
            release = false;
            return buffer;
        } catch (IOException e) {
            throw new SoapSerializationException("Could not write SOAP envelope", e);
        } finally {
            if (release) {
                DataBufferUtils.release(buffer);
            }
        }
    }

    @Override
    public List<MimeType> getEncodableMimeTypes() {
        return List.of(MimeTypeUtils.TEXT_XML, SOAP_12_XML);
    }

    private void writeEnvelope(
                               SoapEnvelope envelope,
                               OutputStream outputStream
    ) {
        String envelopeNamespace = envelope.getEnvelopeNamespace();
        try {
            XMLStreamWriter writer = outputFactory.createXMLStreamWriter(outputStream, StandardCharsets.UTF_8.name());
            writer.writeStartElement(SoapEnvelope.ENVELOPE_PREFIX, "Envelope", envelopeNamespace);
            for (Map.Entry<String, String> declaration : envelope.namespaceDeclarations().entrySet()) {
                if (XMLConstants.DEFAULT_NS_PREFIX.equals(declaration.getKey())) {
                    writer.writeDefaultNamespace(declaration.getValue());
                } else {
                    writer.writeNamespace(declaration.getKey(), declaration.getValue());
                }
            }
            if (envelope.getHeader() != null) {
                writer.writeStartElement(SoapEnvelope.ENVELOPE_PREFIX, "Header", envelopeNamespace);
                if (envelope.getHeader() instanceof Iterable<?> headerBlocks) {
                    for (Object headerBlock : headerBlocks) {
                        marshal(headerBlock, writer);
                    }
                } else {
                    marshal(envelope.getHeader(), writer);
                }
                writer.writeEndElement();
            }
            writer.writeStartElement(SoapEnvelope.ENVELOPE_PREFIX, "Body", envelopeNamespace);
            if (envelope.getBody() != null) {
                marshal(envelope.getBody(), writer);
            }
            writer.writeEndElement();
            writer.writeEndElement();
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new SoapSerializationException("Could not write SOAP envelope", e);
        }
    }

    private void marshal(
                         Object payload,
                         XMLStreamWriter writer
    ) {
        if (payload == null) {
            return;
        }
        Class<?> payloadClass;
        Object element;
        if (payload instanceof JAXBElement<?> jaxbElement) {
            payloadClass = jaxbElement.getDeclaredType();
            element = jaxbElement;
        } else {
            payloadClass = ClassUtils.getUserClass(payload);
            element = payloadClass.isAnnotationPresent(XmlRootElement.class) ? payload
                    : wrapUnrooted(payloadClass, payload);
        }
        try {
            jaxbContexts.createFragmentMarshaller(payloadClass).marshal(element, writer);
        } catch (JAXBException e) {
            throw new SoapSerializationException("Could not marshal " + payloadClass + " to XML", e);
        }
    }

    private static <T> JAXBElement<T> wrapUnrooted(
                                                   Class<T> payloadClass,
                                                   Object payload
    ) {
        return new JAXBElement<>(new QName(payloadClass.getSimpleName()), payloadClass, payloadClass.cast(payload));
    }
}
