package it.pagopa.soapclient.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import javax.xml.XMLConstants;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SOAP envelope frame wrapping a single round trip payload.
 * <p>
 * The root element is always {@code soapenv:Envelope}. Namespace declarations are emitted in a
 * fixed order: {@code xmlns:soapenv}, {@code xmlns}, {@code xmlns:tns}, {@code xmlns:urn},
 * {@code xmlns:xsi}, then {@code xmlns:tns0} to {@code xmlns:tns14}. Every declaration but the
 * first two is left out when its value is null or empty.
 */
@Value
@Builder
public class SoapEnvelope {

    public static final String ENVELOPE_PREFIX = "soapenv";
    public static final String SOAP_11_ENVELOPE_NAMESPACE = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String SOAP_12_ENVELOPE_NAMESPACE = "http://www.w3.org/2003/05/soap-envelope";
    public static final String XSI_NAMESPACE = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;

    @NonNull
    String envelopeNamespace;

    @NonNull
    String defaultNamespace;

    String tnsNamespace;

    String urnNamespace;

    String xsiNamespace;

    @Singular
    Map<NamespaceSlot, String> namespaceSlots;

    Object header;

    Object body;

    /**
     * @return prefix to URI declarations in wire order; the default namespace has the empty
     *         prefix
     */
    public Map<String, String> namespaceDeclarations() {
        Map<String, String> declarations = new LinkedHashMap<>();
        declarations.put(ENVELOPE_PREFIX, envelopeNamespace);
        declarations.put(XMLConstants.DEFAULT_NS_PREFIX, defaultNamespace);
        putIfNotEmpty(declarations, "tns", tnsNamespace);
        putIfNotEmpty(declarations, "urn", urnNamespace);
        putIfNotEmpty(declarations, "xsi", xsiNamespace);
        Map<NamespaceSlot, String> slots = new EnumMap<>(NamespaceSlot.class);
        slots.putAll(namespaceSlots);
        slots.forEach((slot, uri) -> putIfNotEmpty(declarations, slot.getPrefix(), uri));
        return Collections.unmodifiableMap(declarations);
    }

    private static void putIfNotEmpty(
                                      Map<String, String> declarations,
                                      String prefix,
                                      String uri
    ) {
        if (uri != null && !uri.isEmpty()) {
            declarations.put(prefix, uri);
        }
    }
}
