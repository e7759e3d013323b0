package it.pagopa.soapclient.model;

/**
 * Capability for request payload types that need to annotate themselves before being
 * serialized, for example by setting an {@code xsi:type} discriminator attribute.
 * <p>
 * {@link it.pagopa.soapclient.utils.soap.XmlTypeAnnotator} invokes {@link #setXmlType()} on
 * every reachable implementor before the envelope is marshalled.
 */
@FunctionalInterface
public interface XmlTyper {

    void setXmlType();
}
