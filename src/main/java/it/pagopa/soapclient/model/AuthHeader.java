package it.pagopa.soapclient.model;

import javax.xml.bind.JAXBElement;
import javax.xml.namespace.QName;
import java.util.List;
import java.util.Objects;

/**
 * Credentials conveyed in the SOAP Header element.
 * <p>
 * Rendered as two header blocks, {@code ns:username} and {@code ns:password}, qualified with
 * the given namespace.
 */
public record AuthHeader(
        String namespace,
        String username,
        String password
) {
    public static final String PREFIX = "ns";

    public AuthHeader {
        Objects.requireNonNull(namespace, "Auth header namespace must not be null");
    }

    public List<JAXBElement<String>> asHeaderBlocks() {
        return List.of(
                new JAXBElement<>(new QName(namespace, "username", PREFIX), String.class, username),
                new JAXBElement<>(new QName(namespace, "password", PREFIX), String.class, password)
        );
    }

    @Override
    public String toString() {
        return "AuthHeader[namespace=%s, username=%s, password=***]".formatted(namespace, username);
    }
}
