package it.pagopa.soapclient.exceptions;

import lombok.Getter;

/**
 * A successful HTTP response whose Body carries a SOAP Fault instead of the expected payload.
 * <p>
 * For SOAP 1.2 faults {@code faultCode} holds the {@code Code/Value} text and
 * {@code faultString} the first {@code Reason/Text}.
 */
@Getter
public class SoapFaultException extends SoapDeserializationException {

    private final String faultCode;

    private final String faultString;

    public SoapFaultException(
            String faultCode,
            String faultString
    ) {
        super("SOAP fault received: [%s] %s".formatted(faultCode, faultString));
        this.faultCode = faultCode;
        this.faultString = faultString;
    }
}
