package it.pagopa.soapclient.exceptions;

/**
 * The response body could not be read as an envelope wrapping the expected payload
 */
public class SoapDeserializationException extends SoapClientException {

    public SoapDeserializationException(String message) {
        super(message);
    }

    public SoapDeserializationException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
