package it.pagopa.soapclient.exceptions;

/**
 * The request envelope could not be written as XML. No HTTP request has been sent.
 */
public class SoapSerializationException extends SoapClientException {

    public SoapSerializationException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
