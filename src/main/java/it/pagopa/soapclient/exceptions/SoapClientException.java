package it.pagopa.soapclient.exceptions;

/**
 * Base class of every error signalled by a SOAP round trip
 */
public abstract class SoapClientException extends RuntimeException {

    protected SoapClientException(String message) {
        super(message);
    }

    protected SoapClientException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
