package it.pagopa.soapclient.exceptions;

/**
 * The HTTP exchange could not complete: connection failure, I/O error, timeout.
 */
public class SoapTransportException extends SoapClientException {

    public SoapTransportException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
