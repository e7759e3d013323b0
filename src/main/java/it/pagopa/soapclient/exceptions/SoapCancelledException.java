package it.pagopa.soapclient.exceptions;

/**
 * The round trip was aborted because its deadline expired or its cancellation signal fired.
 */
public class SoapCancelledException extends SoapTransportException {

    public SoapCancelledException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }

    public SoapCancelledException(String message) {
        super(message, null);
    }
}
