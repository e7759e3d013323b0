package it.pagopa.soapclient.exceptions;

import lombok.Getter;

/**
 * The HTTP exchange completed with a status other than {@code 200 OK}.
 * <p>
 * {@code msg} holds at most the first MiB of the response body.
 */
@Getter
public class SoapHttpException extends SoapClientException {

    private final int statusCode;

    private final String status;

    private final String msg;

    public SoapHttpException(
            int statusCode,
            String status,
            String msg
    ) {
        super(quote(status) + ": " + quote(msg));
        this.statusCode = statusCode;
        this.status = status;
        this.msg = msg;
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        if (value != null) {
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> {
                        if (Character.isISOControl(c)) {
                            sb.append("\\x%02x".formatted((int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
