package it.pagopa.soapclient.configurations;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "soap.client")
public record SoapClientProperties(
        String url,
        String userAgent,
        String namespace,
        String urnNamespace,
        String tnsNamespace,
        String xsiNamespace,
        String envelopeNamespace,
        boolean excludeActionNamespace,
        String contentType,
        int readTimeout,
        int connectionTimeout,
        Duration deadline,
        Map<String, String> usedNamespaces,
        AuthConf auth
) {
    public record AuthConf(
            String namespace,
            String username,
            String password
    ) {
    }
}
