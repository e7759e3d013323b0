package it.pagopa.soapclient.configurations;

import it.pagopa.soapclient.client.SoapClient;
import it.pagopa.soapclient.exceptions.SoapTransportException;
import it.pagopa.soapclient.model.SoapClientConfig;
import it.pagopa.soapclient.utils.SoapTestUtils;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import javax.xml.bind.JAXBElement;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientsConfigTest {

    private final WebClientsConfig webClientsConfig = new WebClientsConfig();

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(WebClientsConfig.class);

    @Test
    void shouldBindPropertiesAndCreateSoapClient() {
        contextRunner
                .withPropertyValues(
                        "soap.client.url=http://localhost:8080/ws",
                        "soap.client.user-agent=" + SoapTestUtils.USER_AGENT,
                        "soap.client.namespace=" + SoapTestUtils.NAMESPACE,
                        "soap.client.exclude-action-namespace=true",
                        "soap.client.read-timeout=10000",
                        "soap.client.connection-timeout=5000",
                        "soap.client.deadline=30s",
                        "soap.client.used-namespaces.tns0=urn:zero",
                        "soap.client.auth.namespace=" + SoapTestUtils.AUTH_NAMESPACE,
                        "soap.client.auth.username=user",
                        "soap.client.auth.password=secret"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(SoapClient.class);
                    assertThat(context).hasBean("soapWebClient");
                    SoapClientConfig config = context.getBean(SoapClient.class).getConfig();
                    assertEquals("http://localhost:8080/ws", config.getUrl());
                    assertEquals(SoapTestUtils.USER_AGENT, config.getUserAgent());
                    assertEquals(SoapTestUtils.NAMESPACE, config.getNamespace());
                    assertTrue(config.isExcludeActionNamespace());
                    assertEquals(Duration.ofSeconds(30), config.getDeadline());
                    assertEquals(Map.of("tns0", "urn:zero"), config.getUsedNamespaces());
                    assertSame(context.getBean("soapWebClient", WebClient.class), config.getWebClient());
                    assertThat(config.getHeader()).isInstanceOf(List.class);
                    List<?> headerBlocks = (List<?>) config.getHeader();
                    assertEquals(2, headerBlocks.size());
                    assertEquals("secret", ((JAXBElement<?>) headerBlocks.get(1)).getValue());
                });
    }

    @Test
    void shouldLeaveOptionalSettingsUnset() {
        SoapClientProperties properties = new SoapClientProperties(
                "http://localhost:8080/ws",
                null,
                null,
                null,
                null,
                null,
                null,
                false,
                null,
                1000,
                1000,
                null,
                null,
                null
        );

        SoapClientConfig config = webClientsConfig.soapClientConfig(properties, WebClient.create());

        assertNull(config.getHeader());
        assertNull(config.getDeadline());
        assertFalse(config.isExcludeActionNamespace());
        assertTrue(config.getUsedNamespaces().isEmpty());
    }

    @Test
    void shouldMapReadTimeoutToTransportError() throws IOException {
        MockWebServer mockWebServer = new MockWebServer();
        mockWebServer.start();
        mockWebServer.enqueue(
                new MockResponse()
                        .setResponseCode(200)
                        .setBody(SoapTestUtils.getUserResponseEnvelope("Alice"))
                        .setHeadersDelay(2, TimeUnit.SECONDS)
        );
        SoapClientProperties properties = new SoapClientProperties(
                mockWebServer.url("/ws").toString(),
                null,
                SoapTestUtils.NAMESPACE,
                null,
                null,
                null,
                null,
                false,
                null,
                200,
                1000,
                null,
                Map.of(),
                null
        );
        SoapClient client = webClientsConfig.soapClient(properties, webClientsConfig.soapWebClient(properties));

        StepVerifier.create(client.roundTrip(new SoapTestUtils.GetUser("42"), SoapTestUtils.GetUserResponse.class))
                .expectError(SoapTransportException.class)
                .verify(Duration.ofSeconds(10));

        mockWebServer.shutdown();
    }
}
