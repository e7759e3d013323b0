package it.pagopa.soapclient.configurations;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import it.pagopa.soapclient.client.SoapClient;
import it.pagopa.soapclient.model.AuthHeader;
import it.pagopa.soapclient.model.SoapClientConfig;
import it.pagopa.soapclient.utils.soap.Jaxb2SoapDecoder;
import it.pagopa.soapclient.utils.soap.Jaxb2SoapEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(SoapClientProperties.class)
@Slf4j
public class WebClientsConfig {

    @Bean(name = "soapWebClient")
    public WebClient soapWebClient(SoapClientProperties soapClientProperties) {

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, soapClientProperties.connectionTimeout())
                .doOnConnected(
                        connection -> connection.addHandlerLast(
                                new ReadTimeoutHandler(
                                        soapClientProperties.readTimeout(),
                                        TimeUnit.MILLISECONDS
                                )
                        )
                );

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder().codecs(clientCodecConfigurer -> {
            clientCodecConfigurer.customCodecs().register(new Jaxb2SoapEncoder());
            clientCodecConfigurer.customCodecs().register(new Jaxb2SoapDecoder());
        }).build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies)
                .build();
    }

    @Bean(name = "soapClient")
    public SoapClient soapClient(
                                 SoapClientProperties soapClientProperties,
                                 @Qualifier("soapWebClient") WebClient soapWebClient
    ) {
        return new SoapClient(soapClientConfig(soapClientProperties, soapWebClient));
    }

    public SoapClientConfig soapClientConfig(
                                             SoapClientProperties soapClientProperties,
                                             WebClient soapWebClient
    ) {
        SoapClientConfig.SoapClientConfigBuilder config = SoapClientConfig.builder()
                .url(soapClientProperties.url())
                .userAgent(soapClientProperties.userAgent())
                .namespace(soapClientProperties.namespace())
                .urnNamespace(soapClientProperties.urnNamespace())
                .tnsNamespace(soapClientProperties.tnsNamespace())
                .xsiNamespace(soapClientProperties.xsiNamespace())
                .envelopeNamespace(soapClientProperties.envelopeNamespace())
                .excludeActionNamespace(soapClientProperties.excludeActionNamespace())
                .contentType(soapClientProperties.contentType())
                .deadline(soapClientProperties.deadline())
                .webClient(soapWebClient);
        if (soapClientProperties.usedNamespaces() != null) {
            config.usedNamespaces(soapClientProperties.usedNamespaces());
        }
        SoapClientProperties.AuthConf auth = soapClientProperties.auth();
        if (auth != null && auth.namespace() != null) {
            log.info("SOAP auth header enabled for username [{}]", auth.username());
            config.header(new AuthHeader(auth.namespace(), auth.username(), auth.password()).asHeaderBlocks());
        }
        return config.build();
    }
}
