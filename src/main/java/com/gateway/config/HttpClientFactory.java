package com.gateway.config;

import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;

/**
 * Creates the single {@link WebClient} shared by document loading, identity resolution and
 * tool dispatch.
 * <p>
 * No retry filter is installed: a failed backend call is reported to the caller as is.
 * Timeouts are applied per call by the components using the client.
 */
@Configuration
@Slf4j
public class HttpClientFactory {

    // API descriptions of the larger backends are several megabytes
    private static final int MAX_IN_MEMORY_SIZE = 64 * 1024 * 1024;

    @Bean
    public WebClient webClient(GatewayProperties properties) {
        HttpClient httpClient = HttpClient.create();
        if (properties.isIgnoreCertificateErrors()) {
            log.warn("HTTPS certificate validation is disabled. This should only be used in development/testing environments.");
            Http11SslContextSpec insecure = Http11SslContextSpec.forClient()
                    .configure(builder -> builder.trustManager(InsecureTrustManagerFactory.INSTANCE));
            httpClient = httpClient.secure(spec -> spec.sslContext(insecure));
        }

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
