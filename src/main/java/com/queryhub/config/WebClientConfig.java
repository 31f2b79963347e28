package com.queryhub.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

/**
 * Shared settings for the analytics engine WebClient.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClientCustomizer engineWebClientCustomizer(
            @Value("${app.engine.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${app.engine.max-response-bytes:16777216}") int maxResponseBytes) {
        return builder -> builder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes));
    }
}
