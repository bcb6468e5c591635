package com.chimera.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for streaming requests to the completion provider.
 */
@Configuration
public class WebClientConfiguration {

    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final ChimeraProperties properties;

    public WebClientConfiguration(ChimeraProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        // Response timeout bounds the gap between reads, so long streams are not cut off
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(properties.getProvider().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
