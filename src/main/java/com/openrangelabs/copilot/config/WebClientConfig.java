package com.openrangelabs.copilot.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Configuration for the outbound HTTP client shared by the connectors.
 *
 * <p>Timeouts live here and only here; the connectors neither add nor override any.
 */
@Configuration
public class WebClientConfig {

    @Value("${copilot.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${copilot.http.response-timeout-seconds:30}")
    private int responseTimeoutSeconds;

    @Value("${copilot.http.max-in-memory-mb:16}")
    private int maxInMemoryMb;

    @Bean
    public WebClient connectorWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryMb * 1024 * 1024))
                .build();

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
