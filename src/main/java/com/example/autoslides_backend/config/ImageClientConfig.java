package com.example.autoslides_backend.config;

import com.example.autoslides_backend.engine.Interfaces.ImageSearchEngine;
import com.example.autoslides_backend.engine.UnsplashImageSearchEngine;
import com.example.autoslides_backend.exception.ConfigurationException;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(UnsplashProperties.class)
public class ImageClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageClientConfig.class);

    /** Image bytes can be a few megabytes; search JSON stays well below this. */
    static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean("unsplashWebClient")
    public WebClient unsplashWebClient(WebClient.Builder builder, UnsplashProperties props) {
        String accessKey = props.getAccessKey();
        if (accessKey == null || accessKey.isBlank()) {
            throw new ConfigurationException("UNSPLASH_ACCESS_KEY is not set (images.unsplash.access-key)");
        }
        HttpClient http = HttpClient.create()
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));

        LOGGER.info("Configuring Unsplash WebClient baseUrl={} timeout={}s maxRetries={} perPage={}",
                props.getBaseUrl(), props.getTimeoutSeconds(), props.getMaxRetries(), props.getMaxPerPage());

        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .defaultHeader("Accept-Version", "v1")
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Client-ID " + accessKey.trim())
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    @Bean("imageDownloadWebClient")
    public WebClient imageDownloadWebClient(WebClient.Builder builder, UnsplashProperties props) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "image/*")
                .build();
    }

    @Bean
    ImageSearchEngine imageSearchEngine(
            UnsplashProperties props,
            @Qualifier("unsplashWebClient") WebClient unsplashWebClient
    ) {
        return new UnsplashImageSearchEngine(unsplashWebClient, props);
    }
}
