package com.example.autoslides_backend.config;

import com.example.autoslides_backend.engine.Interfaces.TextGenerationEngine;
import com.example.autoslides_backend.engine.OpenAITextGenerationEngine;
import com.example.autoslides_backend.exception.ConfigurationException;
import io.netty.channel.ChannelOption;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(OpenAIScriptProperties.class)
public class ScriptClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("openAiWebClient")
    WebClient openAiWebClient(OpenAIScriptProperties props) {
        String apiKey = props.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("OPENAI_API_KEY is not set (script.openai.api-key)");
        }

        ConnectionProvider provider = ConnectionProvider.builder("openai-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        Duration responseTimeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE);

        LOGGER.info("Configuring OpenAI WebClient baseUrl={} model={} connect={}ms response={}s maxRetries={} maxConn={}",
                props.getBaseUrl(), props.getModel(), CONNECT_TIMEOUT_MILLIS,
                responseTimeout.toSeconds(), props.getMaxRetries(), MAX_CONNECTIONS);

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    @Bean
    TextGenerationEngine textGenerationEngine(
            OpenAIScriptProperties props,
            @Qualifier("openAiWebClient") WebClient openAiWebClient
    ) {
        return new OpenAITextGenerationEngine(openAiWebClient, props);
    }
}
