package com.whereq.dispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.dispatch.transport.SearchTransport;
import com.whereq.dispatch.transport.WebClientSearchTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the search REST API
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(DispatchProperties properties) {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(properties.getMaxInMemorySize()));
    }

    @Bean
    public SearchTransport searchTransport(WebClient.Builder webClientBuilder,
                                           DispatchProperties properties,
                                           ObjectMapper objectMapper) {
        WebClient.Builder builder = webClientBuilder.clone();
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
        } else if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(
                properties.getUsername(), properties.getPassword() == null ? "" : properties.getPassword()));
        }
        return new WebClientSearchTransport(builder.build(), objectMapper, properties.getBaseUrl());
    }
}
