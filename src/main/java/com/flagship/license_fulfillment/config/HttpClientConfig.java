package com.flagship.license_fulfillment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the public blockchain explorers and the price API.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient chainRestClient(FulfillmentProperties properties) {
        FulfillmentProperties.Chain chain = properties.getChain();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) chain.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) chain.getReadTimeout().toMillis());

        return RestClient.builder()
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
