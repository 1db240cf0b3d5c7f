package com.niigaki.billing.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AsaasClientConfig {

    public static final String ACCESS_TOKEN_HEADER = "access_token";

    @Bean
    public RestClient asaasRestClient(RestClient.Builder builder, AsaasProperties asaasProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(asaasProperties.getTimeout());
        requestFactory.setReadTimeout(asaasProperties.getTimeout());

        return builder
                .baseUrl(asaasProperties.resolveApiBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(ACCESS_TOKEN_HEADER, asaasProperties.getApiKey() == null ? "" : asaasProperties.getApiKey())
                .build();
    }
}
