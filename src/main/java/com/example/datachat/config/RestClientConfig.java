package com.example.datachat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClient analysisRestClient(AnalysisProperties props) {
        // Sin baseUrl: el endpoint completo lo normaliza AnalysisEndpoint.
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) props.getTimeout().toMillis());
        return RestClient.builder()
                .requestFactory(factory)
                .build();
    }
}
