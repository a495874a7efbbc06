package com.taodividends.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ClientHttpConfig {

    @Bean
    public RestTemplate chainRestTemplate(ClientProperties clientProperties) {
        ClientProperties.Chain chain = clientProperties.getChain();
        return restTemplate(chain.getConnectTimeoutMs(), chain.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate searchRestTemplate(ClientProperties clientProperties) {
        ClientProperties.Search search = clientProperties.getSearch();
        return restTemplate(search.getConnectTimeoutMs(), search.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate llmRestTemplate(ClientProperties clientProperties) {
        ClientProperties.Llm llm = clientProperties.getLlm();
        return restTemplate(llm.getConnectTimeoutMs(), llm.getReadTimeoutMs());
    }

    private RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
