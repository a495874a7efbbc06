package com.taodividends.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Endpoints and credentials of the external collaborators: the chain gateway that
 * owns the wallet, the post search API and the LLM used for sentiment scoring.
 */
@Configuration
@ConfigurationProperties(prefix = "clients")
@Data
@Validated
public class ClientProperties {

    private Chain chain = new Chain();
    private Search search = new Search();
    private Llm llm = new Llm();

    @Data
    public static class Chain {
        @NotBlank
        private String baseUrl = "http://localhost:9944/api";
        private String apiKey = "";
        private String network = "test";
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 15000;
    }

    @Data
    public static class Search {
        @NotBlank
        private String baseUrl = "https://apis.datura.ai";
        private String apiKey = "";
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 20000;
    }

    @Data
    public static class Llm {
        @NotBlank
        private String baseUrl = "https://llm.chutes.ai/v1/chat";
        private String apiKey = "";
        @NotBlank
        private String model = "unsloth/Llama-3.2-3B-Instruct";
        @Min(1)
        private int maxTokens = 10;
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 30000;
    }
}
