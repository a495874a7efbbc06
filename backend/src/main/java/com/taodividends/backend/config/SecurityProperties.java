package com.taodividends.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tao.security")
@Data
public class SecurityProperties {

    private String apiToken;
    private Cors cors = new Cors();

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private List<String> allowedMethods = List.of("GET", "POST", "DELETE", "OPTIONS");
    }
}
