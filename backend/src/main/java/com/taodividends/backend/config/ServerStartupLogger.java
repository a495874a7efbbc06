package com.taodividends.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final TaoProperties taoProperties;
    private final ClientProperties clientProperties;
    private final SecurityProperties securityProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        log.info("Server started on port {} (base URL: http://{}:{})", port, host, port);
        log.info("Defaults netuid={} hotkey={}; cache ttl={}; trade lock ttl={} task timeout={}",
                taoProperties.getDefaultNetuid(), taoProperties.getDefaultHotkey(),
                taoProperties.getCache().getTtl(), taoProperties.getTrade().getLockTtl(),
                taoProperties.getTrade().getTaskTimeout());
        log.info("Chain gateway {} (network {})", clientProperties.getChain().getBaseUrl(),
                clientProperties.getChain().getNetwork());
        if (securityProperties.getApiToken() == null || securityProperties.getApiToken().isBlank()) {
            log.warn("API_AUTH_TOKEN is not set; every authenticated endpoint will answer 401");
        }
    }
}
