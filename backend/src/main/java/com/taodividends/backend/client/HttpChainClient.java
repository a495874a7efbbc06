package com.taodividends.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.taodividends.backend.config.ClientProperties;
import com.taodividends.backend.exception.ExternalApiException;
import com.taodividends.backend.exception.StakeRejectedException;
import com.taodividends.backend.exception.UpstreamUnavailableException;
import com.taodividends.backend.model.StakeDirection;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON client for the chain gateway. Every call passes through the chain circuit breaker;
 * retries are applied by the callers, which know how long they can afford to wait.
 */
@Slf4j
@Component
public class HttpChainClient implements ChainClient {

    private static final String COLLABORATOR = "Chain gateway";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final ClientProperties.Chain properties;

    public HttpChainClient(@Qualifier("chainRestTemplate") RestTemplate restTemplate,
                           @Qualifier("chainCircuitBreaker") CircuitBreaker circuitBreaker,
                           ClientProperties clientProperties) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.properties = clientProperties.getChain();
    }

    @Override
    public BigInteger fetchDividend(int netuid, String hotkey) {
        JsonNode body = guarded(() -> exchange(HttpMethod.GET,
                "/subnets/" + netuid + "/dividends/" + hotkey, null, null));
        JsonNode dividend = body == null ? null : body.get("dividend");
        if (dividend == null || dividend.isNull()) {
            throw new ExternalApiException(COLLABORATOR + " response missing dividend for " + netuid + ":" + hotkey);
        }
        try {
            return dividend.isNumber() ? dividend.bigIntegerValue() : new BigInteger(dividend.asText().trim());
        } catch (NumberFormatException e) {
            throw new ExternalApiException(COLLABORATOR + " returned a non-integer dividend: " + dividend.asText(), e);
        }
    }

    @Override
    public List<String> listHotkeys(int netuid) {
        JsonNode body = guarded(() -> exchange(HttpMethod.GET, "/subnets/" + netuid + "/hotkeys", null, null));
        JsonNode hotkeys = body == null ? null : body.get("hotkeys");
        if (hotkeys == null || !hotkeys.isArray()) {
            throw new ExternalApiException(COLLABORATOR + " response missing hotkeys for subnet " + netuid);
        }
        List<String> result = new ArrayList<>();
        hotkeys.forEach(node -> result.add(node.asText()));
        return result;
    }

    @Override
    public StakeReceipt submit(StakeDirection direction, int netuid, String hotkey, BigDecimal amount,
                               String idempotencyKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("netuid", netuid);
        payload.put("hotkey", hotkey);
        payload.put("amount", amount);
        payload.put("network", properties.getNetwork());

        JsonNode body = guarded(() -> {
            try {
                return exchange(HttpMethod.POST, "/" + direction.pathSegment(), payload, idempotencyKey);
            } catch (ExternalApiException e) {
                // A 4xx on a stake call is the gateway refusing the operation.
                throw new StakeRejectedException(e.getMessage(), e);
            }
        });
        if (body == null || !body.path("success").asBoolean(false)) {
            String error = body == null ? "empty response" : body.path("error").asText("operation rejected");
            throw new StakeRejectedException(direction.pathSegment() + " rejected: " + error);
        }
        String txHash = body.path("tx_hash").asText(null);
        log.info("Chain {} accepted netuid={} hotkey={} amount={} txHash={}",
                direction.pathSegment(), netuid, hotkey, amount, txHash);
        return new StakeReceipt(txHash);
    }

    private JsonNode exchange(HttpMethod method, String path, Object payload, String idempotencyKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        if (payload != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (idempotencyKey != null) {
            headers.set("Idempotency-Key", idempotencyKey);
        }
        try {
            return restTemplate.exchange(properties.getBaseUrl() + path, method, new HttpEntity<>(payload, headers),
                    JsonNode.class).getBody();
        } catch (HttpClientErrorException.NotFound e) {
            throw new ExternalApiException(COLLABORATOR + " has no resource at " + path, 404, e);
        } catch (RestClientException e) {
            throw HttpFailures.translate(COLLABORATOR, e);
        }
    }

    private JsonNode guarded(Supplier<JsonNode> call) {
        try {
            return CircuitBreaker.decorateSupplier(circuitBreaker, call).get();
        } catch (CallNotPermittedException e) {
            throw new UpstreamUnavailableException(COLLABORATOR + " circuit open", e);
        }
    }
}
