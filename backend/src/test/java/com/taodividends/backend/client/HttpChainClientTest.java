package com.taodividends.backend.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.taodividends.backend.config.ClientProperties;
import com.taodividends.backend.exception.ExternalApiException;
import com.taodividends.backend.exception.StakeRejectedException;
import com.taodividends.backend.exception.UpstreamUnavailableException;
import com.taodividends.backend.model.StakeDirection;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpChainClientTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    private HttpChainClient client;

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        ClientProperties properties = new ClientProperties();
        properties.getChain().setBaseUrl(wireMock.baseUrl() + "/api");
        properties.getChain().setApiKey("chain-key");
        client = new HttpChainClient(new RestTemplate(), CircuitBreaker.ofDefaults("chain-test"), properties);
    }

    @Test
    void fetchDividendReadsNumericValue() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/dividends/H1"))
                .withHeader("Authorization", equalTo("Bearer chain-key"))
                .willReturn(json(200, "{\"netuid\":18,\"hotkey\":\"H1\",\"dividend\":123456789}")));

        assertThat(client.fetchDividend(18, "H1")).isEqualTo(BigInteger.valueOf(123456789));
    }

    @Test
    void fetchDividendAcceptsDecimalStringBeyondLongRange() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/dividends/H1"))
                .willReturn(json(200, "{\"dividend\":\"340282366920938463463374607431768211456\"}")));

        assertThat(client.fetchDividend(18, "H1"))
                .isEqualTo(new BigInteger("340282366920938463463374607431768211456"));
    }

    @Test
    void serverErrorIsTransient() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/dividends/H1")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.fetchDividend(18, "H1")).isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void unknownHotkeyIsNotTransient() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/dividends/H1")).willReturn(aResponse().withStatus(404)));

        assertThatThrownBy(() -> client.fetchDividend(18, "H1"))
                .isInstanceOf(ExternalApiException.class)
                .extracting(e -> ((ExternalApiException) e).getStatusCode())
                .isEqualTo(404);
    }

    @Test
    void missingDividendFieldIsRejected() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/dividends/H1")).willReturn(json(200, "{}")));

        assertThatThrownBy(() -> client.fetchDividend(18, "H1")).isInstanceOf(ExternalApiException.class);
    }

    @Test
    void listHotkeysReadsArray() {
        wireMock.stubFor(get(urlEqualTo("/api/subnets/18/hotkeys"))
                .willReturn(json(200, "{\"hotkeys\":[\"H1\",\"H2\"]}")));

        assertThat(client.listHotkeys(18)).containsExactly("H1", "H2");
    }

    @Test
    void unstakePostsWithIdempotencyKey() {
        wireMock.stubFor(post(urlEqualTo("/api/unstake"))
                .withHeader("Idempotency-Key", equalTo("task-1"))
                .willReturn(json(200, "{\"success\":true,\"tx_hash\":\"0xabc\"}")));

        StakeReceipt receipt = client.submit(StakeDirection.UNSTAKE, 18, "H1", new BigDecimal("0.600000000"), "task-1");

        assertThat(receipt.txHash()).isEqualTo("0xabc");
        wireMock.verify(postRequestedFor(urlEqualTo("/api/unstake"))
                .withRequestBody(matchingJsonPath("$.hotkey", equalTo("H1")))
                .withRequestBody(matchingJsonPath("$.netuid", equalTo("18")))
                .withRequestBody(matchingJsonPath("$.network", equalTo("test"))));
    }

    @Test
    void unsuccessfulSubmissionIsRejected() {
        wireMock.stubFor(post(urlEqualTo("/api/stake"))
                .willReturn(json(200, "{\"success\":false,\"error\":\"insufficient balance\"}")));

        assertThatThrownBy(() -> client.submit(StakeDirection.STAKE, 18, "H1", BigDecimal.ONE, "task-1"))
                .isInstanceOf(StakeRejectedException.class)
                .hasMessageContaining("insufficient balance");
    }

    @Test
    void clientErrorOnSubmissionIsRejection() {
        wireMock.stubFor(post(urlEqualTo("/api/stake")).willReturn(json(400, "{\"error\":\"bad amount\"}")));

        assertThatThrownBy(() -> client.submit(StakeDirection.STAKE, 18, "H1", BigDecimal.ONE, "task-1"))
                .isInstanceOf(StakeRejectedException.class);
    }

    @Test
    void serverErrorOnSubmissionStaysTransient() {
        wireMock.stubFor(post(urlEqualTo("/api/stake")).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(() -> client.submit(StakeDirection.STAKE, 18, "H1", BigDecimal.ONE, "task-1"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void openCircuitFailsFast() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("open-test");
        breaker.transitionToOpenState();
        ClientProperties properties = new ClientProperties();
        properties.getChain().setBaseUrl(wireMock.baseUrl() + "/api");
        HttpChainClient openClient = new HttpChainClient(new RestTemplate(), breaker, properties);

        assertThatThrownBy(() -> openClient.fetchDividend(18, "H1")).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(wireMock.getAllServeEvents()).isEmpty();
    }

    private static com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder json(int status, String body) {
        return aResponse().withStatus(status).withHeader("Content-Type", "application/json").withBody(body);
    }
}
