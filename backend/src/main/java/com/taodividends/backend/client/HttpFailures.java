package com.taodividends.backend.client;

import com.taodividends.backend.exception.ExternalApiException;
import com.taodividends.backend.exception.UpstreamUnavailableException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Maps RestTemplate failures onto the retryable / non-retryable split the callers rely on.
 */
final class HttpFailures {

    private HttpFailures() {
    }

    static RuntimeException translate(String collaborator, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new UpstreamUnavailableException(collaborator + " unreachable: " + e.getMessage(), e);
        }
        if (e instanceof HttpServerErrorException server) {
            return new UpstreamUnavailableException(
                    collaborator + " server error (" + server.getStatusCode().value() + ")", e);
        }
        if (e instanceof HttpClientErrorException.TooManyRequests) {
            return new UpstreamUnavailableException(collaborator + " rate limited", e);
        }
        if (e instanceof HttpClientErrorException client) {
            return new ExternalApiException(
                    collaborator + " API error (" + client.getStatusCode().value() + "): " + client.getResponseBodyAsString(),
                    client.getStatusCode().value(), e);
        }
        return new ExternalApiException(collaborator + " returned an unusable response: " + e.getMessage(), e);
    }
}
