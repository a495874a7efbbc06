package com.taodividends.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.taodividends.backend.config.ClientProperties;
import com.taodividends.backend.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post search through the Datura Twitter endpoint.
 */
@Slf4j
@Component
public class DaturaPostSearchClient implements PostSearchClient {

    private static final String COLLABORATOR = "Datura";

    private final RestTemplate restTemplate;
    private final ClientProperties.Search properties;

    public DaturaPostSearchClient(@Qualifier("searchRestTemplate") RestTemplate restTemplate,
                                  ClientProperties clientProperties) {
        this.restTemplate = restTemplate;
        this.properties = clientProperties.getSearch();
    }

    @Override
    public List<SocialPost> searchPosts(int netuid, int maxResults) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", "Bittensor netuid " + netuid);
        payload.put("blue_verified", false);
        payload.put("lang", "en");
        payload.put("sort", "Latest");
        payload.put("count", maxResults);

        HttpHeaders headers = new HttpHeaders();
        // Datura expects the bare key, not a bearer token.
        headers.set(HttpHeaders.AUTHORIZATION, properties.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        log.info("Searching posts about subnet {}", netuid);
        JsonNode body;
        try {
            body = restTemplate.exchange(properties.getBaseUrl() + "/twitter", HttpMethod.POST,
                    new HttpEntity<>(payload, headers), JsonNode.class).getBody();
        } catch (RestClientException e) {
            throw HttpFailures.translate(COLLABORATOR, e);
        }
        if (body == null || !body.isArray()) {
            throw new ExternalApiException(COLLABORATOR + " search returned a non-list response");
        }

        List<SocialPost> posts = new ArrayList<>();
        for (JsonNode node : body) {
            SocialPost post = toPost(node);
            if (post != null) {
                posts.add(post);
            }
        }
        log.info("Found {} posts about subnet {}", posts.size(), netuid);
        return posts;
    }

    private SocialPost toPost(JsonNode node) {
        if (node == null || !node.isObject()) {
            log.warn("Skipping malformed post entry: {}", node);
            return null;
        }
        String text = node.path("text").asText("");
        if (text.isBlank()) {
            log.warn("Skipping post {} without text", node.path("id").asText(""));
            return null;
        }
        JsonNode user = node.path("user");
        return new SocialPost(
                node.path("id").asText(""),
                text,
                node.path("url").asText(""),
                node.path("created_at").asText(""),
                user.path("username").asText(""),
                user.path("followers_count").asLong(0),
                user.path("verified").asBoolean(false) || user.path("is_blue_verified").asBoolean(false),
                node.path("like_count").asLong(0),
                node.path("retweet_count").asLong(0),
                node.path("reply_count").asLong(0),
                node.path("quote_count").asLong(0),
                node.path("bookmark_count").asLong(0));
    }
}
