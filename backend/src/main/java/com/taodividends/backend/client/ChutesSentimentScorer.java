package com.taodividends.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.taodividends.backend.config.ClientProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scores posts with an LLM behind an OpenAI-style chat completions endpoint (Chutes).
 * A reply that is not an integer scores 0.
 */
@Slf4j
@Component
public class ChutesSentimentScorer implements SentimentScorer {

    static final int MAX_SCORE = 100;

    private static final String COLLABORATOR = "Chutes";

    private final RestTemplate restTemplate;
    private final ClientProperties.Llm properties;

    public ChutesSentimentScorer(@Qualifier("llmRestTemplate") RestTemplate restTemplate,
                                 ClientProperties clientProperties) {
        this.restTemplate = restTemplate;
        this.properties = clientProperties.getLlm();
    }

    @Override
    public int score(int netuid, List<SocialPost> posts) {
        if (posts.isEmpty()) {
            return 0;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", properties.getModel());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt(netuid)),
                Map.of("role", "user", "content", describe(posts))));
        payload.put("max_tokens", properties.getMaxTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        JsonNode body;
        try {
            body = restTemplate.exchange(properties.getBaseUrl() + "/completions", HttpMethod.POST,
                    new HttpEntity<>(payload, headers), JsonNode.class).getBody();
        } catch (RestClientException e) {
            throw HttpFailures.translate(COLLABORATOR, e);
        }
        String completion = body == null ? "0"
                : body.path("choices").path(0).path("message").path("content").asText("0");
        return parseScore(completion);
    }

    static int parseScore(String completion) {
        String trimmed = completion == null ? "" : completion.trim();
        if (trimmed.startsWith("+")) {
            trimmed = trimmed.substring(1);
        }
        int score;
        try {
            score = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse sentiment score: '{}'", completion);
            return 0;
        }
        return Math.max(-MAX_SCORE, Math.min(MAX_SCORE, score));
    }

    static String describe(List<SocialPost> posts) {
        return posts.stream()
                .map(ChutesSentimentScorer::describe)
                .collect(Collectors.joining("\n\n"));
    }

    private static String describe(SocialPost post) {
        String author = "@" + post.authorUsername() + (post.authorVerified() ? " (verified)" : "");
        return "Post by " + author + " (" + post.authorFollowers() + " followers):\n"
                + post.text() + "\n"
                + "[Engagement: " + post.likeCount() + " likes, "
                + post.retweetCount() + " retweets, "
                + post.replyCount() + " replies, "
                + post.quoteCount() + " quotes, "
                + post.bookmarkCount() + " bookmarks]\n";
    }

    private static String systemPrompt(int netuid) {
        return "Analyze the sentiment of these posts about Bittensor subnet " + netuid + ". "
                + "Rate the overall sentiment on a scale from -100 (extremely negative) to +100 (extremely positive). "
                + "Consider both the content of the posts and their engagement metrics; posts with higher "
                + "engagement should be weighted more heavily. "
                + "Your response must be ONLY a single integer between -100 and +100, with no explanation "
                + "or additional text of any kind. For example: 42 or -87";
    }
}
