package com.taodividends.backend.service;

import com.taodividends.backend.client.PostSearchClient;
import com.taodividends.backend.client.SentimentScorer;
import com.taodividends.backend.client.SocialPost;
import com.taodividends.backend.config.TaoProperties;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class SentimentService {

    private final PostSearchClient postSearchClient;
    private final SentimentScorer sentimentScorer;
    private final Retry tradeStepRetry;
    private final TaoProperties taoProperties;

    public SentimentService(PostSearchClient postSearchClient,
                            SentimentScorer sentimentScorer,
                            @Qualifier("tradeStepRetry") Retry tradeStepRetry,
                            TaoProperties taoProperties) {
        this.postSearchClient = postSearchClient;
        this.sentimentScorer = sentimentScorer;
        this.tradeStepRetry = tradeStepRetry;
        this.taoProperties = taoProperties;
    }

    /**
     * Searches recent posts about the subnet and scores them. Each collaborator call is retried
     * on transient failures; anything else propagates.
     */
    public SentimentResult analyze(int netuid, String hotkey) {
        int maxPosts = taoProperties.getTrade().getMaxPosts();
        List<SocialPost> posts = Retry.decorateSupplier(tradeStepRetry,
                () -> postSearchClient.searchPosts(netuid, maxPosts)).get();
        if (posts.isEmpty()) {
            log.info("No posts found for subnet {}", netuid);
            return new SentimentResult(netuid, hotkey, 0, 0.0, 0, null);
        }
        int raw = Retry.decorateSupplier(tradeStepRetry, () -> sentimentScorer.score(netuid, posts)).get();
        double normalised = raw / 100.0;
        log.info("Sentiment for subnet {} is {} from {} posts", netuid, raw, posts.size());
        return new SentimentResult(netuid, hotkey, raw, normalised, posts.size(), joinTexts(posts));
    }

    private String joinTexts(List<SocialPost> posts) {
        String joined = String.join("\n---\n", posts.stream().map(SocialPost::text).toList());
        return joined.length() > 8000 ? joined.substring(0, 8000) : joined;
    }
}
