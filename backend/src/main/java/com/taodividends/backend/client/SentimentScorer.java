package com.taodividends.backend.client;

import java.util.List;

public interface SentimentScorer {

    /**
     * @return overall sentiment of {@code posts} on the integer scale [-100, 100]
     */
    int score(int netuid, List<SocialPost> posts);
}
