package com.taodividends.backend.service;

/**
 * @param rawScore   scorer output on [-100, 100]
 * @param score      rawScore normalised to [-1, 1]
 * @param postsCount number of posts scored; 0 means no data, not neutral sentiment
 */
public record SentimentResult(int netuid, String hotkey, int rawScore, double score, int postsCount, String postsText) {

    public boolean hasData() {
        return postsCount > 0;
    }
}
