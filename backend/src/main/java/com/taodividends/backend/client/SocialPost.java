package com.taodividends.backend.client;

/**
 * A post about a subnet together with the engagement signals the scorer weighs.
 */
public record SocialPost(
        String id,
        String text,
        String url,
        String createdAt,
        String authorUsername,
        long authorFollowers,
        boolean authorVerified,
        long likeCount,
        long retweetCount,
        long replyCount,
        long quoteCount,
        long bookmarkCount
) {
}
