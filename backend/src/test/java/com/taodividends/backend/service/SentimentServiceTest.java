package com.taodividends.backend.service;

import com.taodividends.backend.client.PostSearchClient;
import com.taodividends.backend.client.SentimentScorer;
import com.taodividends.backend.client.SocialPost;
import com.taodividends.backend.config.TaoProperties;
import com.taodividends.backend.exception.ExternalApiException;
import com.taodividends.backend.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SentimentServiceTest {

    private PostSearchClient postSearchClient;
    private SentimentScorer sentimentScorer;
    private SentimentService service;

    @BeforeEach
    void setUp() {
        postSearchClient = mock(PostSearchClient.class);
        sentimentScorer = mock(SentimentScorer.class);
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(UpstreamUnavailableException.class)
                .build());
        service = new SentimentService(postSearchClient, sentimentScorer, retry, new TaoProperties());
    }

    @Test
    void scoresPostsAndNormalises() {
        List<SocialPost> posts = List.of(post("1", "subnet 18 is great"), post("2", "agreed"));
        when(postSearchClient.searchPosts(18, 10)).thenReturn(posts);
        when(sentimentScorer.score(18, posts)).thenReturn(-60);

        SentimentResult result = service.analyze(18, "H1");

        assertThat(result.rawScore()).isEqualTo(-60);
        assertThat(result.score()).isEqualTo(-0.6);
        assertThat(result.postsCount()).isEqualTo(2);
        assertThat(result.postsText()).isEqualTo("subnet 18 is great\n---\nagreed");
        assertThat(result.hasData()).isTrue();
    }

    @Test
    void noPostsMeansNoData() {
        when(postSearchClient.searchPosts(18, 10)).thenReturn(List.of());

        SentimentResult result = service.analyze(18, "H1");

        assertThat(result.hasData()).isFalse();
        verify(sentimentScorer, never()).score(anyInt(), any());
    }

    @Test
    void transientSearchFailureIsRetried() {
        List<SocialPost> posts = List.of(post("1", "hello"));
        when(postSearchClient.searchPosts(18, 10))
                .thenThrow(new UpstreamUnavailableException("rate limited"))
                .thenReturn(posts);
        when(sentimentScorer.score(18, posts)).thenReturn(10);

        assertThat(service.analyze(18, "H1").rawScore()).isEqualTo(10);
        verify(postSearchClient, times(2)).searchPosts(18, 10);
    }

    @Test
    void permanentScorerFailurePropagates() {
        List<SocialPost> posts = List.of(post("1", "hello"));
        when(postSearchClient.searchPosts(18, 10)).thenReturn(posts);
        when(sentimentScorer.score(18, posts)).thenThrow(new ExternalApiException("bad key", 401, null));

        assertThatThrownBy(() -> service.analyze(18, "H1")).isInstanceOf(ExternalApiException.class);
        verify(sentimentScorer, times(1)).score(18, posts);
    }

    private static SocialPost post(String id, String text) {
        return new SocialPost(id, text, "", "", "alice", 10, false, 1, 0, 0, 0, 0);
    }
}
