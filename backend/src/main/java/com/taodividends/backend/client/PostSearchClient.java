package com.taodividends.backend.client;

import java.util.List;

public interface PostSearchClient {

    List<SocialPost> searchPosts(int netuid, int maxResults);
}
