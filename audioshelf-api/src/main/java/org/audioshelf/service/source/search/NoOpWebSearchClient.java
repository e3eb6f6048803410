package org.audioshelf.service.source.search;

import java.util.List;

public class NoOpWebSearchClient implements WebSearchClient {

    @Override
    public List<WebSearchResult> search(String query, int maxResults) {
        return List.of();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
