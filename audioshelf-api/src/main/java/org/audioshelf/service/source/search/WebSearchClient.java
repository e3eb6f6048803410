package org.audioshelf.service.source.search;

import org.audioshelf.exception.SourceUnavailableException;

import java.util.List;

public interface WebSearchClient {

    List<WebSearchResult> search(String query, int maxResults) throws SourceUnavailableException;

    default boolean isAvailable() {
        return true;
    }
}
