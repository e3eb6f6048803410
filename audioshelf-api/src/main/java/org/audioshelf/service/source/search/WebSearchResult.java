package org.audioshelf.service.source.search;

/**
 * One organic result. Title and snippet may contain HTML markup.
 */
public record WebSearchResult(String title, String snippet, String url) {
}
