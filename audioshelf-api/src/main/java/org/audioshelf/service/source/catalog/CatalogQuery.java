package org.audioshelf.service.source.catalog;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Terms sent to a bibliographic catalog. Author and series are optional.
 */
public record CatalogQuery(String title, String author, String series) {

    /**
     * Case-insensitive identity, used to dedupe narrowing steps and as cache key.
     */
    public String key() {
        StringJoiner joiner = new StringJoiner("|");
        joiner.add(lower(title)).add(lower(author)).add(lower(series));
        return joiner.toString();
    }

    public String describe() {
        StringJoiner joiner = new StringJoiner(" / ");
        joiner.add("title='" + title + "'");
        if (author != null) {
            joiner.add("author='" + author + "'");
        }
        if (series != null) {
            joiner.add("series='" + series + "'");
        }
        return joiner.toString();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
