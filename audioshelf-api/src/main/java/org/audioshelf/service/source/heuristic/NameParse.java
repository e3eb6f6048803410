package org.audioshelf.service.source.heuristic;

/**
 * What one piece of name or tag text reveals. Any part may be {@code null}.
 */
public record NameParse(String series, Integer index, String title) {

    public boolean hasSeries() {
        return series != null;
    }
}
