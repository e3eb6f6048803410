package org.audioshelf.service.source.catalog;

import java.util.List;

public record CatalogPage(List<CatalogHit> hits, boolean hasMore) {

    public static CatalogPage empty() {
        return new CatalogPage(List.of(), false);
    }
}
