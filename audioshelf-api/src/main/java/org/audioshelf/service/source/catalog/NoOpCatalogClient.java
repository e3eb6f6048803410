package org.audioshelf.service.source.catalog;

/**
 * Used when no catalog client is configured: never called by the adapter.
 */
public class NoOpCatalogClient implements CatalogClient {

    @Override
    public CatalogPage search(CatalogQuery query, int page) {
        return CatalogPage.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
